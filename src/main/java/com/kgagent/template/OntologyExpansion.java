package com.kgagent.template;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * MONDO identifier handling: normalizes CURIEs to OBO IRIs and builds the Ubergraph
 * sub-query that expands a set of disease roots to all their subclasses.
 */
public final class OntologyExpansion {

    public static final String OBO_PREFIX = "http://purl.obolibrary.org/obo/";
    static final String DEFAULT_UBERGRAPH_ENDPOINT = "https://frink.apps.renci.org/ubergraph/sparql";

    private static final Pattern MONDO_CURIE = Pattern.compile("^MONDO[:_](\\d+)$", Pattern.CASE_INSENSITIVE);

    private OntologyExpansion() {
    }

    /**
     * Maps {@code MONDO:0005148}, {@code MONDO_0005148} and full IRIs to IRIs; other values are dropped.
     */
    public static List<String> toIris(List<String> values) {
        return values.stream()
                .map(String::trim)
                .map(OntologyExpansion::toIri)
                .filter(iri -> iri != null)
                .distinct()
                .toList();
    }

    static String toIri(String value) {
        if (value.startsWith("http://") || value.startsWith("https://")) {
            return value;
        }
        if (value.startsWith("<") && value.endsWith(">")) {
            return value.substring(1, value.length() - 1);
        }
        Matcher matcher = MONDO_CURIE.matcher(value);
        return matcher.matches() ? OBO_PREFIX + "MONDO_" + matcher.group(1) : null;
    }

    /**
     * Binds {@code ?variable} to every subclass (reflexively) of the given roots, evaluated remotely.
     */
    public static String descendantsPattern(String variable, List<String> rootIris, String ubergraphEndpoint) {
        String roots = rootIris.stream().map(SparqlFragments::iri).collect(Collectors.joining(" "));
        return "  SERVICE " + SparqlFragments.iri(ubergraphEndpoint) + " {\n"
                + "    VALUES ?root { " + roots + " }\n"
                + "    ?" + variable + " rdfs:subClassOf* ?root .\n"
                + "  }\n";
    }
}
