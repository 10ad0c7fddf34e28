package com.kgagent.template;

import com.kgagent.exception.TemplateCompilationException;
import com.kgagent.model.ContextPack;
import com.kgagent.model.Intent;
import com.kgagent.model.RdfTerm;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Shared pieces for building SPARQL text: escaping, IRIs, {@code FROM} scopes and limits.
 */
public final class SparqlFragments {

    public static final String PREFIX_BIOLINK = "PREFIX biolink:      <https://w3id.org/biolink/vocab/>\n";
    public static final String PREFIX_SPOKEGENELAB = "PREFIX spokegenelab: <https://spoke.ucsf.edu/genelab/>\n";
    public static final String PREFIX_SCHEMA = "PREFIX schema: <http://schema.org/>\n";
    public static final String PREFIX_RDFS = "PREFIX rdfs: <http://www.w3.org/2000/01/rdf-schema#>\n";
    public static final String PREFIX_WDT = "PREFIX wdt: <http://www.wikidata.org/prop/direct/>\n";

    /**
     * Extracts the experiment accession from a GXA contrast IRI.
     */
    static final String BIND_EXPERIMENT_ID =
            "BIND(REPLACE(STR(?contrast), \"^.*/(E-[A-Z0-9-]+)-.*$\", \"$1\") AS ?experimentId)";

    private static final String REGEX_SPECIALS = ".*+?^${}()|[]\\";

    /**
     * Characters an IRIREF may not contain: controls, space and {@code <>"{}|^`\}.
     */
    private static final Pattern IRI_FORBIDDEN = Pattern.compile("[\\x00-\\x20<>\"{}|^`\\\\]");

    private static final Pattern LANG_TAG = Pattern.compile("[a-zA-Z]+(-[a-zA-Z0-9]+)*");

    private SparqlFragments() {
    }

    /**
     * Escapes a value for use inside a double-quoted SPARQL string literal.
     */
    public static String escapeLiteral(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (char c : value.toCharArray()) {
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    public static String literal(String value) {
        return "\"" + escapeLiteral(value) + "\"";
    }

    /**
     * Wraps an IRI in angle brackets.
     *
     * @throws TemplateCompilationException if the value is empty or holds a character an IRIREF
     *         cannot carry
     */
    public static String iri(String value) {
        if (value == null || value.isEmpty() || IRI_FORBIDDEN.matcher(value).find()) {
            throw new TemplateCompilationException("Not a valid IRI for a SPARQL query: '" + value + "'");
        }
        return "<" + value + ">";
    }

    /**
     * Writes a bound RDF term back as SPARQL. Literals keep their language tag or datatype.
     * Blank nodes are rejected since their labels mean nothing outside the result they came from.
     */
    public static String term(RdfTerm term) {
        if (term.isUri()) {
            return iri(term.getValue());
        }
        if ("bnode".equals(term.getType())) {
            throw new TemplateCompilationException(
                    "Blank node '_:" + term.getValue() + "' cannot be substituted into another query");
        }
        String lexical = literal(term.getValue());
        String lang = term.getLang();
        if (lang != null && !lang.isEmpty()) {
            if (!LANG_TAG.matcher(lang).matches()) {
                throw new TemplateCompilationException("Not a valid language tag: '" + lang + "'");
            }
            return lexical + "@" + lang;
        }
        String datatype = term.getDatatype();
        if (datatype != null && !datatype.isEmpty()) {
            return lexical + "^^" + iri(datatype);
        }
        return lexical;
    }

    /**
     * Escapes regex metacharacters so a term matches literally inside {@code REGEX()}.
     */
    public static String escapeRegex(String term) {
        StringBuilder sb = new StringBuilder();
        for (char c : term.toCharArray()) {
            if (REGEX_SPECIALS.indexOf(c) >= 0) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * One {@code FROM <iri>} line per graph of the intent.
     */
    public static String fromClauses(Intent intent, ContextPack pack) {
        return intent.getGraphs().stream()
                .map(graph -> "FROM " + iri(pack.requireGraph(graph).getIri()) + "\n")
                .collect(Collectors.joining());
    }

    /**
     * Resolves the row limit: the {@code limit} slot or {@code defaultLimit}, capped by the pack's
     * guardrails and by the template's own {@code cap}.
     */
    public static int limit(Intent intent, ContextPack pack, Integer defaultLimit, int cap) {
        Integer requested = parseInteger(intent.slotAsString("limit"));
        return Math.min(pack.capLimit(requested != null ? requested : defaultLimit), cap);
    }

    public static Integer parseInteger(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Reads a slot as a list of terms. Scalar values are split on commas and whitespace.
     */
    public static List<String> splitTerms(Intent intent, String slot) {
        if (!intent.hasSlot(slot)) {
            return List.of();
        }
        List<String> raw = intent.getSlot(slot).isList()
                ? intent.slotAsList(slot)
                : Arrays.asList(intent.slotAsString(slot).split("[,\\s]+"));
        return raw.stream().map(String::trim).filter(s -> !s.isEmpty()).distinct().toList();
    }

    /**
     * @return {@code "up"}, {@code "down"} or null for no direction constraint.
     */
    public static String direction(Intent intent) {
        String direction = intent.slotAsString("direction");
        if (direction == null) {
            return null;
        }
        return switch (direction.trim().toLowerCase()) {
            case "up", "upregulated" -> "up";
            case "down", "downregulated" -> "down";
            default -> null;
        };
    }

    /**
     * Optional {@code ?log2fc} sign filter for the given direction.
     */
    static String log2fcFilter(String direction) {
        if ("up".equals(direction)) {
            return "\n  FILTER(?log2fc > 0)";
        }
        if ("down".equals(direction)) {
            return "\n  FILTER(?log2fc < 0)";
        }
        return "";
    }
}
