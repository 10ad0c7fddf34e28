package com.kgagent.template;

import static com.kgagent.template.SparqlFragments.literal;

import com.kgagent.exception.TemplateCompilationException;
import com.kgagent.model.ContextPack;
import com.kgagent.model.Intent;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * NDE dataset search by health condition (MONDO IRIs, optionally expanded to descendants) or by
 * keyword regex over name and description. The GEO variant keeps only GSE accessions.
 */
public class DatasetSearchTemplate implements SparqlTemplate {

    static final int CAP = 500;

    private static final Set<String> KEYWORD_STOPWORDS = Set.of(
            "find", "show", "list", "search", "get", "give", "me", "all", "any", "the", "a", "an", "of",
            "for", "on", "in", "about", "related", "to", "with", "and", "or", "that", "which", "what",
            "are", "is", "there", "dataset", "datasets", "data", "study", "studies");

    private final boolean geoOnly;

    public DatasetSearchTemplate(boolean geoOnly) {
        this.geoOnly = geoOnly;
    }

    @Override
    public String render(Intent intent, ContextPack pack) {
        int limit = SparqlFragments.limit(intent, pack, null, CAP);

        StringBuilder where = new StringBuilder();
        if (intent.hasSlot("health_conditions")) {
            appendConditionPattern(where, intent, pack);
        } else {
            appendKeywordPattern(where, intent);
        }
        if (intent.hasSlot("organism")) {
            where.append("  ?dataset schema:species ?species .\n")
                    .append("  ?species schema:name ?speciesName .\n")
                    .append("  FILTER(CONTAINS(LCASE(STR(?speciesName)), ")
                    .append(literal(intent.slotAsString("organism").trim().toLowerCase()))
                    .append("))\n");
        }
        if (geoOnly) {
            where.append("  FILTER(BOUND(?identifier) && STRSTARTS(STR(?identifier), \"GSE\"))\n");
        }

        String select = intent.hasSlot("health_conditions")
                ? "SELECT DISTINCT ?dataset ?name ?description ?identifier ?condition ?conditionName\n"
                : "SELECT DISTINCT ?dataset ?name ?description ?identifier\n";

        return SparqlFragments.PREFIX_SCHEMA
                + SparqlFragments.PREFIX_RDFS
                + "\n"
                + select
                + SparqlFragments.fromClauses(intent, pack)
                + "WHERE {\n"
                + where
                + "}\n"
                + "LIMIT " + limit;
    }

    private void appendConditionPattern(StringBuilder where, Intent intent, ContextPack pack) {
        List<String> iris = OntologyExpansion.toIris(intent.slotAsList("health_conditions"));
        if (iris.isEmpty()) {
            throw new TemplateCompilationException(
                    "Slot 'health_conditions' must hold MONDO IRIs or CURIEs for template '" + intent.getTask() + "'");
        }
        boolean expand = !"false".equalsIgnoreCase(intent.slotAsString("expand_descendants"));
        if (expand) {
            String ubergraph = pack.getGraphs().containsKey("ubergraph")
                    ? pack.getGraphs().get("ubergraph").getEndpoint()
                    : OntologyExpansion.DEFAULT_UBERGRAPH_ENDPOINT;
            where.append(OntologyExpansion.descendantsPattern("condition", iris, ubergraph));
        } else {
            where.append("  VALUES ?condition { ")
                    .append(iris.stream().map(SparqlFragments::iri).collect(Collectors.joining(" ")))
                    .append(" }\n");
        }
        where.append("  ?dataset a schema:Dataset ;\n")
                .append("           schema:name ?name ;\n")
                .append("           schema:healthCondition ?condition .\n")
                .append("  OPTIONAL { ?condition schema:name ?conditionName }\n")
                .append("  OPTIONAL { ?dataset schema:description ?description }\n")
                .append("  OPTIONAL { ?dataset schema:identifier ?identifier }\n");
    }

    private void appendKeywordPattern(StringBuilder where, Intent intent) {
        String pattern = literal(keywordRegex(intent));
        where.append("  ?dataset a schema:Dataset ;\n")
                .append("           schema:name ?name .\n")
                .append("  OPTIONAL { ?dataset schema:description ?description }\n")
                .append("  OPTIONAL { ?dataset schema:identifier ?identifier }\n")
                .append("  FILTER(\n")
                .append("    REGEX(STR(?name), ").append(pattern).append(", \"i\")\n")
                .append("    || (BOUND(?description) && REGEX(STR(?description), ").append(pattern).append(", \"i\"))\n")
                .append("  )\n");
    }

    /**
     * Alternation of the significant keyword terms. A list slot is taken as is; free text is
     * reduced to its topic words.
     */
    static String keywordRegex(Intent intent) {
        List<String> terms;
        if (intent.getSlot("keywords").isList()) {
            terms = intent.slotAsList("keywords").stream().map(String::trim).filter(t -> !t.isEmpty()).toList();
        } else {
            String text = intent.slotAsString("keywords").trim().replaceAll("[?.!]+$", "");
            terms = Arrays.stream(text.split("\\s+"))
                    .map(word -> word.replaceAll("[^\\p{Alnum}-]", ""))
                    .filter(word -> word.length() > 1 && !KEYWORD_STOPWORDS.contains(word.toLowerCase()))
                    .toList();
            if (terms.isEmpty()) {
                terms = List.of(text);
            }
        }
        return terms.stream().distinct().map(SparqlFragments::escapeRegex).collect(Collectors.joining("|"));
    }
}
