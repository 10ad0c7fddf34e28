package com.kgagent.template;

import com.kgagent.model.ContextPack;
import com.kgagent.model.Intent;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Lists Expression Atlas experiments with differential expression results, one row per
 * experiment with its contrast count.
 */
public class GxaCoverageTemplate implements SparqlTemplate {

    /**
     * The direct GXA endpoint is slow on large aggregates, so the default stays small.
     */
    static final int DEFAULT_LIMIT = 50;
    static final int CAP = 500;

    @Override
    public String render(Intent intent, ContextPack pack) {
        List<String> factors = intent.slotAsList("factor_terms").stream()
                .map(String::trim)
                .filter(t -> !t.isEmpty())
                .toList();
        String labelPattern = factors.isEmpty()
                ? "  OPTIONAL { ?contrast biolink:name ?contrastLabel . }\n"
                : "  ?contrast biolink:name ?contrastLabel .\n"
                        + "  FILTER(" + factors.stream()
                        .map(f -> "CONTAINS(LCASE(STR(?contrastLabel)), " + SparqlFragments.literal(f.toLowerCase()) + ")")
                        .collect(Collectors.joining(" || ")) + ")\n";

        return SparqlFragments.PREFIX_BIOLINK
                + "\n"
                + "SELECT ?experimentId (COUNT(DISTINCT ?contrast) AS ?contrastCount) (SAMPLE(?contrastLabel) AS ?sampleContrastLabel)\n"
                + SparqlFragments.fromClauses(intent, pack)
                + "WHERE {\n"
                + "  ?association a biolink:GeneExpressionMixin ;\n"
                + "               biolink:subject ?contrast .\n"
                + "  ?contrast a biolink:Assay .\n"
                + "  " + SparqlFragments.BIND_EXPERIMENT_ID + "\n"
                + labelPattern
                + "  FILTER(REGEX(STR(?contrast), \"E-[A-Z0-9-]+-g[0-9]+_g[0-9]+\"))\n"
                + "}\n"
                + "GROUP BY ?experimentId\n"
                + "ORDER BY DESC(?contrastCount)\n"
                + "LIMIT " + SparqlFragments.limit(intent, pack, DEFAULT_LIMIT, CAP);
    }
}
