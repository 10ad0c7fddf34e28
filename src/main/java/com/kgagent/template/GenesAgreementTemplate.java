package com.kgagent.template;

import com.kgagent.model.ContextPack;
import com.kgagent.model.Intent;

/**
 * Genes changed in the same direction in at least {@code min_experiments} experiments.
 */
public class GenesAgreementTemplate implements SparqlTemplate {

    static final int DEFAULT_LIMIT = 50;
    static final int DEFAULT_MIN_EXPERIMENTS = 2;
    static final int CAP = 200;

    @Override
    public String render(Intent intent, ContextPack pack) {
        Integer requestedMin = SparqlFragments.parseInteger(intent.slotAsString("min_experiments"));
        int minExperiments = Math.max(1, requestedMin != null ? requestedMin : DEFAULT_MIN_EXPERIMENTS);
        String direction = SparqlFragments.direction(intent);
        String directionFilter = "up".equals(direction)
                ? "FILTER(?log2fc > 0)"
                : "down".equals(direction) ? "FILTER(?log2fc < 0)" : "FILTER(?log2fc != 0)";

        return SparqlFragments.PREFIX_BIOLINK
                + SparqlFragments.PREFIX_SPOKEGENELAB
                + "\n"
                + "SELECT ?geneSymbol ?direction (COUNT(DISTINCT ?experimentId) AS ?experimentCount) (SAMPLE(?experimentId) AS ?sampleExperimentId)\n"
                + SparqlFragments.fromClauses(intent, pack)
                + "WHERE {\n"
                + "  ?assoc a biolink:GeneExpressionMixin ;\n"
                + "         biolink:object ?gene ;\n"
                + "         biolink:subject ?contrast ;\n"
                + "         spokegenelab:log2fc ?log2fc .\n"
                + "  ?contrast a biolink:Assay .\n"
                + "  OPTIONAL { ?gene biolink:symbol ?geneSymbol . }\n"
                + "  " + directionFilter + "\n"
                + "  " + SparqlFragments.BIND_EXPERIMENT_ID + "\n"
                + "  BIND(IF(?log2fc > 0, \"up\", \"down\") AS ?direction)\n"
                + "}\n"
                + "GROUP BY ?gene ?geneSymbol ?direction\n"
                + "HAVING (COUNT(DISTINCT ?experimentId) >= " + minExperiments + ")\n"
                + "ORDER BY DESC(?experimentCount) ?geneSymbol\n"
                + "LIMIT " + SparqlFragments.limit(intent, pack, DEFAULT_LIMIT, CAP);
    }
}
