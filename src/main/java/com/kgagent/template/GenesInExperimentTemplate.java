package com.kgagent.template;

import com.kgagent.model.ContextPack;
import com.kgagent.model.Intent;

/**
 * Differentially expressed genes of one experiment, one row per gene and contrast.
 */
public class GenesInExperimentTemplate implements SparqlTemplate {

    static final int CAP = 500;

    @Override
    public String render(Intent intent, ContextPack pack) {
        String experimentId = intent.slotAsString("experiment_id").trim();

        return SparqlFragments.PREFIX_BIOLINK
                + SparqlFragments.PREFIX_SPOKEGENELAB
                + "\n"
                + "SELECT DISTINCT ?experimentId ?contrast ?contrastId ?contrastLabel ?gene ?geneSymbol ?log2fc ?adjPValue\n"
                + SparqlFragments.fromClauses(intent, pack)
                + "WHERE {\n"
                + "  ?assoc a biolink:GeneExpressionMixin ;\n"
                + "         biolink:object ?gene ;\n"
                + "         biolink:subject ?contrast ;\n"
                + "         spokegenelab:log2fc ?log2fc .\n"
                + "  OPTIONAL { ?assoc spokegenelab:adj_p_value ?adjPValue . }\n"
                + "  ?contrast a biolink:Assay .\n"
                // contrast IRIs differ between releases; the accession is always part of them
                + "  FILTER(CONTAINS(STR(?contrast), " + SparqlFragments.literal(experimentId) + "))\n"
                + "  " + SparqlFragments.BIND_EXPERIMENT_ID + "\n"
                + "  OPTIONAL { ?contrast spokegenelab:contrast_id ?contrastIdProp . }\n"
                + "  BIND(COALESCE(?contrastIdProp, REPLACE(STR(?contrast), \"^.*-(g[0-9]+_g[0-9]+)$\", \"$1\")) AS ?contrastId)\n"
                + "  OPTIONAL { ?contrast biolink:name ?contrastLabel . }\n"
                + "  OPTIONAL { ?gene biolink:symbol ?geneSymbol . }"
                + SparqlFragments.log2fcFilter(SparqlFragments.direction(intent)) + "\n"
                + "}\n"
                + "ORDER BY ?contrastId ?geneSymbol\n"
                + "LIMIT " + SparqlFragments.limit(intent, pack, null, CAP);
    }
}
