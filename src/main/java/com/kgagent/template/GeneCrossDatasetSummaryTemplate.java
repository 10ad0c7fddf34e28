package com.kgagent.template;

import com.kgagent.model.ContextPack;
import com.kgagent.model.Intent;

/**
 * One gene's differential expression across all experiments, with the direction per contrast.
 */
public class GeneCrossDatasetSummaryTemplate implements SparqlTemplate {

    static final int CAP = 500;

    @Override
    public String render(Intent intent, ContextPack pack) {
        String symbol = intent.hasSlot("gene_symbol")
                ? intent.slotAsString("gene_symbol")
                : intent.slotAsList("gene_symbols").get(0);

        return SparqlFragments.PREFIX_BIOLINK
                + SparqlFragments.PREFIX_SPOKEGENELAB
                + "\n"
                + "SELECT DISTINCT ?geneSymbol ?experimentId ?contrastId ?contrastLabel ?direction ?log2fc ?adjPValue\n"
                + SparqlFragments.fromClauses(intent, pack)
                + "WHERE {\n"
                + "  ?assoc a biolink:GeneExpressionMixin ;\n"
                + "         biolink:object ?gene ;\n"
                + "         biolink:subject ?contrast ;\n"
                + "         spokegenelab:log2fc ?log2fc .\n"
                + "  OPTIONAL { ?assoc spokegenelab:adj_p_value ?adjPValue . }\n"
                + "  ?contrast a biolink:Assay .\n"
                + "  ?gene biolink:symbol ?geneSymbol .\n"
                + "  FILTER(LCASE(?geneSymbol) = " + SparqlFragments.literal(symbol.trim().toLowerCase()) + ")\n"
                + "  " + SparqlFragments.BIND_EXPERIMENT_ID + "\n"
                + "  OPTIONAL { ?contrast spokegenelab:contrast_id ?contrastIdProp . }\n"
                + "  BIND(COALESCE(?contrastIdProp, REPLACE(STR(?contrast), \"^.*-(g[0-9]+_g[0-9]+)$\", \"$1\")) AS ?contrastId)\n"
                + "  OPTIONAL { ?contrast biolink:name ?contrastLabel . }\n"
                + "  BIND(IF(?log2fc > 0, \"up\", \"down\") AS ?direction)\n"
                + "}\n"
                + "ORDER BY ?experimentId ?contrastId\n"
                + "LIMIT " + SparqlFragments.limit(intent, pack, null, CAP);
    }
}
