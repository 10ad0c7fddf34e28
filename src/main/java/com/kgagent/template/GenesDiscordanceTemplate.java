package com.kgagent.template;

import com.kgagent.model.ContextPack;
import com.kgagent.model.Intent;

/**
 * Genes that go up in one association and down in another.
 */
public class GenesDiscordanceTemplate implements SparqlTemplate {

    static final int DEFAULT_LIMIT = 50;
    static final int CAP = 200;

    @Override
    public String render(Intent intent, ContextPack pack) {
        return SparqlFragments.PREFIX_BIOLINK
                + SparqlFragments.PREFIX_SPOKEGENELAB
                + "\n"
                + "SELECT DISTINCT ?gene ?geneSymbol\n"
                + SparqlFragments.fromClauses(intent, pack)
                + "WHERE {\n"
                + "  ?a1 a biolink:GeneExpressionMixin ; biolink:object ?gene ; spokegenelab:log2fc ?l1 .\n"
                + "  FILTER(?l1 > 0)\n"
                + "  ?a2 a biolink:GeneExpressionMixin ; biolink:object ?gene ; spokegenelab:log2fc ?l2 .\n"
                + "  FILTER(?l2 < 0)\n"
                + "  FILTER(?a1 != ?a2)\n"
                + "  OPTIONAL { ?gene biolink:symbol ?geneSymbol . }\n"
                + "}\n"
                + "LIMIT " + SparqlFragments.limit(intent, pack, DEFAULT_LIMIT, CAP);
    }
}
