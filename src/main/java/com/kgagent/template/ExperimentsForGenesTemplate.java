package com.kgagent.template;

import com.kgagent.exception.TemplateCompilationException;
import com.kgagent.model.ContextPack;
import com.kgagent.model.Intent;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Experiments and contrasts in which any of the given genes is differentially expressed.
 */
public class ExperimentsForGenesTemplate implements SparqlTemplate {

    static final int CAP = 500;

    @Override
    public String render(Intent intent, ContextPack pack) {
        List<String> symbols = SparqlFragments.splitTerms(intent, "gene_symbols");
        if (symbols.isEmpty()) {
            symbols = SparqlFragments.splitTerms(intent, "gene_symbol");
        }
        if (symbols.isEmpty()) {
            throw new TemplateCompilationException("Missing required slot 'gene_symbols' for template '" + intent.getTask() + "'");
        }
        String geneFilter = symbols.stream()
                .map(symbol -> "LCASE(?geneSymbol) = " + SparqlFragments.literal(symbol.toLowerCase()))
                .collect(Collectors.joining(" ||\n    "));

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
                + "  ?gene biolink:symbol ?geneSymbol .\n"
                + "  FILTER(\n"
                + "    " + geneFilter + "\n"
                + "  )"
                + SparqlFragments.log2fcFilter(SparqlFragments.direction(intent)) + "\n"
                + "  ?contrast a biolink:Assay ;\n"
                + "            spokegenelab:study_id ?experimentId ;\n"
                + "            spokegenelab:contrast_id ?contrastId .\n"
                + "  OPTIONAL { ?contrast biolink:name ?contrastLabel . }\n"
                + "}\n"
                + "ORDER BY ?geneSymbol ?experimentId ?contrastId\n"
                + "LIMIT " + SparqlFragments.limit(intent, pack, null, CAP);
    }
}
