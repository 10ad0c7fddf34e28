package com.kgagent.service.impl;

import com.kgagent.dto.request.ExecutionRequest;
import com.kgagent.dto.response.ExecutionResponse;
import com.kgagent.exception.KgAgentException;
import com.kgagent.model.ContextPack;
import com.kgagent.model.GraphMode;
import com.kgagent.model.RdfTerm;
import com.kgagent.model.SparqlResult;
import com.kgagent.service.api.GxaBridgeService;
import com.kgagent.service.api.SparqlExecutionClient;
import com.kgagent.template.SparqlFragments;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Expression Atlas re-processes GEO series under {@code E-GEOD-<n>}, so a dataset with the GEO
 * accession {@code GSE<n>} has expression data exactly when the atlas knows {@code E-GEOD-<n>}.
 */
@Service
@Slf4j
public class GxaBridgeServiceImpl implements GxaBridgeService {

    static final String GXA_GRAPH = "gene-expression-atlas-okn";
    static final String HAS_GENE_EXPRESSION = "hasGeneExpression";
    static final String GXA_EXPERIMENT_ID = "gxaExperimentId";

    private static final Pattern GSE = Pattern.compile("\\bGSE(\\d+)\\b", Pattern.CASE_INSENSITIVE);

    private final SparqlExecutionClient client;

    public GxaBridgeServiceImpl(SparqlExecutionClient client) {
        this.client = client;
    }

    @Override
    public SparqlResult annotate(SparqlResult datasets, ContextPack pack) {
        Map<Integer, String> candidates = new LinkedHashMap<>();
        for (int i = 0; i < datasets.size(); i++) {
            String accession = geoAccession(datasets.getBindings().get(i));
            if (accession != null) {
                candidates.put(i, toGxaAccession(accession));
            }
        }

        Set<String> known = candidates.isEmpty() ? Set.of() : knownExperiments(new LinkedHashSet<>(candidates.values()), pack);

        List<String> vars = new ArrayList<>(datasets.getVars());
        vars.add(HAS_GENE_EXPRESSION);
        vars.add(GXA_EXPERIMENT_ID);
        List<Map<String, RdfTerm>> rows = new ArrayList<>();
        for (int i = 0; i < datasets.size(); i++) {
            Map<String, RdfTerm> row = new LinkedHashMap<>(datasets.getBindings().get(i));
            String experiment = candidates.get(i);
            boolean covered = experiment != null && known.contains(experiment);
            row.put(HAS_GENE_EXPRESSION, new RdfTerm("literal", String.valueOf(covered),
                    "http://www.w3.org/2001/XMLSchema#boolean", null));
            if (covered) {
                row.put(GXA_EXPERIMENT_ID, RdfTerm.literal(experiment));
            }
            rows.add(row);
        }
        log.info("GXA bridge: {} of {} dataset(s) have expression experiments", known.size(), datasets.size());
        return SparqlResult.of(vars, rows);
    }

    /**
     * Maps {@code GSE123} to {@code E-GEOD-123}.
     */
    static String toGxaAccession(String gse) {
        Matcher m = GSE.matcher(gse);
        if (!m.find()) {
            throw new KgAgentException("Not a GEO series accession: " + gse);
        }
        return "E-GEOD-" + m.group(1);
    }

    private static String geoAccession(Map<String, RdfTerm> row) {
        for (String column : List.of("identifier", "dataset")) {
            RdfTerm term = row.get(column);
            if (term != null && term.getValue() != null) {
                Matcher m = GSE.matcher(term.getValue());
                if (m.find()) {
                    return "GSE" + m.group(1);
                }
            }
        }
        return null;
    }

    private Set<String> knownExperiments(Set<String> accessions, ContextPack pack) {
        String values = accessions.stream().map(SparqlFragments::literal).collect(Collectors.joining(" "));
        String query = SparqlFragments.PREFIX_BIOLINK
                + "\n"
                + "SELECT DISTINCT ?experimentId\n"
                + "WHERE {\n"
                + "  VALUES ?experimentId { " + values + " }\n"
                + "  ?contrast a biolink:Assay .\n"
                + "  FILTER(CONTAINS(STR(?contrast), ?experimentId))\n"
                + "}";
        ExecutionResponse response = client.execute(
                new ExecutionRequest(query, GraphMode.SINGLE, List.of(GXA_GRAPH), false, false), pack).block();
        if (response == null || response.getResult() == null) {
            return Set.of();
        }
        return new LinkedHashSet<>(response.getResult().distinctValues("experimentId"));
    }
}
