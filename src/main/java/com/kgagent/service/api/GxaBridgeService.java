package com.kgagent.service.api;

import com.kgagent.model.ContextPack;
import com.kgagent.model.SparqlResult;

/**
 * Links NDE datasets to Gene Expression Atlas experiments through their GEO accessions.
 */
public interface GxaBridgeService {

    /**
     * Returns a copy of {@code datasets} with a {@code hasGeneExpression} column ({@code true} /
     * {@code false}) and, where available, the matching {@code gxaExperimentId}.
     * The input result is not modified.
     */
    SparqlResult annotate(SparqlResult datasets, ContextPack pack);
}
