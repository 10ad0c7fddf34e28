package com.kgagent.service.api;

import com.kgagent.model.ContextPack;
import com.kgagent.model.Intent;

/**
 * Renders an intent into a SPARQL query.
 */
public interface TemplateCompiler {

    /**
     * @param intent an intent whose slots are fully resolved.
     * @param pack   the context pack declaring the intent's task.
     * @return the query text.
     * @throws com.kgagent.exception.TemplateCompilationException if a required slot is missing or a
     *         slot still contains a step placeholder.
     */
    String compile(Intent intent, ContextPack pack);
}
