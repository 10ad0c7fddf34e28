package com.kgagent.template;

import com.kgagent.model.ContextPack;
import com.kgagent.model.Intent;

/**
 * Renders the query of one task. Implementations are stateless and may assume the required
 * slots are bound and placeholder free.
 */
public interface SparqlTemplate {

    String render(Intent intent, ContextPack pack);
}
