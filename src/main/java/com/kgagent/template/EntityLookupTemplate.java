package com.kgagent.template;

import com.kgagent.model.ContextPack;
import com.kgagent.model.Intent;

/**
 * Case-insensitive label search over the intent's graphs.
 */
public class EntityLookupTemplate implements SparqlTemplate {

    static final int CAP = 500;

    @Override
    public String render(Intent intent, ContextPack pack) {
        String q = intent.slotAsString("q").trim().toLowerCase();
        return SparqlFragments.PREFIX_RDFS
                + "\n"
                + "SELECT DISTINCT ?entity ?label\n"
                + SparqlFragments.fromClauses(intent, pack)
                + "WHERE {\n"
                + "  ?entity rdfs:label ?label .\n"
                + "  FILTER(CONTAINS(LCASE(STR(?label)), " + SparqlFragments.literal(q) + "))\n"
                + "}\n"
                + "LIMIT " + SparqlFragments.limit(intent, pack, null, CAP);
    }
}
