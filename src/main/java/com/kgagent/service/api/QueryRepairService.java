package com.kgagent.service.api;

import java.util.Optional;

/**
 * Produces a corrected version of a query that an endpoint rejected.
 */
public interface QueryRepairService {

    /**
     * @param query        the rejected query.
     * @param errorMessage the endpoint's error text.
     * @return the rewritten query, or empty when no fix could be produced.
     */
    Optional<String> repair(String query, String errorMessage);
}
