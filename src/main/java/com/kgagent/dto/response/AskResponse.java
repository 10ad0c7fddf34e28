package com.kgagent.dto.response;

import com.kgagent.model.Intent;

/**
 * End-to-end result of a one-step question: the interpreted intent, the compiled query and the
 * execution response.
 */
public record AskResponse(Intent intent, String compiledQuery, ExecutionResponse execution) {
}
