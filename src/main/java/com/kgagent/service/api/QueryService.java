package com.kgagent.service.api;

import com.kgagent.dto.request.ExecutionRequest;
import com.kgagent.dto.response.AskResponse;
import com.kgagent.dto.response.ExecutionResponse;
import com.kgagent.model.CancellationToken;
import com.kgagent.model.Intent;
import com.kgagent.model.SlotValue;
import java.util.Map;

/**
 * The interpret / compile / execute surface of the planner.
 */
public interface QueryService {

    /**
     * Turns a question into an intent: classification and slot extraction run independently,
     * then the task's refiner fills what is still missing.
     *
     * @param text        the question.
     * @param packId      context pack id, or null for the default pack.
     * @param presetSlots slots supplied explicitly by the caller; they are never overwritten.
     */
    Intent interpret(String text, String packId, Map<String, SlotValue> presetSlots);

    /**
     * Compiles an intent with the pack it names.
     */
    String compile(Intent intent);

    /**
     * Executes a compiled query. Failures are reported in the response, not thrown. Cancelling
     * the token aborts the request in flight and yields a {@link
     * com.kgagent.model.ExecutionErrorKind#CANCELLED} response.
     */
    ExecutionResponse execute(ExecutionRequest request, String packId, CancellationToken cancellation);

    /**
     * Executes a compiled intent on its graphs. Dataset searches that ask for it are annotated
     * with Expression Atlas coverage.
     */
    ExecutionResponse run(Intent intent, String query, boolean debug, boolean repair, CancellationToken cancellation);

    /**
     * Interprets, compiles and executes a one-step question.
     */
    AskResponse ask(String text, String packId, boolean debug, boolean repair, CancellationToken cancellation);
}
