package com.kgagent.service.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.kgagent.dto.llm.LlmMessage;
import java.util.List;

/**
 * Chat-completions client constrained to JSON-object answers.
 */
public interface LlmClient {

    /**
     * @return true when an API key is available.
     */
    boolean isConfigured();

    /**
     * Sends the conversation and parses the first choice as a JSON object.
     *
     * @throws com.kgagent.exception.KgAgentException if the call fails or the answer is not a JSON object.
     */
    JsonNode completeJson(List<LlmMessage> messages, int maxTokens);
}
