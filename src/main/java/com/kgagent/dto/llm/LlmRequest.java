package com.kgagent.dto.llm;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Data;

/**
 * Chat-completions request body. The response is always constrained to a JSON object and
 * sampled at temperature 0 so slot refinement and query repair stay reproducible.
 */
@Data
public class LlmRequest {

    private String model;

    private List<LlmMessage> messages;

    private double temperature = 0.0;

    @JsonProperty("max_tokens")
    private int maxTokens;

    @JsonProperty("response_format")
    private ResponseFormat responseFormat = new ResponseFormat("json_object");

    public LlmRequest(String model, List<LlmMessage> messages, int maxTokens) {
        this.model = model;
        this.messages = messages;
        this.maxTokens = maxTokens;
    }

    @Data
    public static class ResponseFormat {

        private String type;

        public ResponseFormat(String type) {
            this.type = type;
        }
    }
}
