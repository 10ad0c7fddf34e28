package com.kgagent.dto.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class LlmResponse {
    private List<Choice> choices;

    /**
     * @return the content of the first choice, or null if the response carries none.
     */
    public String firstContent() {
        if (choices == null || choices.isEmpty() || choices.get(0).getMessage() == null) {
            return null;
        }
        return choices.get(0).getMessage().getContent();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Choice {
        private LlmResponseMessage message;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LlmResponseMessage {
        private String role;
        private String content;
    }
}
