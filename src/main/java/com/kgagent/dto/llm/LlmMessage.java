package com.kgagent.dto.llm;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * One chat message sent to the LLM ({@code system} instructions or the {@code user} turn).
 */
@Data
@AllArgsConstructor
public class LlmMessage {

    private String role;

    private String content;

    public static LlmMessage system(String content) {
        return new LlmMessage("system", content);
    }

    public static LlmMessage user(String content) {
        return new LlmMessage("user", content);
    }
}
