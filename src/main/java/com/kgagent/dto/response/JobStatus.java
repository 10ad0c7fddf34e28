package com.kgagent.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Poll result for a submitted job. {@code result} is only present once the job finished.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobStatus(String status, JsonNode result) {

    public boolean isTerminal() {
        return "completed".equalsIgnoreCase(status) || "failed".equalsIgnoreCase(status);
    }
}
