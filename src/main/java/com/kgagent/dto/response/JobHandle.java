package com.kgagent.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Returned by a job submission.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobHandle(@JsonProperty("job_id") String jobId) {
}
