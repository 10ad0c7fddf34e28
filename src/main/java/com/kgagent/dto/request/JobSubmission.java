package com.kgagent.dto.request;

import java.util.Map;

/**
 * A long-running job for an external collaborator (e.g. a differential-expression analysis).
 *
 * @param kind       the job type understood by the collaborator.
 * @param parameters opaque job parameters.
 */
public record JobSubmission(String kind, Map<String, Object> parameters) {
}
