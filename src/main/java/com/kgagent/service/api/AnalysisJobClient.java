package com.kgagent.service.api;

import com.kgagent.dto.request.JobSubmission;
import com.kgagent.dto.response.JobHandle;
import com.kgagent.dto.response.JobStatus;

/**
 * Submit / poll contract of the external analysis service.
 */
public interface AnalysisJobClient {

    JobHandle submit(JobSubmission submission);

    JobStatus poll(String jobId);
}
