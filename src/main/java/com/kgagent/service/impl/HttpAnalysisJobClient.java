package com.kgagent.service.impl;

import com.kgagent.config.KgAgentProperties;
import com.kgagent.dto.request.JobSubmission;
import com.kgagent.dto.response.JobHandle;
import com.kgagent.dto.response.JobStatus;
import com.kgagent.exception.KgAgentException;
import com.kgagent.service.api.AnalysisJobClient;
import com.kgagent.service.api.CredentialService;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * HTTP client of the analysis service: {@code POST {base}/jobs} submits, {@code GET {base}/jobs/{id}}
 * polls. A token stored under {@code jobs} is sent as a bearer token.
 */
@Service
@Slf4j
public class HttpAnalysisJobClient implements AnalysisJobClient {

    static final String CREDENTIAL_TARGET = "jobs";

    private final WebClient webClient;
    private final CredentialService credentialService;
    private final KgAgentProperties properties;

    public HttpAnalysisJobClient(WebClient webClient, CredentialService credentialService, KgAgentProperties properties) {
        this.webClient = webClient;
        this.credentialService = credentialService;
        this.properties = properties;
    }

    @Override
    public JobHandle submit(JobSubmission submission) {
        if (submission == null || submission.kind() == null || submission.kind().isBlank()) {
            throw new KgAgentException("A job submission needs a kind.");
        }
        String uri = UriComponentsBuilder.fromUriString(baseUrl()).path("/jobs").toUriString();
        log.info("Submitting '{}' job to {}", submission.kind(), uri);
        try {
            JobHandle handle = webClient.post().uri(uri)
                    .headers(this::bearer)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(submission)
                    .retrieve()
                    .bodyToMono(JobHandle.class)
                    .block(timeout());
            if (handle == null || handle.jobId() == null) {
                throw new KgAgentException("The analysis service did not return a job id.");
            }
            log.info("Job submitted with id {}", handle.jobId());
            return handle;
        } catch (WebClientResponseException e) {
            log.error("Job submission failed with status {} and body: {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new KgAgentException("Job submission failed: " + e.getStatusCode() + " " + e.getResponseBodyAsString(), e);
        } catch (WebClientRequestException | IllegalStateException e) {
            throw new KgAgentException("Could not reach the analysis service at " + uri + ": " + e.getMessage(), e);
        }
    }

    @Override
    public JobStatus poll(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            throw new KgAgentException("A job id is required.");
        }
        String uri = UriComponentsBuilder.fromUriString(baseUrl()).path("/jobs/{id}").buildAndExpand(jobId).toUriString();
        log.debug("Polling job {} at {}", jobId, uri);
        try {
            JobStatus status = webClient.get().uri(uri)
                    .headers(this::bearer)
                    .retrieve()
                    .bodyToMono(JobStatus.class)
                    .block(timeout());
            if (status == null) {
                throw new KgAgentException("The analysis service returned no status for job " + jobId + ".");
            }
            return status;
        } catch (WebClientResponseException.NotFound e) {
            throw new KgAgentException("Unknown job: " + jobId, e);
        } catch (WebClientResponseException e) {
            log.error("Job poll failed with status {} and body: {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new KgAgentException("Polling job " + jobId + " failed: " + e.getStatusCode() + " " + e.getResponseBodyAsString(), e);
        } catch (WebClientRequestException | IllegalStateException e) {
            throw new KgAgentException("Could not reach the analysis service at " + uri + ": " + e.getMessage(), e);
        }
    }

    private void bearer(HttpHeaders headers) {
        String token = credentialService.getCredential(CREDENTIAL_TARGET);
        if (token != null) {
            headers.setBearerAuth(token);
        }
    }

    private String baseUrl() {
        String base = properties.getJobs().getBaseUrl();
        if (base == null || base.isBlank()) {
            throw new KgAgentException("No analysis service configured (kgagent.jobs.base-url).");
        }
        return base;
    }

    private Duration timeout() {
        return properties.getJobs().getTimeout();
    }
}
