package com.kgagent.cli;

import static com.kgagent.cli.ui.AnsiJson.ANSI_CYAN;
import static com.kgagent.cli.ui.AnsiJson.ANSI_RESET;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kgagent.cli.ui.AnsiJson;
import com.kgagent.dto.request.JobSubmission;
import com.kgagent.dto.response.CommandResponse;
import com.kgagent.dto.response.JobHandle;
import com.kgagent.dto.response.JobStatus;
import com.kgagent.service.api.AnalysisJobClient;
import java.util.Map;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Submits and polls jobs of the external analysis service.
 */
@ShellComponent
public class JobCommand {

    private final AnalysisJobClient jobClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public JobCommand(AnalysisJobClient jobClient) {
        this.jobClient = jobClient;
    }

    @ShellMethod(key = "job-submit", value = "Submit an analysis job.")
    public String submit(
            @ShellOption(help = "Job kind, e.g. differential_expression.") String kind,
            @ShellOption(help = "Job parameters as a JSON object.", defaultValue = "{}") String params
    ) {
        try {
            Map<String, Object> parameters = objectMapper.readValue(params, new TypeReference<Map<String, Object>>() {});
            JobHandle handle = jobClient.submit(new JobSubmission(kind, parameters));
            return new CommandResponse(true, "Submitted job " + handle.jobId()).toAnsiString();
        } catch (Exception e) {
            return new CommandResponse(false, "An error occurred: " + e.getMessage()).toAnsiString();
        }
    }

    @ShellMethod(key = "job-status", value = "Show the status of an analysis job.")
    public String status(@ShellOption(help = "The job id.") String id) {
        try {
            JobStatus status = jobClient.poll(id);
            StringBuilder out = new StringBuilder(ANSI_CYAN + "Job " + id + ": " + status.status() + ANSI_RESET);
            if (status.result() != null) {
                out.append("\n").append(AnsiJson.format(status.result()));
            }
            return out.toString();
        } catch (Exception e) {
            return new CommandResponse(false, "An error occurred: " + e.getMessage()).toAnsiString();
        }
    }
}
