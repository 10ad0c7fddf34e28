package com.kgagent.cli;

import com.kgagent.dto.request.AuthRequest;
import com.kgagent.dto.response.CommandResponse;
import com.kgagent.service.api.CredentialService;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

@ShellComponent
public class AuthCommand {

    private final CredentialService credentialService;

    public AuthCommand(CredentialService credentialService) {
        this.credentialService = credentialService;
    }

    /**
     * Stores a secret encrypted on disk.
     *
     * @param target {@code llm} for the LLM API key, {@code jobs} for the analysis service, or a graph
     *               shortname whose endpoint needs a bearer token.
     * @param token  the secret.
     */
    @ShellMethod(key = "auth", value = "Store a credential for the LLM, the job service or a graph endpoint.")
    public String auth(
            @ShellOption(help = "llm, jobs or a graph shortname.") String target,
            @ShellOption(help = "The API key or bearer token.") String token
    ) {
        var request = new AuthRequest(target, token);
        try {
            credentialService.saveCredential(request.target(), request.token());
            return new CommandResponse(true, "Stored credential for '" + request.target() + "'").toAnsiString();
        } catch (Exception e) {
            return new CommandResponse(false, "An error occurred: " + e.getMessage()).toAnsiString();
        }
    }
}
