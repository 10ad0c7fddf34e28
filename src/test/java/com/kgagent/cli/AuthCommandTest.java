package com.kgagent.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import com.kgagent.exception.KgAgentException;
import com.kgagent.service.api.CredentialService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AuthCommandTest {

    @Mock
    private CredentialService credentialService;

    @InjectMocks
    private AuthCommand authCommand;

    @Test
    void auth_storesCredential() {
        String output = authCommand.auth("nde", "secret");

        verify(credentialService).saveCredential("nde", "secret");
        assertThat(output).contains("Stored credential for 'nde'");
    }

    @Test
    void auth_saveFailure_printsError() {
        doThrow(new KgAgentException("Failed to save credentials")).when(credentialService).saveCredential("llm", "key");

        assertThat(authCommand.auth("llm", "key")).contains("An error occurred: Failed to save credentials");
    }
}
