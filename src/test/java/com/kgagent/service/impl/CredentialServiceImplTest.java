package com.kgagent.service.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.kgagent.exception.KgAgentException;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.jasypt.exceptions.EncryptionOperationNotPossibleException;
import org.jasypt.encryption.StringEncryptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CredentialServiceImplTest {

    @Mock
    private StringEncryptor stringEncryptor;

    @TempDir
    Path home;

    private File credentialsFile;
    private CredentialServiceImpl credentialService;

    @BeforeEach
    void setUp() {
        credentialsFile = home.resolve(".kg-agent/credentials.json").toFile();
        credentialService = new CredentialServiceImpl(stringEncryptor, credentialsFile);
        credentialService.init();
    }

    @Test
    void saveCredential_encryptsBeforeWriting() throws IOException {
        when(stringEncryptor.encrypt("my-secret-token")).thenReturn("encrypted-token");

        credentialService.saveCredential("nde", "my-secret-token");

        String stored = Files.readString(credentialsFile.toPath());
        assertThat(stored).contains("\"nde\"").contains("encrypted-token").doesNotContain("my-secret-token");
    }

    @Test
    void savedCredential_survivesReload() {
        when(stringEncryptor.encrypt("my-secret-token")).thenReturn("encrypted-token");
        when(stringEncryptor.decrypt("encrypted-token")).thenReturn("my-secret-token");
        credentialService.saveCredential("jobs", "my-secret-token");

        CredentialServiceImpl reloaded = new CredentialServiceImpl(stringEncryptor, credentialsFile);
        reloaded.init();

        assertThat(reloaded.getCredential("jobs")).isEqualTo("my-secret-token");
        verify(stringEncryptor, times(1)).decrypt("encrypted-token");
    }

    @Test
    void getCredential_returnsNullIfTargetNotFound() {
        assertThat(credentialService.getCredential("non-existent")).isNull();
        verify(stringEncryptor, never()).decrypt(any());
    }

    @Test
    void getCredential_undecryptable_returnsNull() {
        when(stringEncryptor.encrypt("token")).thenReturn("encrypted");
        when(stringEncryptor.decrypt("encrypted")).thenThrow(new EncryptionOperationNotPossibleException());
        credentialService.saveCredential("llm", "token");

        assertThat(credentialService.getCredential("llm")).isNull();
    }

    @Test
    void saveCredential_blankToken_isRejected() {
        assertThatThrownBy(() -> credentialService.saveCredential("llm", " "))
                .isInstanceOf(KgAgentException.class)
                .hasMessageContaining("required");
        verify(stringEncryptor, never()).encrypt(any());
    }

    @Test
    void init_corruptedFile_isBackedUpAndStartsEmpty() throws IOException {
        Files.createDirectories(credentialsFile.toPath().getParent());
        Files.writeString(credentialsFile.toPath(), "{ this is not json");

        CredentialServiceImpl recovered = new CredentialServiceImpl(stringEncryptor, credentialsFile);
        recovered.init();

        assertThat(credentialsFile).doesNotExist();
        File[] backups = credentialsFile.getParentFile().listFiles((dir, name) -> name.startsWith("credentials.json.corrupted."));
        assertThat(backups).hasSize(1);
        assertThat(recovered.getCredential("anything")).isNull();
    }
}
