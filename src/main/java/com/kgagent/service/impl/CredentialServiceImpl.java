package com.kgagent.service.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kgagent.exception.KgAgentException;
import com.kgagent.service.api.CredentialService;
import jakarta.annotation.PostConstruct;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.jasypt.encryption.StringEncryptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Keeps credentials encrypted with Jasypt in {@code $KG_AGENT_HOME/.kg-agent/credentials.json}
 * (the user's home directory when {@code KG_AGENT_HOME} is unset). Secrets are only decrypted
 * on read.
 */
@Service
@Slf4j
public class CredentialServiceImpl implements CredentialService {

    private final File credentialsFile;
    private final StringEncryptor encryptor;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private Map<String, String> credentials = new ConcurrentHashMap<>();

    @Autowired
    public CredentialServiceImpl(StringEncryptor encryptor) {
        this(encryptor, defaultFile());
    }

    CredentialServiceImpl(StringEncryptor encryptor, File credentialsFile) {
        this.encryptor = encryptor;
        this.credentialsFile = credentialsFile;
    }

    private static File defaultFile() {
        String home = System.getenv("KG_AGENT_HOME") != null ? System.getenv("KG_AGENT_HOME") : System.getProperty("user.home");
        return new File(home, ".kg-agent/credentials.json");
    }

    @PostConstruct
    public void init() {
        load();
    }

    @Override
    public void saveCredential(String target, String token) {
        if (target == null || target.isBlank() || token == null || token.isBlank()) {
            throw new KgAgentException("Both a target and a token are required.");
        }
        log.info("Encrypting and saving credential for '{}'", target);
        credentials.put(target, encryptor.encrypt(token));
        save();
    }

    @Override
    public String getCredential(String target) {
        String encrypted = credentials.get(target);
        if (encrypted == null) {
            return null;
        }
        try {
            return encryptor.decrypt(encrypted);
        } catch (Exception e) {
            log.error("Could not decrypt credential for '{}'. The secret key may have changed.", target);
            return null;
        }
    }

    private synchronized void save() {
        try {
            File parent = credentialsFile.getParentFile();
            if (!parent.exists() && !parent.mkdirs()) {
                throw new IOException("Failed to create directory " + parent.getAbsolutePath());
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(credentialsFile, credentials);
        } catch (IOException e) {
            log.error("Failed to save credentials to {}", credentialsFile, e);
            throw new KgAgentException("Failed to save credentials", e);
        }
    }

    /**
     * Reads the credential file. An unreadable file is moved aside so the next start is clean.
     */
    private synchronized void load() {
        if (!credentialsFile.exists() || credentialsFile.length() == 0) {
            log.debug("No credential file at {}", credentialsFile);
            return;
        }
        try {
            Map<String, String> stored = objectMapper.readValue(credentialsFile, new TypeReference<Map<String, String>>() {});
            credentials = new ConcurrentHashMap<>(stored);
            log.info("Loaded {} credential(s) from {}", credentials.size(), credentialsFile);
        } catch (IOException e) {
            log.warn("Could not parse credential file {}; backing it up and starting empty. Error: {}", credentialsFile, e.getMessage());
            backupCorruptedFile();
            credentials = new ConcurrentHashMap<>();
        }
    }

    private void backupCorruptedFile() {
        File backup = new File(credentialsFile.getPath() + ".corrupted." + System.currentTimeMillis());
        try {
            Files.move(credentialsFile.toPath(), backup.toPath(), StandardCopyOption.REPLACE_EXISTING);
            log.info("Backed up corrupted credential file to {}", backup);
        } catch (IOException e) {
            log.error("Failed to back up corrupted credential file {} to {}", credentialsFile, backup, e);
        }
    }
}
