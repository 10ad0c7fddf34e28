package com.kgagent.service.api;

/**
 * Stores secrets used for outbound calls: the LLM API key ({@code llm}) and bearer tokens for
 * protected graph endpoints (keyed by graph shortname).
 */
public interface CredentialService {

    void saveCredential(String target, String token);

    /**
     * @return the decrypted secret, or null if none is stored or it cannot be decrypted.
     */
    String getCredential(String target);
}
