package com.kgagent.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kgagent.dto.llm.LlmMessage;
import com.kgagent.dto.llm.LlmRequest;
import com.kgagent.dto.llm.LlmResponse;
import com.kgagent.exception.KgAgentException;
import com.kgagent.service.api.CredentialService;
import com.kgagent.service.api.LlmClient;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.core.publisher.Mono;

/**
 * Chat-completions client used by the slot refiner and the query repair pass.
 * <p>
 * The API key stored with {@code auth --target llm} takes precedence over {@code llm.api.key}.
 */
@Service
@Slf4j
public class LlmClientImpl implements LlmClient {

    static final String CREDENTIAL_TARGET = "llm";

    private final WebClient webClient;
    private final CredentialService credentialService;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Value("${llm.api.key:}")
    private String llmApiKey;

    @Value("${llm.api.endpoint}")
    private String llmApiEndpoint;

    @Value("${llm.model}")
    private String llmModel;

    public LlmClientImpl(WebClient webClient, CredentialService credentialService) {
        this.webClient = webClient;
        this.credentialService = credentialService;
    }

    @Override
    public boolean isConfigured() {
        String key = resolveApiKey();
        return key != null && !key.isBlank();
    }

    @Override
    public JsonNode completeJson(List<LlmMessage> messages, int maxTokens) {
        if (!isConfigured()) {
            throw new KgAgentException("No LLM API key configured. Use 'auth --target llm --token <key>' or set LLM_API_KEY.");
        }
        LlmRequest request = new LlmRequest(llmModel, messages, maxTokens);
        log.debug("Sending {} message(s) to LLM model {}", messages.size(), llmModel);

        String content;
        try {
            LlmResponse response = webClient.post()
                    .uri(llmApiEndpoint)
                    .header("Authorization", "Bearer " + resolveApiKey())
                    .body(Mono.just(request), LlmRequest.class)
                    .retrieve()
                    .bodyToMono(LlmResponse.class)
                    .block();
            content = response == null ? null : response.firstContent();
        } catch (WebClientException e) {
            throw new KgAgentException("An error occurred while communicating with the LLM: " + e.getMessage(), e);
        }

        if (content == null || content.isBlank()) {
            throw new KgAgentException("Received an empty or invalid response from the LLM.");
        }
        log.debug("LLM JSON response: {}", content);

        try {
            JsonNode node = objectMapper.readTree(content);
            if (node == null || !node.isObject()) {
                throw new KgAgentException("The LLM answer is not a JSON object.");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new KgAgentException("Failed to parse the LLM answer. The response was not valid JSON.", e);
        }
    }

    private String resolveApiKey() {
        String stored = credentialService.getCredential(CREDENTIAL_TARGET);
        return stored != null && !stored.isBlank() ? stored : llmApiKey;
    }
}
