package com.kgagent.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.kgagent.config.KgAgentProperties;
import com.kgagent.dto.llm.LlmMessage;
import com.kgagent.service.api.LlmClient;
import com.kgagent.service.api.QueryRepairService;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Repairs queries rejected by an endpoint.
 * <p>
 * The cheap fix comes first: declarations for well-known prefixes that the query uses but does not
 * declare. Only when that changes nothing, and an LLM is configured, is the model asked for a
 * minimal rewrite.
 */
@Service
@Slf4j
public class QueryRepairServiceImpl implements QueryRepairService {

    static final Map<String, String> WELL_KNOWN_PREFIXES = new LinkedHashMap<>();

    static {
        WELL_KNOWN_PREFIXES.put("biolink", "https://w3id.org/biolink/vocab/");
        WELL_KNOWN_PREFIXES.put("spokegenelab", "https://spoke.ucsf.edu/genelab/");
        WELL_KNOWN_PREFIXES.put("schema", "http://schema.org/");
        WELL_KNOWN_PREFIXES.put("rdfs", "http://www.w3.org/2000/01/rdf-schema#");
        WELL_KNOWN_PREFIXES.put("rdf", "http://www.w3.org/1999/02/22-rdf-syntax-ns#");
        WELL_KNOWN_PREFIXES.put("wd", "http://www.wikidata.org/entity/");
        WELL_KNOWN_PREFIXES.put("wdt", "http://www.wikidata.org/prop/direct/");
        WELL_KNOWN_PREFIXES.put("wdtn", "http://www.wikidata.org/prop/direct-normalized/");
        WELL_KNOWN_PREFIXES.put("xsd", "http://www.w3.org/2001/XMLSchema#");
        WELL_KNOWN_PREFIXES.put("obo", "http://purl.obolibrary.org/obo/");
    }

    private final LlmClient llmClient;
    private final KgAgentProperties properties;

    public QueryRepairServiceImpl(LlmClient llmClient, KgAgentProperties properties) {
        this.llmClient = llmClient;
        this.properties = properties;
    }

    @Override
    public Optional<String> repair(String query, String errorMessage) {
        String withPrefixes = addMissingPrefixes(query);
        if (!withPrefixes.equals(query)) {
            log.info("Repaired query by declaring missing prefixes");
            return Optional.of(withPrefixes);
        }
        if (!llmClient.isConfigured()) {
            log.debug("No deterministic repair applies and no LLM is configured");
            return Optional.empty();
        }

        JsonNode answer = llmClient.completeJson(List.of(
                LlmMessage.system("You fix SPARQL 1.1 queries rejected by an endpoint. Make the smallest change that "
                        + "fixes the reported error. Keep every FROM, SERVICE, VALUES and LIMIT clause. "
                        + "Return ONLY a JSON object of the form {\"query\": \"<fixed query>\"}."),
                LlmMessage.user("Error:\n" + errorMessage + "\n\nQuery:\n" + query)),
                properties.getRefiner().getMaxTokens() * 4);

        JsonNode fixed = answer.get("query");
        if (fixed == null || !fixed.isTextual() || fixed.asText().isBlank()) {
            log.warn("LLM repair answer has no 'query' field");
            return Optional.empty();
        }
        return Optional.of(fixed.asText().strip());
    }

    /**
     * Declares each well-known prefix that is used as {@code prefix:} but has no {@code PREFIX} line.
     */
    static String addMissingPrefixes(String query) {
        StringBuilder declarations = new StringBuilder();
        for (Map.Entry<String, String> prefix : WELL_KNOWN_PREFIXES.entrySet()) {
            String name = Pattern.quote(prefix.getKey());
            boolean declared = Pattern.compile("(?im)^\\s*PREFIX\\s+" + name + "\\s*:").matcher(query).find();
            boolean used = Pattern.compile("(?<![\\w<:/#.-])" + name + ":[A-Za-z_]").matcher(query).find();
            if (used && !declared) {
                declarations.append("PREFIX ").append(prefix.getKey()).append(": <").append(prefix.getValue()).append(">\n");
            }
        }
        return declarations.length() == 0 ? query : declarations + query;
    }
}
