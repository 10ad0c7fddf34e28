package com.kgagent.service.impl;

import com.kgagent.model.Intent;
import com.kgagent.model.SlotValue;
import com.kgagent.service.api.SlotExtractor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Regex and lexicon based slot extraction.
 * <p>
 * Extraction does not depend on the task: every recognizable slot is proposed, and the caller
 * keeps the ones the selected task accepts. A slot that is already bound in the input intent is
 * never replaced.
 */
@Service
@Slf4j
public class RegexSlotExtractor implements SlotExtractor {

    static final int MAX_LIMIT = 1000;

    private static final Pattern EXPERIMENT_ID = Pattern.compile("E-(?:GEOD|MTAB)-\\d+", Pattern.CASE_INSENSITIVE);
    private static final Pattern GENE_SYMBOL = Pattern.compile("\\b([A-Z][a-zA-Z0-9]{1,9})\\b");
    private static final Pattern LIMIT = Pattern.compile("limit\\s+(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern ENTITY_COMMAND = Pattern.compile("^/entity\\s*", Pattern.CASE_INSENSITIVE);
    private static final List<Pattern> CONDITION_PATTERNS = List.of(
            Pattern.compile("about\\s+(\\w+(?:\\s+\\w+){0,2})"),
            Pattern.compile("related\\s+to\\s+(\\w+(?:\\s+\\w+){0,2})"),
            Pattern.compile("(?:datasets?|experiments?)\\s+for\\s+(\\w+(?:\\s+\\w+){0,2})"));

    private static final Set<String> GENE_SYMBOL_BLOCKLIST = Set.of(
            "limit", "what", "which", "where", "list", "show", "find", "gene", "genes",
            "experiment", "experiments", "dataset", "datasets", "expression", "summary",
            "across", "multiple", "same", "opposite", "direction", "directions",
            "summarize", "differential", "differentially", "upregulated", "downregulated",
            "geod", "mtab");

    private static final Set<String> CONDITION_STOPWORDS = Set.of(
            "gene", "expression", "data", "that", "contain", "what", "which", "list", "experiments");

    private static final Map<String, List<String>> DISEASE_TO_EFO = Map.of(
            "influenza", List.of("0001072"),
            "heart disease", List.of("0001461"),
            "heart failure", List.of("0001645"),
            "cancer", List.of("0000618"),
            "diabetes", List.of("0001360"),
            "covid", List.of("0000644"),
            "covid-19", List.of("0000644"));

    private static final List<String> GXA_BRIDGE_PHRASES = List.of(
            "contain gene expression", "gene expression data", "with gene expression", "that have gene expression");

    @Override
    public Intent extract(String text, Intent intent) {
        String source = text == null ? "" : text.trim();
        String lower = source.toLowerCase();
        Intent result = intent;

        Matcher entityCommand = ENTITY_COMMAND.matcher(source);
        if (entityCommand.find()) {
            String query = source.substring(entityCommand.end()).trim();
            result = result.withSlotIfAbsent("q", SlotValue.of(query.isEmpty() ? source : query));
        } else if (!source.isEmpty()) {
            result = result.withSlotIfAbsent("q", SlotValue.of(source));
        }

        Matcher experiment = EXPERIMENT_ID.matcher(source);
        if (experiment.find()) {
            result = result.withSlotIfAbsent("experiment_id", SlotValue.of(experiment.group().toUpperCase()));
        }

        List<String> genes = extractGeneSymbols(source);
        if (!genes.isEmpty()) {
            result = result.withSlotIfAbsent("gene_symbols", SlotValue.of(genes));
            result = result.withSlotIfAbsent("gene_symbol", SlotValue.of(genes.get(0)));
        }

        String direction = extractDirection(lower);
        if (direction != null) {
            result = result.withSlotIfAbsent("direction", SlotValue.of(direction));
        }

        List<String> conditions = extractConditionPhrases(lower);
        if (!conditions.isEmpty()) {
            result = result.withSlotIfAbsent("factor_terms", SlotValue.of(conditions));
            List<String> efoIds = conditions.stream()
                    .flatMap(term -> DISEASE_TO_EFO.getOrDefault(term, List.of()).stream())
                    .distinct()
                    .toList();
            if (!efoIds.isEmpty()) {
                result = result.withSlotIfAbsent("disease_efo_ids", SlotValue.of(efoIds));
            }
        }

        if (!source.isEmpty()) {
            String keywords = conditions.isEmpty() ? source : conditions.get(0);
            result = result.withSlotIfAbsent("keywords", SlotValue.of(keywords));
        }

        if (GXA_BRIDGE_PHRASES.stream().anyMatch(lower::contains)) {
            result = result.withSlotIfAbsent("include_gxa_bridge", SlotValue.of("true"));
        }

        Integer limit = extractLimit(source);
        if (limit != null) {
            result = result.withSlotIfAbsent("limit", SlotValue.of(limit));
        }

        log.debug("Extracted slots: {}", result.getSlots());
        return result;
    }

    /**
     * Candidate gene symbols, deduplicated. Symbol-like tokens of 2 to 8 characters are ranked
     * first, then shorter before longer: long capitalized words are usually sentence words.
     */
    static List<String> extractGeneSymbols(String text) {
        Set<String> candidates = new LinkedHashSet<>();
        Matcher matcher = GENE_SYMBOL.matcher(text);
        while (matcher.find()) {
            String token = matcher.group(1);
            if (!GENE_SYMBOL_BLOCKLIST.contains(token.toLowerCase())) {
                candidates.add(token);
            }
        }
        List<String> ranked = new ArrayList<>(candidates);
        ranked.sort(Comparator.comparing((String s) -> s.length() > 8).thenComparingInt(String::length));
        return ranked;
    }

    private static String extractDirection(String lower) {
        if (lower.contains("upregulated") || lower.contains("up-regulation") || lower.contains("up regulation")) {
            return "up";
        }
        if (lower.contains("downregulated") || lower.contains("down-regulation") || lower.contains("down regulation")) {
            return "down";
        }
        return null;
    }

    private static List<String> extractConditionPhrases(String lower) {
        List<String> terms = new ArrayList<>();
        for (Pattern pattern : CONDITION_PATTERNS) {
            Matcher matcher = pattern.matcher(lower);
            if (!matcher.find()) {
                continue;
            }
            String term = String.join(" ", Arrays.stream(matcher.group(1).trim().split("\\s+"))
                    .filter(word -> word.length() > 1 && !CONDITION_STOPWORDS.contains(word))
                    .toList());
            if (!term.isEmpty() && !terms.contains(term)) {
                terms.add(term);
            }
        }
        return terms;
    }

    private static Integer extractLimit(String text) {
        Matcher matcher = LIMIT.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        try {
            int limit = Integer.parseInt(matcher.group(1));
            return limit >= 1 && limit <= MAX_LIMIT ? limit : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
