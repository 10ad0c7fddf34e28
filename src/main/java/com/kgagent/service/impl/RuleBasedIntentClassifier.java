package com.kgagent.service.impl;

import com.kgagent.model.Classification;
import com.kgagent.model.ContextPack;
import com.kgagent.model.TaskType;
import com.kgagent.service.api.IntentClassifier;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.function.BiPredicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Classifies questions with an ordered list of text rules. The first rule that matches wins;
 * rules are ordered from the most specific pattern to the most general one, so an experiment
 * accession beats a bare mention of "dataset".
 */
@Service
@Slf4j
public class RuleBasedIntentClassifier implements IntentClassifier {

    static final TaskType FALLBACK_TASK = TaskType.DATASET_SEARCH;
    static final double FALLBACK_CONFIDENCE = 0.55;

    private static final Pattern GEOD_ACCESSION = Pattern.compile("e-geod-\\d+", Pattern.CASE_INSENSITIVE);
    private static final Pattern ATLAS_ACCESSION = Pattern.compile("e-(?:geod|mtab)-\\d+", Pattern.CASE_INSENSITIVE);
    private static final Pattern DE_WORD = Pattern.compile("\\bde\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern SYMBOL_LIKE = Pattern.compile("\\b[A-Z][a-zA-Z0-9]{1,8}\\b");
    private static final Pattern ABOUT_PHRASE = Pattern.compile("about\\s+(\\w+(?:\\s+\\w+){0,2})");
    private static final Set<String> ABOUT_STOPWORDS =
            Set.of("gene", "expression", "data", "that", "contain", "what", "which", "list");

    private final List<Rule> rules = List.of(
            new Rule("entity_command", TaskType.ENTITY_LOOKUP, 0.9,
                    (text, lower) -> lower.startsWith("/entity")),
            new Rule("genes_in_experiment", TaskType.GENES_IN_EXPERIMENT, 0.8,
                    (text, lower) -> containsAny(lower, "genes in", "genes for", "genes from")
                            && GEOD_ACCESSION.matcher(text).find()),
            new Rule("de_genes_in_experiment", TaskType.GENES_IN_EXPERIMENT, 0.8,
                    (text, lower) -> (lower.contains("differential")
                            || (DE_WORD.matcher(text).find() && lower.contains("genes") && lower.contains("in")))
                            && lower.contains("genes")
                            && GEOD_ACCESSION.matcher(text).find()),
            new Rule("genes_in_experiment_id", TaskType.GENES_IN_EXPERIMENT, 0.75,
                    (text, lower) -> lower.contains("genes") && lower.contains("in")
                            && ATLAS_ACCESSION.matcher(text).find()),
            new Rule("experiments_for_gene", TaskType.EXPERIMENTS_FOR_GENE, 0.75,
                    (text, lower) -> containsAny(lower, "where is", "which experiments", "experiments where", "experiments for")
                            && containsAny(lower, "upregulated", "downregulated", "differentially expressed", "expression", "gene")),
            new Rule("experiments_with_gene", TaskType.EXPERIMENTS_FOR_GENE, 0.7,
                    (text, lower) -> containsAny(lower, "experiments for", "experiments with")
                            && containsAny(lower, "gene", "upregulated", "downregulated")),
            new Rule("cross_dataset_summary", TaskType.GENE_CROSS_DATASET_SUMMARY, 0.7,
                    (text, lower) -> containsAny(lower, "summarize", "summary", "across experiments")
                            && (containsAny(lower, "gene", "expression") || SYMBOL_LIKE.matcher(text).find())),
            new Rule("genes_agreement", TaskType.GENES_AGREEMENT, 0.75,
                    (text, lower) -> containsAny(lower, "agree", "same direction", "multiple experiments")
                            && containsAny(lower, "gene", "upregulated", "downregulated")),
            new Rule("genes_discordance", TaskType.GENES_DISCORDANCE, 0.75,
                    (text, lower) -> containsAny(lower, "discord", "opposite direction", "disagree")),
            new Rule("datasets_about_condition", TaskType.DATASET_SEARCH, 0.8,
                    (text, lower) -> lower.contains("about") && lower.contains("dataset") && hasAboutTopic(lower)),
            new Rule("expression_coverage", TaskType.GENE_EXPRESSION_DATASET_SEARCH, 0.75,
                    (text, lower) -> containsAny(lower, "gene expression", "expression dataset", "differential expression", "expression experiment")
                            && containsAny(lower, "dataset", "list", "what", "which", "experiments")),
            new Rule("mentions_dataset", TaskType.DATASET_SEARCH, 0.75,
                    (text, lower) -> containsAny(lower, "dataset", "study"))
    );

    @Override
    public Classification classify(String text, ContextPack pack) {
        String trimmed = text == null ? "" : text.trim();
        String lower = trimmed.toLowerCase();

        for (Rule rule : rules) {
            if (!pack.declares(rule.task())) {
                continue;
            }
            if (rule.matcher().test(trimmed, lower)) {
                log.debug("Question matched rule '{}' -> {}", rule.name(), rule.task());
                return new Classification(rule.task(), rule.confidence(),
                        "Classified as " + rule.task() + " (rule " + rule.name() + ")", false);
            }
        }
        TaskType fallback = pack.declares(FALLBACK_TASK) || pack.getTasks().isEmpty()
                ? FALLBACK_TASK
                : pack.getTasks().get(0).getId();
        log.debug("No classification rule matched; defaulting to {}", fallback);
        return new Classification(fallback, FALLBACK_CONFIDENCE,
                "Defaulted to " + fallback + " (low confidence)", true);
    }

    private static boolean containsAny(String lower, String... needles) {
        return Arrays.stream(needles).anyMatch(lower::contains);
    }

    private static boolean hasAboutTopic(String lower) {
        Matcher matcher = ABOUT_PHRASE.matcher(lower);
        if (!matcher.find()) {
            return false;
        }
        return Arrays.stream(matcher.group(1).trim().split("\\s+"))
                .anyMatch(word -> word.length() > 1 && !ABOUT_STOPWORDS.contains(word));
    }

    private record Rule(String name, TaskType task, double confidence, BiPredicate<String, String> matcher) {
    }
}
