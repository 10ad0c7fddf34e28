package com.kgagent.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jayway.jsonpath.JsonPath;
import com.kgagent.exception.KgAgentException;
import com.kgagent.exception.PlaceholderResolutionException;
import com.kgagent.exception.TemplateCompilationException;
import com.kgagent.model.Intent;
import com.kgagent.model.QueryStep;
import com.kgagent.model.RdfTerm;
import com.kgagent.model.SlotValue;
import com.kgagent.model.SparqlResult;
import com.kgagent.template.SparqlFragments;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Resolves {@code {{stepId.field}}} placeholders against the results of upstream steps.
 * <p>
 * A field names a result variable, either through the upstream step's {@code exports} map, directly,
 * or with an {@code _iris} / {@code _ids} suffix ({@code drug_iris -> ?drug}). All values bound to the
 * variable are used, deduplicated in row order. Resolution is pure: the same inputs always give the
 * same text, and text without placeholders is returned unchanged.
 */
@Component
@Slf4j
public class PlaceholderInterpolator {

    public static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_-]+)\\.([A-Za-z0-9_]+)\\s*\\}\\}");

    private static final List<String> FIELD_SUFFIXES = List.of("_iris", "_ids");

    private final ObjectMapper objectMapper = new ObjectMapper();

    public static boolean containsPlaceholder(String text) {
        return text != null && PLACEHOLDER.matcher(text).find();
    }

    /**
     * Step ids referenced by placeholders in the text, in order of appearance.
     */
    public static List<String> referencedSteps(String text) {
        List<String> ids = new ArrayList<>();
        if (text == null) {
            return ids;
        }
        Matcher matcher = PLACEHOLDER.matcher(text);
        while (matcher.find()) {
            if (!ids.contains(matcher.group(1))) {
                ids.add(matcher.group(1));
            }
        }
        return ids;
    }

    /**
     * Resolves placeholders in slot values. A value that is exactly one placeholder becomes a list
     * slot holding every upstream value; placeholders embedded in longer text are replaced with the
     * comma-joined values.
     *
     * @throws PlaceholderResolutionException if a placeholder yields no values.
     */
    public Intent resolveSlots(Intent intent, Map<String, QueryStep> steps, Map<String, SparqlResult> results) {
        Map<String, SlotValue> resolved = new LinkedHashMap<>();
        boolean changed = false;
        for (Map.Entry<String, SlotValue> slot : intent.getSlots().entrySet()) {
            SlotValue value = slot.getValue();
            if (value.asList().stream().noneMatch(PlaceholderInterpolator::containsPlaceholder)) {
                resolved.put(slot.getKey(), value);
                continue;
            }
            changed = true;
            List<String> expanded = new ArrayList<>();
            for (String element : value.asList()) {
                Matcher whole = PLACEHOLDER.matcher(element.trim());
                if (whole.matches()) {
                    lookup(whole.group(1), whole.group(2), steps, results).stream()
                            .map(RdfTerm::getValue)
                            .filter(v -> !expanded.contains(v))
                            .forEach(expanded::add);
                } else {
                    expanded.add(replaceAll(element, steps, results, terms -> terms.stream()
                            .map(RdfTerm::getValue)
                            .distinct()
                            .collect(Collectors.joining(", "))));
                }
            }
            boolean listSlot = value.isList() || PLACEHOLDER.matcher(value.asString().trim()).matches();
            resolved.put(slot.getKey(), listSlot ? SlotValue.of(expanded) : SlotValue.of(expanded.get(0)));
            log.debug("Resolved slot '{}' to {}", slot.getKey(), expanded);
        }
        return changed ? intent.toBuilder().clearSlots().slots(resolved).build() : intent;
    }

    /**
     * Resolves placeholders inside query text. IRIs render as {@code <iri>}, literals as quoted
     * escaped strings with their datatype or language tag, multiple values separated by a space
     * (a {@code VALUES} body).
     *
     * @throws PlaceholderResolutionException if a placeholder yields no values, or a value that
     *         cannot be written as SPARQL such as a blank node.
     */
    public String resolveQuery(String query, Map<String, QueryStep> steps, Map<String, SparqlResult> results) {
        if (!containsPlaceholder(query)) {
            return query;
        }
        try {
            return replaceAll(query, steps, results, terms -> terms.stream()
                    .map(SparqlFragments::term)
                    .collect(Collectors.joining(" ")));
        } catch (TemplateCompilationException e) {
            throw new PlaceholderResolutionException("Upstream value cannot be substituted: " + e.getMessage());
        }
    }

    private String replaceAll(String text, Map<String, QueryStep> steps, Map<String, SparqlResult> results,
                              Function<List<RdfTerm>, String> renderer) {
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String rendered = renderer.apply(lookup(matcher.group(1), matcher.group(2), steps, results));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(rendered));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /**
     * Distinct terms bound to the variable that {@code field} designates in the step's result.
     */
    List<RdfTerm> lookup(String stepId, String field, Map<String, QueryStep> steps, Map<String, SparqlResult> results) {
        String placeholder = "{{" + stepId + "." + field + "}}";
        QueryStep upstream = steps.get(stepId);
        if (upstream == null) {
            throw new PlaceholderResolutionException("Placeholder " + placeholder + " refers to unknown step '" + stepId + "'");
        }
        SparqlResult result = results.get(stepId);
        if (result == null) {
            throw new PlaceholderResolutionException("Placeholder " + placeholder + " has no upstream data: step '"
                    + stepId + "' has not completed");
        }

        String variable = variableFor(field, upstream, result);
        List<RdfTerm> terms = extractTerms(result, variable);
        if (terms.isEmpty()) {
            throw new PlaceholderResolutionException("Placeholder " + placeholder + " resolved to no upstream data: step '"
                    + stepId + "' returned no values for ?" + variable);
        }
        log.debug("{} -> {} value(s) of ?{}", placeholder, terms.size(), variable);
        return terms;
    }

    static String variableFor(String field, QueryStep upstream, SparqlResult result) {
        String exported = upstream.getExports().get(field);
        if (exported != null) {
            return exported;
        }
        if (result.getVars().contains(field)) {
            return field;
        }
        for (String suffix : FIELD_SUFFIXES) {
            if (field.endsWith(suffix)) {
                return field.substring(0, field.length() - suffix.length());
            }
        }
        return field;
    }

    private List<RdfTerm> extractTerms(SparqlResult result, String variable) {
        if (result.size() == 0) {
            return List.of();
        }
        List<Map<String, Object>> bound;
        try {
            String json = objectMapper.writeValueAsString(result);
            bound = JsonPath.read(json, "$.results.bindings[*]['" + variable + "']");
        } catch (JsonProcessingException e) {
            throw new KgAgentException("Failed to read upstream result for ?" + variable, e);
        }

        // "42" and "42"^^xsd:integer are different terms
        Set<RdfTerm> distinct = new LinkedHashSet<>();
        for (Map<String, Object> term : bound) {
            Object value = term.get("value");
            if (value != null) {
                String type = (String) term.get("type");
                distinct.add(new RdfTerm("typed-literal".equals(type) ? "literal" : type, value.toString(),
                        (String) term.get("datatype"), (String) term.get("xml:lang")));
            }
        }
        return new ArrayList<>(distinct);
    }
}
