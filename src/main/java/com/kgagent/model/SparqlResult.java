package com.kgagent.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.Data;

/**
 * A SPARQL 1.1 JSON result set ({@code head.vars} + {@code results.bindings}).
 * <p>
 * Rows are kept in endpoint order. Each step of a plan owns its own instance.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SparqlResult {

    private Head head = new Head();

    private Results results = new Results();

    public static SparqlResult of(List<String> vars, List<Map<String, RdfTerm>> bindings) {
        SparqlResult result = new SparqlResult();
        result.getHead().setVars(new ArrayList<>(vars));
        result.getResults().setBindings(new ArrayList<>(bindings));
        return result;
    }

    public static SparqlResult empty(List<String> vars) {
        return of(vars, List.of());
    }

    @JsonIgnore
    public List<String> getVars() {
        return head.getVars();
    }

    @JsonIgnore
    public List<Map<String, RdfTerm>> getBindings() {
        return results.getBindings();
    }

    @JsonIgnore
    public int size() {
        return results.getBindings().size();
    }

    /**
     * Collects the distinct values bound to {@code variable} across all rows, in row order.
     */
    public List<String> distinctValues(String variable) {
        LinkedHashSet<String> values = new LinkedHashSet<>();
        getBindings().stream()
                .map(row -> row.get(variable))
                .filter(Objects::nonNull)
                .map(RdfTerm::getValue)
                .filter(Objects::nonNull)
                .forEach(values::add);
        return new ArrayList<>(values);
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Head {
        private List<String> vars = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Results {
        private List<Map<String, RdfTerm>> bindings = new ArrayList<>();

        public void addRow(Map<String, RdfTerm> row) {
            bindings.add(new LinkedHashMap<>(row));
        }
    }
}
