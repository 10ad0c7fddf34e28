package com.kgagent.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One bound value in a SPARQL JSON result row.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class RdfTerm {

    /**
     * {@code uri}, {@code literal}, {@code typed-literal} or {@code bnode}.
     */
    private String type;

    private String value;

    private String datatype;

    @JsonProperty("xml:lang")
    private String lang;

    public static RdfTerm uri(String value) {
        return new RdfTerm("uri", value, null, null);
    }

    public static RdfTerm literal(String value) {
        return new RdfTerm("literal", value, null, null);
    }

    public boolean isUri() {
        return "uri".equals(type);
    }
}
