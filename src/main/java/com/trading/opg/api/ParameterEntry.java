package com.trading.opg.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * Wire form of a single parameter: either {@code {"column": "..."}} or
 * {@code {"value": n}}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ParameterEntry {
    private String column;
    private Double value;

    public static ParameterEntry column(String name) {
        ParameterEntry e = new ParameterEntry();
        e.setColumn(name);
        return e;
    }

    public static ParameterEntry value(double v) {
        ParameterEntry e = new ParameterEntry();
        e.setValue(v);
        return e;
    }
}
