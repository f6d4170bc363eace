package com.inp2ops.core.mapping;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * One command of the static analysis template.
 *
 * @param command target command name
 * @param arguments literal arguments: strings, integers or doubles
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalysisStep(
    @JsonProperty("command") String command,
    @JsonProperty("args") List<Object> arguments
) {
    public AnalysisStep {
        Objects.requireNonNull(command, "command must not be null");
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }
}
