package com.inp2ops.core;

import com.inp2ops.core.model.FeModel;
import com.inp2ops.core.translator.ConversionResult;
import com.inp2ops.core.translator.ConversionWarning;

import java.util.List;
import java.util.Objects;

/**
 * Everything one end-to-end conversion produced.
 *
 * @param model the parsed model
 * @param result translated commands and warnings
 * @param script rendered script text
 */
public record ConversionReport(
    FeModel model,
    ConversionResult result,
    String script
) {
    public ConversionReport {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(script, "script must not be null");
    }

    public List<ConversionWarning> warnings() {
        return result.warnings();
    }
}
