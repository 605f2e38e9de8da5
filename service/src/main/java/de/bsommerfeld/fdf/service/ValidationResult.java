package de.bsommerfeld.fdf.service;

import com.google.common.collect.ImmutableList;
import de.bsommerfeld.fdf.layout.TransformWarning;

import java.util.List;

/**
 * Outcome of {@link FdfService#validate(String)}.
 *
 * @param valid    whether the document can be loaded
 * @param errors   messages of the failures that prevent loading
 * @param warnings non-fatal problems found while loading
 */
public record ValidationResult(boolean valid, List<String> errors, List<TransformWarning> warnings) {

    public ValidationResult {
        errors = ImmutableList.copyOf(errors);
        warnings = ImmutableList.copyOf(warnings);
    }

    static ValidationResult passed(List<TransformWarning> warnings) {
        return new ValidationResult(true, List.of(), warnings);
    }

    static ValidationResult failed(String error, List<TransformWarning> warnings) {
        return new ValidationResult(false, List.of(error), warnings);
    }
}
