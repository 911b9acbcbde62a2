package com.klinevault.data.cache;

import com.klinevault.core.model.Gap;

import java.util.List;

/**
 * Report on one cached day.
 */
public record ValidationResult(boolean valid, List<String> errors, int rowCount, List<Gap> gaps) {

    public ValidationResult {
        errors = List.copyOf(errors);
        gaps = List.copyOf(gaps);
    }

    public static ValidationResult ok(int rowCount, List<Gap> gaps) {
        return new ValidationResult(true, List.of(), rowCount, gaps);
    }

    public static ValidationResult failed(String error) {
        return new ValidationResult(false, List.of(error), 0, List.of());
    }

    public boolean hasGaps() {
        return !gaps.isEmpty();
    }
}
