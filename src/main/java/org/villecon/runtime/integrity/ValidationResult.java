package org.villecon.runtime.integrity;

import java.util.List;

/**
 * Outcome of {@link IntegrityGuard#validate(org.villecon.runtime.model.Village)}.
 *
 * @param valid    {@code true} if no invariant is violated.
 * @param errors   field-level invariant violations.
 * @param warnings suspicious but legal states.
 */
public record ValidationResult(boolean valid, List<String> errors, List<String> warnings) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }
}
