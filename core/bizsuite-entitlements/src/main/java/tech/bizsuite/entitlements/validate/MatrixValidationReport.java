package tech.bizsuite.entitlements.validate;

import tech.bizsuite.entitlements.query.MatrixSummary;

import java.util.List;

/**
 * Validation outcome together with the size of the validated catalog.
 */
public record MatrixValidationReport(
    boolean valid,
    List<String> errors,
    MatrixSummary summary
) {

    public MatrixValidationReport {
        errors = List.copyOf(errors);
    }
}
