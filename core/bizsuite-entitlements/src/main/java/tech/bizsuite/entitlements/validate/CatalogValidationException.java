package tech.bizsuite.entitlements.validate;

import java.util.List;

/**
 * Exception thrown at startup when the catalog or the plan projection has defects
 * and {@code bizsuite.entitlements.validation.fail-on-error} is set.
 */
public class CatalogValidationException extends RuntimeException {

    private final List<String> errors;

    public CatalogValidationException(List<String> errors) {
        super("Entitlement data has " + errors.size() + " defect(s): " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
