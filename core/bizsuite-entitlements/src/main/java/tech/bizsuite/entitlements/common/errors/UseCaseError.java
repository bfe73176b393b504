package tech.bizsuite.entitlements.common.errors;

import java.util.Map;

/**
 * Sealed error hierarchy for entitlement operation failures.
 *
 * Errors are categorized by type so that callers (HTTP layer, onboarding flow)
 * can map them consistently.
 */
public sealed interface UseCaseError {

    String code();
    String message();
    Map<String, Object> details();

    /**
     * Input validation failed (blank identifier, malformed code, etc.)
     */
    record ValidationError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}

    /**
     * Referenced entity does not exist (unknown plan, unknown application).
     */
    record NotFoundError(
        String code,
        String message,
        Map<String, Object> details
    ) implements UseCaseError {}
}
