package tech.bizsuite.entitlements.role;

/**
 * Exception thrown when a role configuration cannot be converted to or from JSON.
 */
public class RoleConfigSerializationException extends RuntimeException {

    public RoleConfigSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
