package tech.bizsuite.entitlements.catalog;

/**
 * Fully-qualified permission code.
 *
 * Format: {appCode}.{moduleCode}.{permissionCode}
 *
 * Examples:
 * - crm.leads.read
 * - accounting.invoices.send
 * - project_management.tasks.change_status
 *
 * This three-segment string is the storage and wire format used by persisted roles
 * and authorization checks, so no segment may contain a literal dot.
 */
public record PermissionCode(
    String appCode,
    String moduleCode,
    String code
) {

    public static final char SEPARATOR = '.';

    public PermissionCode {
        validateSegment(appCode, "appCode");
        validateSegment(moduleCode, "moduleCode");
        validateSegment(code, "code");
    }

    /**
     * Parse a fully-qualified code string.
     *
     * @param fullCode String such as "crm.leads.read"
     * @return Parsed code
     * @throws IllegalArgumentException if the string does not have exactly three non-blank segments
     */
    public static PermissionCode parse(String fullCode) {
        if (fullCode == null || fullCode.isBlank()) {
            throw new IllegalArgumentException("Permission code cannot be null or empty");
        }
        String[] parts = fullCode.split("\\.", -1);
        if (parts.length != 3) {
            throw new IllegalArgumentException("Invalid permission code format: " + fullCode);
        }
        return new PermissionCode(parts[0], parts[1], parts[2]);
    }

    /**
     * Render the dot-joined representation of the three segments.
     */
    public static String format(String appCode, String moduleCode, String code) {
        return new PermissionCode(appCode, moduleCode, code).toString();
    }

    /**
     * Whether a string could be used as one segment of a fully-qualified code.
     */
    public static boolean isValidSegment(String segment) {
        return segment != null && !segment.isBlank() && segment.indexOf(SEPARATOR) < 0;
    }

    private static void validateSegment(String segment, String segmentName) {
        if (segment == null || segment.isBlank()) {
            throw new IllegalArgumentException(segmentName + " cannot be null or empty");
        }
        if (segment.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException(segmentName + " cannot contain '" + SEPARATOR + "': " + segment);
        }
    }

    @Override
    public String toString() {
        return appCode + SEPARATOR + moduleCode + SEPARATOR + code;
    }
}
