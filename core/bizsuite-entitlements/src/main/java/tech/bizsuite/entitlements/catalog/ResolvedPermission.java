package tech.bizsuite.entitlements.catalog;

/**
 * A permission together with the application and module it belongs to.
 *
 * This is the unit the plan resolver emits and the query service lists. When the
 * permission is referenced by a plan but missing from the catalog, {@code name} falls
 * back to the bare code and {@code description} to an empty string.
 */
public record ResolvedPermission(
    String code,
    String name,
    String description,
    String fullCode,
    String appCode,
    String moduleCode
) {

    /**
     * An empty catalog name falls back to the code, the same as a permission missing from the catalog.
     */
    public static ResolvedPermission of(String appCode, String moduleCode, PermissionDefinition permission) {
        String name = permission.name();
        return new ResolvedPermission(
            permission.code(),
            name == null || name.isEmpty() ? permission.code() : name,
            permission.description() == null ? "" : permission.description(),
            fullCode(appCode, moduleCode, permission.code()),
            appCode,
            moduleCode
        );
    }

    /**
     * Dot-join without validation. Malformed catalog entries are the validator's concern,
     * listing and resolution must not fail on them.
     */
    public static String fullCode(String appCode, String moduleCode, String code) {
        return appCode + PermissionCode.SEPARATOR + moduleCode + PermissionCode.SEPARATOR + code;
    }

    public static ResolvedPermission of(String appCode, String moduleCode, String code,
                                        String name, String description) {
        return new ResolvedPermission(code, name, description, fullCode(appCode, moduleCode, code),
            appCode, moduleCode);
    }

    public PermissionCode permissionCode() {
        return PermissionCode.parse(fullCode);
    }
}
