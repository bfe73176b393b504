package tech.bizsuite.entitlements.catalog;

/**
 * An atomic grantable action inside a module.
 *
 * The code is unique within its module only; the globally unique identifier is the
 * {@link PermissionCode} formed together with the owning application and module.
 *
 * Null fields are normalized to empty strings rather than rejected so that
 * authoring mistakes surface through the matrix validator instead of failing class
 * initialization of the whole catalog.
 */
public record PermissionDefinition(
    String code,
    String name,
    String description
) {

    public PermissionDefinition {
        code = code == null ? "" : code;
        name = name == null ? "" : name;
        description = description == null ? "" : description;
    }

    /**
     * Static factory method to create a permission.
     */
    public static PermissionDefinition make(String code, String name, String description) {
        return new PermissionDefinition(code, name, description);
    }

    /**
     * Qualify this permission with its owning application and module.
     */
    public PermissionCode qualify(String appCode, String moduleCode) {
        return new PermissionCode(appCode, moduleCode, code);
    }

    @Override
    public String toString() {
        return code + " (" + name + ")";
    }
}
