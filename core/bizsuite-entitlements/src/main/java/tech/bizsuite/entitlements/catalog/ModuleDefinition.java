package tech.bizsuite.entitlements.catalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A functional area inside an application, owning an ordered sequence of permissions.
 *
 * The module code is unique within its application, not globally: both "crm" and
 * "accounting" declare a "dashboard" module.
 */
public record ModuleDefinition(
    String moduleCode,
    String moduleName,
    String description,
    boolean core,
    List<PermissionDefinition> permissions
) {

    public ModuleDefinition {
        moduleCode = moduleCode == null ? "" : moduleCode;
        moduleName = moduleName == null ? "" : moduleName;
        description = description == null ? "" : description;
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
    }

    /**
     * Find a permission of this module by its code.
     */
    public Optional<PermissionDefinition> findPermission(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return permissions.stream()
            .filter(p -> p.code().equals(code))
            .findFirst();
    }

    /**
     * Permission codes in declaration order.
     */
    public List<String> permissionCodes() {
        return permissions.stream().map(PermissionDefinition::code).toList();
    }

    public static Builder builder(String moduleCode) {
        return new Builder(moduleCode);
    }

    /**
     * Fluent builder used by the catalog declarations.
     */
    public static final class Builder {
        private final String moduleCode;
        private String moduleName;
        private String description;
        private boolean core;
        private final List<PermissionDefinition> permissions = new ArrayList<>();

        private Builder(String moduleCode) {
            this.moduleCode = moduleCode;
        }

        public Builder name(String moduleName) {
            this.moduleName = moduleName;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder core(boolean core) {
            this.core = core;
            return this;
        }

        public Builder permission(String code, String name, String description) {
            permissions.add(PermissionDefinition.make(code, name, description));
            return this;
        }

        public Builder permission(PermissionDefinition permission) {
            permissions.add(permission);
            return this;
        }

        public ModuleDefinition build() {
            return new ModuleDefinition(moduleCode, moduleName, description, core, permissions);
        }
    }
}
