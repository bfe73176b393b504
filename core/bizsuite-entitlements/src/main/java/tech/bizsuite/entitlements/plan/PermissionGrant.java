package tech.bizsuite.entitlements.plan;

import tech.bizsuite.entitlements.catalog.ModuleDefinition;

import java.util.List;
import java.util.Optional;

/**
 * What a plan grants inside one module: either every permission the module currently
 * defines, or an explicit list of permission codes.
 *
 * The wildcard is resolved against the catalog at the time of use, never snapshotted,
 * so permissions added to a module later flow into every plan that uses it.
 */
public sealed interface PermissionGrant permits PermissionGrant.AllPermissions, PermissionGrant.ExplicitCodes {

    /**
     * Literal marker used for the wildcard in the persisted and legacy representations.
     */
    String WILDCARD = "*";

    /**
     * Codes granted inside the given module. A missing module expands a wildcard to nothing;
     * explicit codes are returned as declared whether or not the module knows them.
     */
    List<String> expand(Optional<ModuleDefinition> module);

    boolean isWildcard();

    /**
     * Every permission currently defined for the module.
     */
    record AllPermissions() implements PermissionGrant {
        @Override
        public List<String> expand(Optional<ModuleDefinition> module) {
            return module.map(ModuleDefinition::permissionCodes).orElse(List.of());
        }

        @Override
        public boolean isWildcard() {
            return true;
        }

        @Override
        public String toString() {
            return WILDCARD;
        }
    }

    /**
     * An explicit list of permission codes, kept in declaration order.
     * Duplicates are preserved; deduplication is left to the consumer.
     */
    record ExplicitCodes(List<String> codes) implements PermissionGrant {
        public ExplicitCodes {
            codes = codes == null ? List.of() : List.copyOf(codes);
        }

        @Override
        public List<String> expand(Optional<ModuleDefinition> module) {
            return codes;
        }

        @Override
        public boolean isWildcard() {
            return false;
        }

        @Override
        public String toString() {
            return codes.toString();
        }
    }

    static PermissionGrant all() {
        return new AllPermissions();
    }

    static PermissionGrant of(String... codes) {
        return new ExplicitCodes(List.of(codes));
    }

    static PermissionGrant of(List<String> codes) {
        return new ExplicitCodes(codes);
    }
}
