package tech.bizsuite.entitlements.plan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * What a plan grants inside one application: every module (application-level wildcard)
 * or a per-module set of {@link PermissionGrant}s.
 */
public sealed interface ApplicationGrant permits ApplicationGrant.AllModules, ApplicationGrant.ModuleGrants {

    boolean isWildcard();

    /**
     * Every module and every permission currently defined for the application.
     */
    record AllModules() implements ApplicationGrant {
        @Override
        public boolean isWildcard() {
            return true;
        }

        @Override
        public String toString() {
            return PermissionGrant.WILDCARD;
        }
    }

    /**
     * Per-module grants in declaration order.
     */
    record ModuleGrants(Map<String, PermissionGrant> modules) implements ApplicationGrant {
        public ModuleGrants {
            modules = modules == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(modules));
        }

        public Optional<PermissionGrant> forModule(String moduleCode) {
            return Optional.ofNullable(modules.get(moduleCode));
        }

        @Override
        public boolean isWildcard() {
            return false;
        }
    }

    static ApplicationGrant allModules() {
        return new AllModules();
    }

    static ApplicationGrant modules(Map<String, PermissionGrant> modules) {
        return new ModuleGrants(modules);
    }
}
