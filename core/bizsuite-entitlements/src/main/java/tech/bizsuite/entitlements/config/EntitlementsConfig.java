package tech.bizsuite.entitlements.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for the entitlement engine.
 *
 * Example configuration:
 * <pre>
 * bizsuite.entitlements.fallback-plan=free
 * bizsuite.entitlements.super-admin.color=#dc2626
 * bizsuite.entitlements.derived-maps.cache-enabled=true
 * bizsuite.entitlements.validation.fail-on-error=true
 * </pre>
 */
@StaticInitSafe
@ConfigMapping(prefix = "bizsuite.entitlements")
public interface EntitlementsConfig {

    /**
     * Plan substituted by the role provisioner when asked for an unknown plan id.
     */
    @WithName("fallback-plan")
    @WithDefault("free")
    String fallbackPlan();

    /**
     * Metadata of the administrator role provisioned for every new tenant.
     */
    SuperAdmin superAdmin();

    DerivedMaps derivedMaps();

    Validation validation();

    interface SuperAdmin {

        @WithDefault("Organization Admin")
        String roleName();

        @WithDefault("Full administrative access to all features and settings. This role has complete control over the organization.")
        String description();

        /**
         * Higher is more authoritative.
         */
        @WithDefault("100")
        int priority();

        @WithDefault("organization")
        String scope();

        @WithDefault("#dc2626")
        String color();
    }

    interface DerivedMaps {

        /**
         * Application whose subtree the module access map and legacy action map are built from.
         */
        @WithDefault("accounting")
        String application();

        /**
         * Memoize derived maps keyed on the catalog fingerprint.
         */
        @WithDefault("false")
        boolean cacheEnabled();

        @WithDefault("16")
        long cacheMaxSize();
    }

    interface Validation {

        /**
         * Run the catalog and plan consistency check when the application starts.
         */
        @WithDefault("true")
        boolean onStartup();

        /**
         * Abort startup when the consistency check reports defects.
         */
        @WithDefault("false")
        boolean failOnError();
    }
}
