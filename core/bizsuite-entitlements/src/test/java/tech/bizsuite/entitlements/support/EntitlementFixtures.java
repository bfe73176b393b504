package tech.bizsuite.entitlements.support;

import org.mockito.quality.Strictness;
import tech.bizsuite.entitlements.catalog.ApplicationDefinition;
import tech.bizsuite.entitlements.catalog.CapabilityCatalog;
import tech.bizsuite.entitlements.catalog.ModuleDefinition;
import tech.bizsuite.entitlements.config.EntitlementsConfig;

import java.util.HashMap;
import java.util.Map;

import static org.mockito.Mockito.*;

/**
 * Small catalogs and config instances shared by the unit tests.
 */
public final class EntitlementFixtures {

    private static final String PREFIX = "bizsuite.entitlements.";

    private static final Map<String, String> DEFAULTS = Map.ofEntries(
        Map.entry(PREFIX + "fallback-plan", "free"),
        Map.entry(PREFIX + "super-admin.role-name", "Organization Admin"),
        Map.entry(PREFIX + "super-admin.description",
            "Full administrative access to all features and settings. This role has complete control over the organization."),
        Map.entry(PREFIX + "super-admin.priority", "100"),
        Map.entry(PREFIX + "super-admin.scope", "organization"),
        Map.entry(PREFIX + "super-admin.color", "#dc2626"),
        Map.entry(PREFIX + "derived-maps.application", "accounting"),
        Map.entry(PREFIX + "derived-maps.cache-enabled", "false"),
        Map.entry(PREFIX + "derived-maps.cache-max-size", "16"),
        Map.entry(PREFIX + "validation.on-startup", "true"),
        Map.entry(PREFIX + "validation.fail-on-error", "false"));

    private EntitlementFixtures() {
    }

    /**
     * crm → leads {read, create}
     */
    public static CapabilityCatalog crmLeadsCatalog() {
        return CapabilityCatalog.of(ApplicationDefinition.builder("crm")
            .name("CRM")
            .module(ModuleDefinition.builder("leads")
                .name("Leads")
                .permission("read", "View Leads", "View lead information")
                .permission("create", "Create Leads", "Create new leads")
                .build())
            .build());
    }

    /**
     * crm → dashboard {view, customize, export}, leads {read, create}
     */
    public static CapabilityCatalog crmDashboardCatalog() {
        return CapabilityCatalog.of(ApplicationDefinition.builder("crm")
            .name("CRM")
            .module(ModuleDefinition.builder("dashboard")
                .name("Dashboard")
                .permission("view", "View Dashboard", "Access the dashboard")
                .permission("customize", "Customize Dashboard", "Rearrange dashboard widgets")
                .permission("export", "Export Dashboard", "Export dashboard data")
                .build())
            .module(ModuleDefinition.builder("leads")
                .name("Leads")
                .permission("read", "View Leads", "View lead information")
                .permission("create", "Create Leads", "Create new leads")
                .build())
            .build());
    }

    /**
     * accounting → invoices {read, create, send}
     */
    public static CapabilityCatalog invoicesCatalog() {
        return CapabilityCatalog.of(ApplicationDefinition.builder("accounting")
            .name("Accounting")
            .module(invoices())
            .build());
    }

    public static ModuleDefinition invoices() {
        return ModuleDefinition.builder("invoices")
            .name("Invoices")
            .permission("read", "View Invoices", "View invoices")
            .permission("create", "Create Invoices", "Create invoices")
            .permission("send", "Send Invoices", "Email invoices to customers")
            .build();
    }

    public static EntitlementsConfig defaultConfig() {
        return config(Map.of());
    }

    /**
     * Stubbed config mapping: the shipped defaults overridden by the given properties.
     *
     * @param properties full property names, e.g. {@code bizsuite.entitlements.fallback-plan}
     */
    public static EntitlementsConfig config(Map<String, String> properties) {
        Map<String, String> values = new HashMap<>(DEFAULTS);
        values.putAll(properties);

        EntitlementsConfig.SuperAdmin superAdmin = stub(EntitlementsConfig.SuperAdmin.class);
        when(superAdmin.roleName()).thenReturn(values.get(PREFIX + "super-admin.role-name"));
        when(superAdmin.description()).thenReturn(values.get(PREFIX + "super-admin.description"));
        when(superAdmin.priority()).thenReturn(Integer.parseInt(values.get(PREFIX + "super-admin.priority")));
        when(superAdmin.scope()).thenReturn(values.get(PREFIX + "super-admin.scope"));
        when(superAdmin.color()).thenReturn(values.get(PREFIX + "super-admin.color"));

        EntitlementsConfig.DerivedMaps derivedMaps = stub(EntitlementsConfig.DerivedMaps.class);
        when(derivedMaps.application()).thenReturn(values.get(PREFIX + "derived-maps.application"));
        when(derivedMaps.cacheEnabled()).thenReturn(Boolean.parseBoolean(values.get(PREFIX + "derived-maps.cache-enabled")));
        when(derivedMaps.cacheMaxSize()).thenReturn(Long.parseLong(values.get(PREFIX + "derived-maps.cache-max-size")));

        EntitlementsConfig.Validation validation = stub(EntitlementsConfig.Validation.class);
        when(validation.onStartup()).thenReturn(Boolean.parseBoolean(values.get(PREFIX + "validation.on-startup")));
        when(validation.failOnError()).thenReturn(Boolean.parseBoolean(values.get(PREFIX + "validation.fail-on-error")));

        EntitlementsConfig config = stub(EntitlementsConfig.class);
        when(config.fallbackPlan()).thenReturn(values.get(PREFIX + "fallback-plan"));
        when(config.superAdmin()).thenReturn(superAdmin);
        when(config.derivedMaps()).thenReturn(derivedMaps);
        when(config.validation()).thenReturn(validation);
        return config;
    }

    // Lenient: each test reads only the groups it needs.
    private static <T> T stub(Class<T> type) {
        return mock(type, withSettings().strictness(Strictness.LENIENT));
    }
}
