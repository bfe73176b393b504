package tech.bizsuite.entitlements.catalog.suite;

import tech.bizsuite.entitlements.catalog.ApplicationDefinition;
import tech.bizsuite.entitlements.catalog.CapabilityCatalog;

import java.util.List;

/**
 * The built-in capability catalog of the business suite.
 *
 * Applications are declared one class per application. Add new application classes here;
 * the declaration order below is the catalog's iteration order.
 */
public final class BusinessSuiteCatalog {

    private static final List<ApplicationDefinition> APPLICATIONS = List.of(
        CrmApplication.INSTANCE,
        HrApplication.INSTANCE,
        AffiliateConnectApplication.INSTANCE,
        ProjectManagementApplication.INSTANCE,
        OperationsApplication.INSTANCE,
        AccountingApplication.INSTANCE
    );

    private BusinessSuiteCatalog() {}

    public static CapabilityCatalog create() {
        return CapabilityCatalog.of(APPLICATIONS);
    }
}
