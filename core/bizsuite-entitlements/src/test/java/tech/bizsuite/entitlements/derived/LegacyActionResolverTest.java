package tech.bizsuite.entitlements.derived;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.bizsuite.entitlements.catalog.CapabilityCatalog;
import tech.bizsuite.entitlements.catalog.suite.BusinessSuiteCatalog;
import tech.bizsuite.entitlements.support.EntitlementFixtures;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for LegacyActionResolver and ModuleAccessResolver over the shipped catalog.
 */
class LegacyActionResolverTest {

    private final CapabilityCatalog catalog = BusinessSuiteCatalog.create();
    private final DerivedMapCache derivedMaps = new DerivedMapCache(
        catalog,
        new ModuleAccessMapBuilder(catalog),
        new LegacyActionMapBuilder(catalog),
        EntitlementFixtures.defaultConfig());

    private final LegacyActionResolver legacy = new LegacyActionResolver(derivedMaps);
    private final ModuleAccessResolver modules = new ModuleAccessResolver(derivedMaps);

    // ========================================
    // LEGACY ACTIONS
    // ========================================

    @Test
    @DisplayName("satisfies should accept any one of the mapped permissions")
    void satisfies_shouldAcceptAnyMappedPermission() {
        assertThat(legacy.satisfies("manage_invoices", Set.of("accounting.invoices.send"))).isTrue();
        assertThat(legacy.satisfies("view_invoices", Set.of("accounting.invoices.send"))).isFalse();
        assertThat(legacy.satisfies("view_invoices", Set.of("accounting.invoices.read_all"))).isTrue();
    }

    @Test
    @DisplayName("composite actions should be satisfied by either source module")
    void satisfies_shouldHonourComposites() {
        assertThat(legacy.satisfies("view_accounting", Set.of("accounting.chart_of_accounts.read"))).isTrue();
        assertThat(legacy.satisfies("manage_accounting", Set.of("accounting.general_ledger.post"))).isTrue();
        assertThat(legacy.satisfies("manage_entities", Set.of("accounting.multi_entity.consolidate"))).isTrue();
    }

    @Test
    @DisplayName("unknown actions should never be satisfied")
    void satisfies_shouldRejectUnknownActions() {
        assertThat(legacy.isKnown("manage_spaceships")).isFalse();
        assertThat(legacy.expand("manage_spaceships")).isEmpty();
        assertThat(legacy.satisfies("manage_spaceships", Set.of("accounting.invoices.read"))).isFalse();
    }

    // ========================================
    // MODULE ACCESS
    // ========================================

    @Test
    @DisplayName("unlockedModules should union the aliases of every granted module")
    void unlockedModules_shouldUnionAliases() {
        Set<String> unlocked = modules.unlockedModules(List.of(
            "accounting.invoices.read",
            "accounting.banking.read",
            "accounting.invoices.create",
            "crm.leads.read",
            "malformed"));

        assertThat(unlocked).containsExactly(
            "invoices", "accounts_receivable", "banking", "bank_accounts", "bank_reconciliation", "cash_flow");
    }

    @Test
    @DisplayName("unlockedModules should skip null codes")
    void unlockedModules_shouldSkipNullCodes() {
        Set<String> unlocked = modules.unlockedModules(Arrays.asList("accounting.invoices.read", null));

        assertThat(unlocked).containsExactly("invoices", "accounts_receivable");
    }
}
