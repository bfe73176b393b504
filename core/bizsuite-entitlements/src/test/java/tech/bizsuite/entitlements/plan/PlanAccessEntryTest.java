package tech.bizsuite.entitlements.plan;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.bizsuite.entitlements.catalog.ModuleDefinition;
import tech.bizsuite.entitlements.support.EntitlementFixtures;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class PlanAccessEntryTest {

    @Test
    @DisplayName("builder should derive applications and modules listings from the grants")
    void builder_shouldDeriveListings() {
        PlanAccessEntry entry = PlanAccessEntry.builder("starter")
            .grant("crm", "leads", "read")
            .grantAll("crm", "dashboard")
            .grant("hr", "employees", "read", "create")
            .build();

        assertThat(entry.applications()).containsExactly("crm", "hr");
        assertThat(entry.modules().get("crm")).containsExactly("leads", "dashboard");
        assertThat(entry.modules().get("hr")).containsExactly("employees");
        assertThat(entry.grantFor("crm")).get().isInstanceOf(ApplicationGrant.ModuleGrants.class);
        assertThat(entry.credits()).isEqualTo(CreditAllocation.NONE);
    }

    @Test
    @DisplayName("grantsModule should honour module listings and the application wildcard")
    void grantsModule_shouldCheckDeclaredScope() {
        PlanAccessEntry entry = PlanAccessEntry.builder("custom")
            .grant("crm", "leads", "read")
            .grantApplication("hr")
            .build();

        assertThat(entry.grantsModule("crm", "leads")).isTrue();
        assertThat(entry.grantsModule("crm", "contacts")).isFalse();
        assertThat(entry.grantsModule("hr", "payroll")).isTrue();
        assertThat(entry.grantsModule("accounting", "invoices")).isFalse();
        assertThat(entry.modules()).doesNotContainKey("hr");
    }

    @Test
    @DisplayName("builder should refuse mixing the application wildcard with module grants")
    void builder_shouldThrow_whenWildcardMixedWithModuleGrants() {
        assertThatThrownBy(() -> PlanAccessEntry.builder("p")
                .grant("crm", "leads", "read")
                .grantApplication("crm"))
            .isInstanceOf(IllegalStateException.class);

        assertThatThrownBy(() -> PlanAccessEntry.builder("p")
                .grantApplication("crm")
                .grant("crm", "leads", "read"))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("wildcard grant should expand to the module's current permissions")
    void permissionGrant_shouldExpandWildcardAgainstModule() {
        ModuleDefinition invoices = EntitlementFixtures.invoices();

        assertThat(PermissionGrant.all().expand(Optional.of(invoices))).containsExactly("read", "create", "send");
        assertThat(PermissionGrant.all().expand(Optional.empty())).isEmpty();
        assertThat(PermissionGrant.of("send", "unknown").expand(Optional.of(invoices)))
            .containsExactly("send", "unknown");
    }

    @Test
    @DisplayName("credit allocation should reject negative credits and non-positive expiry")
    void creditAllocation_shouldValidate() {
        assertThatThrownBy(() -> new CreditAllocation(-1, 0, 30)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CreditAllocation(0, 0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThat(new CreditAllocation(1000, 0, 30).freeCredits()).isEqualTo(1000L);
    }

    @Test
    @DisplayName("projection should reject two entries with the same plan id")
    void projection_shouldThrow_whenPlanIdDuplicated() {
        PlanAccessEntry a = PlanAccessEntry.builder("free").build();
        PlanAccessEntry b = PlanAccessEntry.builder("free").build();

        assertThatThrownBy(() -> PlanAccessProjection.of(List.of(a, b)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("free");
    }
}
