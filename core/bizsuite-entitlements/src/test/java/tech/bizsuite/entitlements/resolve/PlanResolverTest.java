package tech.bizsuite.entitlements.resolve;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.bizsuite.entitlements.catalog.ApplicationDefinition;
import tech.bizsuite.entitlements.catalog.CapabilityCatalog;
import tech.bizsuite.entitlements.catalog.ModuleDefinition;
import tech.bizsuite.entitlements.catalog.ResolvedPermission;
import tech.bizsuite.entitlements.catalog.suite.BusinessSuiteCatalog;
import tech.bizsuite.entitlements.common.Result;
import tech.bizsuite.entitlements.common.errors.UseCaseError;
import tech.bizsuite.entitlements.plan.CreditAllocation;
import tech.bizsuite.entitlements.plan.PlanAccessEntry;
import tech.bizsuite.entitlements.plan.PlanAccessProjection;
import tech.bizsuite.entitlements.plan.suite.SubscriptionPlans;
import tech.bizsuite.entitlements.query.MatrixQueryService;
import tech.bizsuite.entitlements.support.EntitlementFixtures;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PlanResolver.
 */
class PlanResolverTest {

    private static PlanResolver resolver(CapabilityCatalog catalog, PlanAccessEntry... plans) {
        return new PlanResolver(PlanAccessProjection.of(plans), new MatrixQueryService(catalog));
    }

    // ========================================
    // STRICT RESOLUTION
    // ========================================

    @Test
    @DisplayName("resolve should return exactly the listed permission for the starter scenario")
    void resolve_shouldReturnListedPermission_whenPlanListsOneCode() {
        // Arrange: crm.leads {read, create}, starter grants leads [read]
        PlanResolver resolver = resolver(EntitlementFixtures.crmLeadsCatalog(),
            PlanAccessEntry.builder("starter").grant("crm", "leads", "read").build());

        // Act
        List<ResolvedPermission> permissions = resolver.resolve("starter").orElseThrow();

        // Assert
        assertThat(permissions).hasSize(1);
        assertThat(permissions.get(0).fullCode()).isEqualTo("crm.leads.read");
        assertThat(permissions.get(0).name()).isEqualTo("View Leads");
    }

    @Test
    @DisplayName("resolve should fail with PLAN_NOT_FOUND for an unknown plan")
    void resolve_shouldFail_whenPlanUnknown() {
        PlanResolver resolver = resolver(EntitlementFixtures.crmLeadsCatalog(),
            PlanAccessEntry.builder("free").grant("crm", "leads", "read").build());

        Result<List<ResolvedPermission>> result = resolver.resolve("platinum");

        assertThat(result.isFailure()).isTrue();
        UseCaseError error = ((Result.Failure<List<ResolvedPermission>>) result).error();
        assertThat(error).isInstanceOf(UseCaseError.NotFoundError.class);
        assertThat(error.code()).isEqualTo(PlanResolver.PLAN_NOT_FOUND);
        assertThat(error.details()).containsEntry("planId", "platinum");
        assertThatThrownBy(result::orElseThrow)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("PLAN_NOT_FOUND");
    }

    @Test
    @DisplayName("resolve should fail with a validation error for a blank plan id")
    void resolve_shouldFail_whenPlanIdBlank() {
        PlanResolver resolver = resolver(EntitlementFixtures.crmLeadsCatalog(),
            PlanAccessEntry.builder("free").grant("crm", "leads", "read").build());

        Result<List<ResolvedPermission>> blank = resolver.resolve(" ");
        Result<List<ResolvedPermission>> missing = resolver.resolve(null);

        assertThat(((Result.Failure<List<ResolvedPermission>>) blank).error())
            .isInstanceOf(UseCaseError.ValidationError.class)
            .extracting(UseCaseError::code)
            .isEqualTo(PlanResolver.INVALID_PLAN_ID);
        assertThat(((Result.Failure<List<ResolvedPermission>>) missing).error())
            .isInstanceOf(UseCaseError.ValidationError.class)
            .extracting(UseCaseError::code)
            .isEqualTo(PlanResolver.INVALID_PLAN_ID);
    }

    @Test
    @DisplayName("resolveEntry should resolve a plan that is not part of the projection")
    void resolveEntry_shouldResolveDraftPlan() {
        PlanResolver resolver = resolver(EntitlementFixtures.crmLeadsCatalog());

        List<ResolvedPermission> permissions = resolver.resolveEntry(
            PlanAccessEntry.builder("draft").grantAll("crm", "leads").build());

        assertThat(permissions)
            .extracting(ResolvedPermission::fullCode)
            .containsExactly("crm.leads.read", "crm.leads.create");
        assertThat(resolver.resolve("draft").isFailure()).isTrue();
    }

    // ========================================
    // WILDCARDS
    // ========================================

    @Test
    @DisplayName("module wildcard should resolve exactly like listing every code of the module")
    void resolve_shouldTreatModuleWildcardAsExplicitList() {
        CapabilityCatalog catalog = EntitlementFixtures.crmDashboardCatalog();
        PlanResolver resolver = resolver(catalog,
            PlanAccessEntry.builder("wildcard").grantAll("crm", "dashboard").build(),
            PlanAccessEntry.builder("explicit").grant("crm", "dashboard", "view", "customize", "export").build());

        List<ResolvedPermission> wildcard = resolver.resolve("wildcard").orElseThrow();
        List<ResolvedPermission> explicit = resolver.resolve("explicit").orElseThrow();

        assertThat(wildcard).containsExactlyElementsOf(explicit);
        assertThat(wildcard).extracting(ResolvedPermission::code).containsExactly("view", "customize", "export");
    }

    @Test
    @DisplayName("module wildcard should match the explicit list even when a catalog name is empty")
    void resolve_shouldTreatWildcardAsExplicitList_whenNameEmpty() {
        CapabilityCatalog catalog = CapabilityCatalog.of(ApplicationDefinition.builder("crm")
            .name("CRM")
            .module(ModuleDefinition.builder("notes").permission("a", "", "").build())
            .build());
        PlanResolver resolver = resolver(catalog,
            PlanAccessEntry.builder("wildcard").grantAll("crm", "notes").build(),
            PlanAccessEntry.builder("explicit").grant("crm", "notes", "a").build());

        List<ResolvedPermission> wildcard = resolver.resolve("wildcard").orElseThrow();

        assertThat(wildcard).containsExactlyElementsOf(resolver.resolve("explicit").orElseThrow());
        assertThat(wildcard.get(0).name()).isEqualTo("a");
    }

    @Test
    @DisplayName("application wildcard should expand every module and permission of the application")
    void resolve_shouldExpandApplicationWildcard() {
        PlanResolver resolver = resolver(EntitlementFixtures.crmDashboardCatalog(),
            PlanAccessEntry.builder("all").grantApplication("crm").build());

        assertThat(resolver.resolve("all").orElseThrow())
            .extracting(ResolvedPermission::fullCode)
            .containsExactly("crm.dashboard.view", "crm.dashboard.customize", "crm.dashboard.export",
                "crm.leads.read", "crm.leads.create");
    }

    @Test
    @DisplayName("wildcard on a module missing from the catalog should resolve to nothing")
    void resolve_shouldSkipWildcard_whenModuleMissing() {
        PlanResolver resolver = resolver(EntitlementFixtures.crmLeadsCatalog(),
            PlanAccessEntry.builder("p").grantAll("crm", "tickets").grant("crm", "leads", "create").build());

        assertThat(resolver.resolve("p").orElseThrow())
            .extracting(ResolvedPermission::fullCode)
            .containsExactly("crm.leads.create");
    }

    // ========================================
    // EXPLICIT CODES
    // ========================================

    @Test
    @DisplayName("explicit codes missing from the catalog should still be emitted with fallback name")
    void resolve_shouldEmitUnknownCodesWithFallbacks() {
        PlanResolver resolver = resolver(EntitlementFixtures.crmLeadsCatalog(),
            PlanAccessEntry.builder("p").grant("crm", "leads", "archive").build());

        ResolvedPermission permission = resolver.resolve("p").orElseThrow().get(0);

        assertThat(permission.fullCode()).isEqualTo("crm.leads.archive");
        assertThat(permission.name()).isEqualTo("archive");
        assertThat(permission.description()).isEmpty();
    }

    @Test
    @DisplayName("resolve should keep duplicates and declaration order")
    void resolve_shouldNotDeduplicate() {
        PlanResolver resolver = resolver(EntitlementFixtures.crmDashboardCatalog(),
            PlanAccessEntry.builder("p")
                .grant("crm", "leads", "create", "read", "create")
                .grant("crm", "dashboard", "view")
                .build());

        assertThat(resolver.resolve("p").orElseThrow())
            .extracting(ResolvedPermission::fullCode)
            .containsExactly("crm.leads.create", "crm.leads.read", "crm.leads.create", "crm.dashboard.view");
        assertThat(resolver.resolveFullCodes("p").orElseThrow())
            .containsExactly("crm.leads.create", "crm.leads.read", "crm.dashboard.view");
    }

    // ========================================
    // SHIPPED PLANS
    // ========================================

    @Test
    @DisplayName("every resolved code of a shipped plan should stay within the plan's declared scope")
    void resolve_shouldStayInsideDeclaredScope_forShippedPlans() {
        PlanAccessProjection projection = SubscriptionPlans.create();
        PlanResolver resolver = new PlanResolver(projection, new MatrixQueryService(BusinessSuiteCatalog.create()));

        for (PlanAccessEntry entry : projection.entries()) {
            List<ResolvedPermission> permissions = resolver.resolve(entry.planId()).orElseThrow();

            assertThat(permissions).as(entry.planId()).isNotEmpty();
            for (ResolvedPermission permission : permissions) {
                assertThat(entry.grantsModule(permission.appCode(), permission.moduleCode()))
                    .as("%s grants %s", entry.planId(), permission.fullCode())
                    .isTrue();
                assertThat(permission.fullCode())
                    .startsWith(permission.appCode() + "." + permission.moduleCode() + ".");
            }
        }
    }

    @Test
    @DisplayName("higher tiers should resolve to more permissions")
    void resolve_shouldGrowWithTier() {
        PlanResolver resolver = new PlanResolver(SubscriptionPlans.create(),
            new MatrixQueryService(BusinessSuiteCatalog.create()));

        Set<String> free = resolver.resolveFullCodes("free").orElseThrow();
        Set<String> enterprise = resolver.resolveFullCodes("enterprise").orElseThrow();

        assertThat(free).contains("crm.leads.read", "accounting.invoices.create", "crm.dashboard.view");
        assertThat(enterprise.size()).isGreaterThan(free.size());
    }

    // ========================================
    // CREDITS & DETAILS
    // ========================================

    @Test
    @DisplayName("planCredits should default to no credits for an unknown plan")
    void planCredits_shouldDefault_whenPlanUnknown() {
        PlanResolver resolver = new PlanResolver(SubscriptionPlans.create(),
            new MatrixQueryService(BusinessSuiteCatalog.create()));

        assertThat(resolver.planCredits("starter")).isEqualTo(new CreditAllocation(60000, 0, 365));
        assertThat(resolver.planCredits("does-not-exist")).isEqualTo(new CreditAllocation(0, 0, 30));
    }

    @Test
    @DisplayName("describePlan should report the entry with its resolved permissions")
    void describePlan_shouldReportEntryAndPermissions() {
        PlanResolver resolver = resolver(EntitlementFixtures.crmLeadsCatalog(),
            PlanAccessEntry.builder("starter").grant("crm", "leads", "read", "create").credits(10, 0, 7).build());

        PlanAccessDetails details = resolver.describePlan("starter").orElseThrow();

        assertThat(details.planId()).isEqualTo("starter");
        assertThat(details.permissionCount()).isEqualTo(2);
        assertThat(details.entry().credits().expiryDays()).isEqualTo(7);
        assertThat(resolver.describePlan("nope").isFailure()).isTrue();
    }
}
