package tech.bizsuite.entitlements.role;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.bizsuite.entitlements.catalog.suite.BusinessSuiteCatalog;
import tech.bizsuite.entitlements.plan.CreditAllocation;
import tech.bizsuite.entitlements.plan.suite.SubscriptionPlans;
import tech.bizsuite.entitlements.support.EntitlementFixtures;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TenantRoleOnboarding with a mocked role store.
 */
@ExtendWith(MockitoExtension.class)
class TenantRoleOnboardingTest {

    @Mock
    private RoleConfigStore store;

    private TenantRoleOnboarding onboarding;

    @BeforeEach
    void setUp() {
        RoleProvisioner provisioner = new RoleProvisioner(
            BusinessSuiteCatalog.create(), SubscriptionPlans.create(), EntitlementFixtures.defaultConfig());
        onboarding = new TenantRoleOnboarding(provisioner, store);
    }

    @Test
    @DisplayName("provision should store the role and return the plan's credits")
    void provision_shouldStoreRoleAndReturnCredits() {
        // Act
        ProvisionedRole provisioned = onboarding.provision("professional", "tnt_1", "usr_1");

        // Assert
        ArgumentCaptor<RoleConfig> saved = ArgumentCaptor.forClass(RoleConfig.class);
        verify(store).save(saved.capture());
        assertThat(saved.getValue()).isEqualTo(provisioned.role());
        assertThat(saved.getValue().tenantId()).isEqualTo("tnt_1");
        assertThat(provisioned.planId()).isEqualTo("professional");
        assertThat(provisioned.credits()).isEqualTo(new CreditAllocation(300000, 0, 365));
    }

    @Test
    @DisplayName("provision should use the free plan and its credits when the plan is unknown")
    void provision_shouldFallBackToFree_whenPlanUnknown() {
        ProvisionedRole provisioned = onboarding.provision("gold", "tnt_2", "usr_2");

        assertThat(provisioned.planId()).isEqualTo("free");
        assertThat(provisioned.credits()).isEqualTo(new CreditAllocation(1000, 0, 30));
        verify(store, times(1)).save(any(RoleConfig.class));
    }

    @Test
    @DisplayName("provision should propagate store failures")
    void provision_shouldPropagate_whenStoreFails() {
        doThrow(new IllegalStateException("store offline")).when(store).save(any(RoleConfig.class));

        assertThatThrownBy(() -> onboarding.provision("starter", "tnt_3", "usr_3"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("store offline");
    }
}
