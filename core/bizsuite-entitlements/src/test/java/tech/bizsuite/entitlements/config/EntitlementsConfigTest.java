package tech.bizsuite.entitlements.config;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.bizsuite.entitlements.role.RoleConfig;
import tech.bizsuite.entitlements.role.RoleProvisioner;

import static org.assertj.core.api.Assertions.*;

/**
 * Boots the application to check the real config mapping and the bean wiring built on it.
 */
@QuarkusTest
class EntitlementsConfigTest {

    @Inject
    EntitlementsConfig config;

    @Inject
    RoleProvisioner roleProvisioner;

    @Test
    @DisplayName("mapping should describe the organization admin role and the free fallback plan")
    void mapping_shouldMatchShippedValues() {
        assertThat(config.fallbackPlan()).isEqualTo("free");
        assertThat(config.superAdmin().roleName()).isEqualTo("Organization Admin");
        assertThat(config.superAdmin().description())
            .isEqualTo("Full administrative access to all features and settings. This role has complete control over the organization.");
        assertThat(config.superAdmin().priority()).isEqualTo(100);
        assertThat(config.superAdmin().scope()).isEqualTo("organization");
        assertThat(config.superAdmin().color()).isEqualTo("#dc2626");
        assertThat(config.derivedMaps().application()).isEqualTo("accounting");
        assertThat(config.derivedMaps().cacheEnabled()).isFalse();
        assertThat(config.derivedMaps().cacheMaxSize()).isEqualTo(16L);
        assertThat(config.validation().onStartup()).isTrue();
    }

    @Test
    @DisplayName("test profile should make consistency defects fatal")
    void testProfile_shouldFailOnError() {
        assertThat(config.validation().failOnError()).isTrue();
    }

    @Test
    @DisplayName("injected provisioner should build the admin role from the mapped config")
    void provisioner_shouldUseMappedConfig() {
        RoleConfig role = roleProvisioner.buildSuperAdminRole("starter", "tenant-1", "user-1");

        assertThat(role.roleName()).isEqualTo("Organization Admin");
        assertThat(role.priority()).isEqualTo(100);
        assertThat(role.permissions()).isNotEmpty();
    }
}
