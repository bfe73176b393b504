package tech.bizsuite.entitlements.role;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.bizsuite.entitlements.catalog.suite.BusinessSuiteCatalog;
import tech.bizsuite.entitlements.plan.suite.SubscriptionPlans;
import tech.bizsuite.entitlements.support.EntitlementFixtures;

import static org.assertj.core.api.Assertions.*;

class RoleConfigCodecTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RoleConfigCodec codec = new RoleConfigCodec(objectMapper);
    private final RoleProvisioner provisioner = new RoleProvisioner(
        BusinessSuiteCatalog.create(), SubscriptionPlans.create(), EntitlementFixtures.defaultConfig());

    @Test
    @DisplayName("toJson should write permissions as a nested object")
    void toJson_shouldWriteNestedPermissions() throws Exception {
        RoleConfig role = provisioner.buildSuperAdminRole("free", "tnt_1", "usr_1");

        JsonNode json = objectMapper.readTree(codec.toJson(role));

        assertThat(json.path("permissions").path("crm").path("leads").isArray()).isTrue();
        assertThat(json.path("permissions").path("crm").path("leads").get(0).asText()).isEqualTo("read");
        assertThat(json.path("isSystemRole").asBoolean()).isTrue();
        assertThat(json.path("isDefault").asBoolean()).isTrue();
        assertThat(json.path("isInheritable").asBoolean()).isTrue();
        assertThat(json.path("organizationId").asText()).isEqualTo("tnt_1");
        assertThat(json.path("restrictions").isObject()).isTrue();
        assertThat(json.has("systemRole")).isFalse();
    }

    @Test
    @DisplayName("fromJson should restore an equal role")
    void fromJson_shouldRestoreRole() {
        RoleConfig role = provisioner.buildSuperAdminRole("professional", "tnt_1", "usr_1");

        assertThat(codec.fromJson(codec.toJson(role))).isEqualTo(role);
    }

    @Test
    @DisplayName("fromJson should wrap malformed input")
    void fromJson_shouldThrow_whenJsonMalformed() {
        assertThatThrownBy(() -> codec.fromJson("{\"permissions\": ["))
            .isInstanceOf(RoleConfigSerializationException.class);
    }
}
