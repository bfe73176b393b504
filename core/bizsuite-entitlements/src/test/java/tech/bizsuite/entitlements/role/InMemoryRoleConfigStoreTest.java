package tech.bizsuite.entitlements.role;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class InMemoryRoleConfigStoreTest {

    private final InMemoryRoleConfigStore store = new InMemoryRoleConfigStore(new RoleConfigCodec(new ObjectMapper()));

    private static RoleConfig role(String tenantId) {
        return RoleConfig.builder()
            .tenantId(tenantId)
            .organizationId(tenantId)
            .roleName("Organization Admin")
            .permissions(Map.of("crm", Map.of("leads", List.of("read"))))
            .systemRole(true)
            .priority(100)
            .build();
    }

    @Test
    @DisplayName("save then findByTenant should return an equal role")
    void findByTenant_shouldReturnSavedRole() {
        RoleConfig role = role("tnt_1");

        store.save(role);

        assertThat(store.findByTenant("tnt_1")).contains(role);
        assertThat(store.findByTenant("tnt_2")).isEmpty();
        assertThat(store.findByTenant(null)).isEmpty();
    }

    @Test
    @DisplayName("delete should remove the tenant's role")
    void delete_shouldRemoveRole() {
        store.save(role("tnt_1"));

        store.delete("tnt_1");

        assertThat(store.findByTenant("tnt_1")).isEmpty();
    }

    @Test
    @DisplayName("save should reject a role without tenant")
    void save_shouldThrow_whenTenantMissing() {
        assertThatThrownBy(() -> store.save(role(null)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
