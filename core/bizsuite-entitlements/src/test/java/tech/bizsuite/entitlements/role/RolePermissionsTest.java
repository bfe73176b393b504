package tech.bizsuite.entitlements.role;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.bizsuite.entitlements.catalog.suite.BusinessSuiteCatalog;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class RolePermissionsTest {

    private static Map<String, Map<String, List<String>>> grants() {
        Map<String, Map<String, List<String>>> grants = new LinkedHashMap<>();
        grants.put("crm", Map.of("leads", List.of("read", "create")));
        grants.put("legacy_app", Map.of("widgets", List.of("read")));
        grants.put("hr", Map.of("employees", List.of("read")));
        return grants;
    }

    @Test
    @DisplayName("extractApplications should keep only catalog applications in grant order")
    void extractApplications_shouldSkipUnknownApplications() {
        assertThat(RolePermissions.extractApplications(grants(), BusinessSuiteCatalog.create()))
            .containsExactly("crm", "hr");
        assertThat(RolePermissions.extractApplications(null, BusinessSuiteCatalog.create())).isEmpty();
    }

    @Test
    @DisplayName("filterByApplication should return only the application's subtree")
    void filterByApplication_shouldReturnSubtree() {
        assertThat(RolePermissions.filterByApplication(grants(), "hr"))
            .isEqualTo(Map.of("hr", Map.of("employees", List.of("read"))));
        assertThat(RolePermissions.filterByApplication(grants(), "accounting")).isEmpty();
    }

    @Test
    @DisplayName("filterByApplication should treat a null subtree as not granted")
    void filterByApplication_shouldReturnEmpty_whenSubtreeNull() {
        Map<String, Map<String, List<String>>> grants = new LinkedHashMap<>();
        grants.put("crm", null);

        assertThat(RolePermissions.filterByApplication(grants, "crm")).isEmpty();
        assertThat(RolePermissions.filterByApplication(grants(), null)).isEmpty();
    }

    @Test
    @DisplayName("grants should do a direct three-level lookup")
    void grants_shouldLookUpFullCodes() {
        assertThat(RolePermissions.grants(grants(), "crm.leads.create")).isTrue();
        assertThat(RolePermissions.grants(grants(), "crm.leads.delete")).isFalse();
        assertThat(RolePermissions.grants(grants(), "crm.contacts.read")).isFalse();
        assertThat(RolePermissions.grants(grants(), "crm.leads")).isFalse();
        assertThat(RolePermissions.grants(grants(), (String) null)).isFalse();
    }

    @Test
    @DisplayName("flatten should render fully-qualified codes")
    void flatten_shouldRenderFullCodes() {
        assertThat(RolePermissions.flatten(grants()))
            .containsExactly("crm.leads.read", "crm.leads.create", "legacy_app.widgets.read", "hr.employees.read");
    }
}
