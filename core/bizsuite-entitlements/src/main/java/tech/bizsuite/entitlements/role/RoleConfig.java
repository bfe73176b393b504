package tech.bizsuite.entitlements.role;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persisted description of a tenant role, including its nested permission grants.
 *
 * <p>{@code permissions} has the shape {@code appCode -> moduleCode -> [permissionCode]}
 * so that authorization code can do a direct three-level lookup without re-flattening.
 * The serialized keys follow the stored role format ({@code isSystemRole},
 * {@code isDefault}, {@code isInheritable}).
 */
@Builder
public record RoleConfig(
    String tenantId,
    String organizationId,
    String roleName,
    String description,
    Map<String, Map<String, List<String>>> permissions,
    @JsonProperty("isSystemRole") boolean systemRole,
    @JsonProperty("isDefault") boolean defaultRole,
    int priority,
    String scope,
    @JsonProperty("isInheritable") boolean inheritable,
    String color,
    String createdBy,
    Map<String, Object> restrictions
) {

    public RoleConfig {
        permissions = copyPermissions(permissions);
        restrictions = restrictions == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(restrictions));
    }

    private static Map<String, Map<String, List<String>>> copyPermissions(
            Map<String, Map<String, List<String>>> permissions) {
        if (permissions == null) {
            return Map.of();
        }
        Map<String, Map<String, List<String>>> copy = new LinkedHashMap<>();
        permissions.forEach((appCode, modules) -> {
            Map<String, List<String>> moduleCopy = new LinkedHashMap<>();
            if (modules != null) {
                modules.forEach((moduleCode, codes) ->
                    moduleCopy.put(moduleCode, codes == null ? List.of() : List.copyOf(codes)));
            }
            copy.put(appCode, Collections.unmodifiableMap(moduleCopy));
        });
        return Collections.unmodifiableMap(copy);
    }
}
