package tech.bizsuite.entitlements.role;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * JSON form of a {@link RoleConfig} as handed to the role store.
 *
 * <p>Permissions are written as a nested object:
 * <pre>
 * "permissions": { "crm": { "leads": ["read", "create"] } }
 * </pre>
 */
@ApplicationScoped
public class RoleConfigCodec {

    private final ObjectMapper objectMapper;

    @Inject
    public RoleConfigCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toJson(RoleConfig role) {
        try {
            return objectMapper.writeValueAsString(role);
        } catch (JsonProcessingException e) {
            throw new RoleConfigSerializationException("Failed to serialize role " + role.roleName(), e);
        }
    }

    public RoleConfig fromJson(String json) {
        try {
            return objectMapper.readValue(json, RoleConfig.class);
        } catch (JsonProcessingException e) {
            throw new RoleConfigSerializationException("Failed to deserialize role config", e);
        }
    }
}
