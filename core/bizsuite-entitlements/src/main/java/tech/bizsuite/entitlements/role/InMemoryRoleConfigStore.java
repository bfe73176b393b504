package tech.bizsuite.entitlements.role;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Role store that keeps the serialized roles in memory.
 *
 * <p>Single node, lost on restart. Roles go through {@link RoleConfigCodec} so the stored form
 * is the same JSON a persistent store would receive.
 */
@ApplicationScoped
public class InMemoryRoleConfigStore implements RoleConfigStore {

    private static final Logger LOG = Logger.getLogger(InMemoryRoleConfigStore.class);

    private final RoleConfigCodec codec;

    // tenantId -> role JSON
    private final ConcurrentMap<String, String> roles = new ConcurrentHashMap<>();

    @Inject
    public InMemoryRoleConfigStore(RoleConfigCodec codec) {
        this.codec = codec;
    }

    @Override
    public void save(RoleConfig role) {
        if (role.tenantId() == null) {
            throw new IllegalArgumentException("Role " + role.roleName() + " has no tenantId");
        }
        roles.put(role.tenantId(), codec.toJson(role));
        LOG.debugf("Stored role %s for tenant %s", role.roleName(), role.tenantId());
    }

    @Override
    public Optional<RoleConfig> findByTenant(String tenantId) {
        if (tenantId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(roles.get(tenantId)).map(codec::fromJson);
    }

    @Override
    public void delete(String tenantId) {
        if (tenantId != null) {
            roles.remove(tenantId);
        }
    }
}
