package tech.bizsuite.entitlements.derived;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Collection;
import java.util.List;

/**
 * Checks old-style {@code manage_x} / {@code view_x} actions against fully-qualified grants.
 *
 * <p>An action is satisfied when any one of the permissions it maps to is granted.
 * Unknown actions are never satisfied.
 */
@ApplicationScoped
public class LegacyActionResolver {

    private static final Logger LOG = Logger.getLogger(LegacyActionResolver.class);

    private final DerivedMapCache derivedMaps;

    @Inject
    public LegacyActionResolver(DerivedMapCache derivedMaps) {
        this.derivedMaps = derivedMaps;
    }

    /**
     * Fully-qualified codes that satisfy the action, empty when the action is unknown.
     */
    public List<String> expand(String legacyAction) {
        return derivedMaps.legacyActionMap().getOrDefault(legacyAction, List.of());
    }

    public boolean isKnown(String legacyAction) {
        return derivedMaps.legacyActionMap().containsKey(legacyAction);
    }

    public boolean satisfies(String legacyAction, Collection<String> grantedFullCodes) {
        List<String> accepted = expand(legacyAction);
        if (accepted.isEmpty()) {
            LOG.debugf("Unknown legacy action %s", legacyAction);
            return false;
        }
        return accepted.stream().anyMatch(grantedFullCodes::contains);
    }
}
