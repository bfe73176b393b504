package tech.bizsuite.entitlements.derived;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Answers which modules of the configured application a set of granted permissions unlocks.
 *
 * <p>The module segment of every granted code of that application is looked up as a keyword in
 * the module access map; the union of the matching module lists is returned.
 */
@ApplicationScoped
public class ModuleAccessResolver {

    private final DerivedMapCache derivedMaps;

    @Inject
    public ModuleAccessResolver(DerivedMapCache derivedMaps) {
        this.derivedMaps = derivedMaps;
    }

    /**
     * @param grantedFullCodes fully-qualified codes the principal holds
     * @return unlocked module names, in first-seen order; null and malformed codes are skipped
     */
    public Set<String> unlockedModules(Collection<String> grantedFullCodes) {
        String appCode = derivedMaps.application();
        Map<String, List<String>> keywords = derivedMaps.moduleAccessMap(appCode);

        Set<String> modules = new LinkedHashSet<>();
        for (String fullCode : grantedFullCodes) {
            if (fullCode == null) {
                continue;
            }
            String[] parts = fullCode.split("\\.", -1);
            if (parts.length != 3 || !parts[0].equals(appCode)) {
                continue;
            }
            modules.addAll(keywords.getOrDefault(parts[1], List.of()));
        }
        return modules;
    }
}
