package tech.bizsuite.entitlements.validate;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.bizsuite.entitlements.catalog.CapabilityCatalog;
import tech.bizsuite.entitlements.catalog.ModuleDefinition;
import tech.bizsuite.entitlements.plan.ApplicationGrant;
import tech.bizsuite.entitlements.plan.PermissionGrant;
import tech.bizsuite.entitlements.plan.PlanAccessEntry;
import tech.bizsuite.entitlements.plan.PlanAccessProjection;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cross-checks the plan projection against the catalog.
 *
 * <p>Reports plans that grant applications, modules or permission codes the catalog does not
 * define, and plans whose {@code applications} / {@code modules} listings disagree with their
 * grants. Kept apart from {@link MatrixValidator}: the catalog can be valid while a plan is not.
 */
@ApplicationScoped
public class PlanAccessValidator {

    private final CapabilityCatalog catalog;
    private final PlanAccessProjection projection;

    @Inject
    public PlanAccessValidator(CapabilityCatalog catalog, PlanAccessProjection projection) {
        this.catalog = catalog;
        this.projection = projection;
    }

    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        for (PlanAccessEntry entry : projection.entries()) {
            errors.addAll(validate(entry));
        }
        return errors;
    }

    public List<String> validate(PlanAccessEntry entry) {
        List<String> errors = new ArrayList<>();
        String plan = "Plan " + entry.planId();

        for (String appCode : entry.applications()) {
            if (!catalog.hasApplication(appCode)) {
                errors.add(plan + " references unknown application " + appCode);
            }
            if (entry.grantFor(appCode).isEmpty()) {
                errors.add(plan + " lists application " + appCode + " without permissions");
            }
        }

        for (Map.Entry<String, ApplicationGrant> grant : entry.permissions().entrySet()) {
            String appCode = grant.getKey();
            if (!entry.grantsApplication(appCode)) {
                errors.add(plan + " grants " + appCode + " which is not listed in applications");
            }
            if (grant.getValue() instanceof ApplicationGrant.ModuleGrants modules) {
                validateModules(plan, entry, appCode, modules, errors);
            }
        }

        return errors;
    }

    private void validateModules(String plan, PlanAccessEntry entry, String appCode,
                                 ApplicationGrant.ModuleGrants grants, List<String> errors) {
        List<String> listed = entry.modules().getOrDefault(appCode, List.of());

        for (Map.Entry<String, PermissionGrant> grant : grants.modules().entrySet()) {
            String moduleCode = grant.getKey();
            String path = appCode + "." + moduleCode;

            if (!listed.contains(moduleCode)) {
                errors.add(plan + " grants " + path + " which is not listed in modules");
            }

            Optional<ModuleDefinition> module = catalog.findModule(appCode, moduleCode);
            if (module.isEmpty()) {
                if (catalog.hasApplication(appCode)) {
                    errors.add(plan + " references unknown module " + path);
                }
                continue;
            }
            if (grant.getValue().isWildcard()) {
                continue;
            }
            for (String code : grant.getValue().expand(module)) {
                if (module.get().findPermission(code).isEmpty()) {
                    errors.add(plan + " grants unknown permission " + path + "." + code);
                }
            }
        }

        for (String moduleCode : listed) {
            if (grants.forModule(moduleCode).isEmpty()) {
                errors.add(plan + " lists module " + appCode + "." + moduleCode + " without permissions");
            }
        }
    }
}
