package tech.bizsuite.entitlements.resolve;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.bizsuite.entitlements.catalog.ModuleDefinition;
import tech.bizsuite.entitlements.catalog.ResolvedPermission;
import tech.bizsuite.entitlements.common.Result;
import tech.bizsuite.entitlements.common.errors.UseCaseError;
import tech.bizsuite.entitlements.plan.ApplicationGrant;
import tech.bizsuite.entitlements.plan.CreditAllocation;
import tech.bizsuite.entitlements.plan.PermissionGrant;
import tech.bizsuite.entitlements.plan.PlanAccessEntry;
import tech.bizsuite.entitlements.plan.PlanAccessProjection;
import tech.bizsuite.entitlements.query.MatrixQueryService;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Expands a subscription plan into the flat list of permissions it grants.
 *
 * Resolution is strict: an unknown plan id is reported as a {@code PLAN_NOT_FOUND}
 * failure and no default plan is substituted. Callers that want graceful degradation
 * pick their own fallback before calling.
 *
 * Output order follows the plan declaration: applications, then modules, then codes.
 * Wildcards expand in catalog order. Nothing is deduplicated.
 */
@ApplicationScoped
public class PlanResolver {

    private static final Logger LOG = Logger.getLogger(PlanResolver.class);

    public static final String PLAN_NOT_FOUND = "PLAN_NOT_FOUND";
    public static final String INVALID_PLAN_ID = "INVALID_PLAN_ID";

    private final PlanAccessProjection projection;
    private final MatrixQueryService queryService;

    @Inject
    public PlanResolver(PlanAccessProjection projection, MatrixQueryService queryService) {
        this.projection = projection;
        this.queryService = queryService;
    }

    /**
     * Resolve a plan id into its granted permissions.
     *
     * @param planId Plan identifier (e.g., "starter")
     * @return The granted permissions, a ValidationError for a blank id,
     *         or a NotFoundError when the plan does not exist
     */
    public Result<List<ResolvedPermission>> resolve(String planId) {
        Result<PlanAccessEntry> entry = findPlan(planId);
        if (entry instanceof Result.Failure<PlanAccessEntry> failure) {
            return Result.failure(failure.error());
        }
        List<ResolvedPermission> permissions = resolveEntry(entry.orElseThrow());
        LOG.debugf("Resolved plan %s to %d permissions", planId, permissions.size());
        return Result.success(permissions);
    }

    /**
     * Resolve an entry that is not necessarily part of the projection (e.g. a draft plan).
     */
    public List<ResolvedPermission> resolveEntry(PlanAccessEntry entry) {
        List<ResolvedPermission> permissions = new ArrayList<>();
        for (String appCode : entry.applications()) {
            Optional<ApplicationGrant> grant = entry.grantFor(appCode);
            if (grant.isEmpty()) {
                continue;
            }
            if (grant.get() instanceof ApplicationGrant.ModuleGrants moduleGrants) {
                for (Map.Entry<String, PermissionGrant> module : moduleGrants.modules().entrySet()) {
                    resolveModule(appCode, module.getKey(), module.getValue(), permissions);
                }
            } else {
                for (ModuleDefinition module : queryService.listModules(appCode)) {
                    permissions.addAll(queryService.listPermissions(appCode, module.moduleCode()));
                }
            }
        }
        return permissions;
    }

    private void resolveModule(String appCode, String moduleCode, PermissionGrant grant,
                               List<ResolvedPermission> out) {
        if (grant.isWildcard()) {
            out.addAll(queryService.listPermissions(appCode, moduleCode));
            return;
        }
        for (String code : ((PermissionGrant.ExplicitCodes) grant).codes()) {
            out.add(ResolvedPermission.of(
                appCode,
                moduleCode,
                code,
                queryService.permissionName(appCode, moduleCode, code),
                queryService.permissionDescription(appCode, moduleCode, code)
            ));
        }
    }

    /**
     * Fully-qualified codes granted by a plan, as a set.
     */
    public Result<Set<String>> resolveFullCodes(String planId) {
        return resolve(planId).map(permissions -> {
            Set<String> codes = new LinkedHashSet<>();
            permissions.forEach(p -> codes.add(p.fullCode()));
            return codes;
        });
    }

    /**
     * Plan entry together with its resolved permissions.
     */
    public Result<PlanAccessDetails> describePlan(String planId) {
        return findPlan(planId).map(entry -> PlanAccessDetails.of(entry, resolveEntry(entry)));
    }

    /**
     * Credit allocation of a plan, or {@link CreditAllocation#NONE} when the plan does not exist.
     */
    public CreditAllocation planCredits(String planId) {
        return projection.find(planId)
            .map(PlanAccessEntry::credits)
            .orElse(CreditAllocation.NONE);
    }

    private Result<PlanAccessEntry> findPlan(String planId) {
        if (planId == null || planId.isBlank()) {
            return Result.failure(new UseCaseError.ValidationError(
                INVALID_PLAN_ID,
                "Plan id cannot be null or empty",
                Map.of()
            ));
        }
        return projection.find(planId)
            .<Result<PlanAccessEntry>>map(Result::success)
            .orElseGet(() -> Result.failure(new UseCaseError.NotFoundError(
                PLAN_NOT_FOUND,
                "Plan " + planId + " not found",
                Map.of("planId", planId)
            )));
    }
}
