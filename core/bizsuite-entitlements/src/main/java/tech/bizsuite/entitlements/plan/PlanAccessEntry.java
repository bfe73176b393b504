package tech.bizsuite.entitlements.plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One row of the plan-access projection: the slice of the catalog a subscription plan grants.
 *
 * <ul>
 *   <li>{@code applications} - app codes granted, in declaration order</li>
 *   <li>{@code modules} - app code → module codes granted</li>
 *   <li>{@code permissions} - app code → {@link ApplicationGrant}</li>
 *   <li>{@code credits} - credit allocation that comes with the plan</li>
 * </ul>
 *
 * The record accepts inconsistent combinations on purpose (an app present in
 * {@code permissions} but not in {@code applications}, a module that is not in the
 * catalog); those are reported by the plan-access validator rather than rejected here.
 */
public record PlanAccessEntry(
    String planId,
    List<String> applications,
    Map<String, List<String>> modules,
    Map<String, ApplicationGrant> permissions,
    CreditAllocation credits
) {

    public PlanAccessEntry {
        if (planId == null || planId.isBlank()) {
            throw new IllegalArgumentException("planId cannot be null or empty");
        }
        applications = applications == null ? List.of() : List.copyOf(new LinkedHashSet<>(applications));
        modules = copyModules(modules);
        permissions = permissions == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(permissions));
        credits = credits == null ? CreditAllocation.NONE : credits;
    }

    public Optional<ApplicationGrant> grantFor(String appCode) {
        return Optional.ofNullable(permissions.get(appCode));
    }

    public boolean grantsApplication(String appCode) {
        return applications.contains(appCode);
    }

    /**
     * Whether the module is inside the plan's declared scope: the application is granted and
     * either carries the application-level wildcard or lists the module.
     */
    public boolean grantsModule(String appCode, String moduleCode) {
        if (!grantsApplication(appCode)) {
            return false;
        }
        ApplicationGrant grant = permissions.get(appCode);
        if (grant != null && grant.isWildcard()) {
            return true;
        }
        return modules.getOrDefault(appCode, List.of()).contains(moduleCode);
    }

    private static Map<String, List<String>> copyModules(Map<String, List<String>> modules) {
        if (modules == null) {
            return Map.of();
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        modules.forEach((appCode, moduleCodes) ->
            copy.put(appCode, moduleCodes == null ? List.of() : List.copyOf(moduleCodes)));
        return Collections.unmodifiableMap(copy);
    }

    public static Builder builder(String planId) {
        return new Builder(planId);
    }

    /**
     * Builder used by the plan declarations. Granting a module registers its application
     * and module in the {@code applications} / {@code modules} listings as well.
     */
    public static final class Builder {
        private final String planId;
        private final Set<String> applications = new LinkedHashSet<>();
        private final Map<String, Map<String, PermissionGrant>> moduleGrants = new LinkedHashMap<>();
        private final Set<String> wildcardApplications = new LinkedHashSet<>();
        private CreditAllocation credits = CreditAllocation.NONE;

        private Builder(String planId) {
            this.planId = planId;
        }

        public Builder grant(String appCode, String moduleCode, PermissionGrant grant) {
            if (wildcardApplications.contains(appCode)) {
                throw new IllegalStateException("Application " + appCode + " already granted with wildcard");
            }
            applications.add(appCode);
            moduleGrants.computeIfAbsent(appCode, k -> new LinkedHashMap<>()).put(moduleCode, grant);
            return this;
        }

        public Builder grant(String appCode, String moduleCode, String... codes) {
            return grant(appCode, moduleCode, PermissionGrant.of(codes));
        }

        public Builder grantAll(String appCode, String moduleCode) {
            return grant(appCode, moduleCode, PermissionGrant.all());
        }

        /**
         * Grant every module of the application (application-level wildcard).
         */
        public Builder grantApplication(String appCode) {
            if (moduleGrants.containsKey(appCode)) {
                throw new IllegalStateException("Application " + appCode + " already has module grants");
            }
            applications.add(appCode);
            wildcardApplications.add(appCode);
            return this;
        }

        public Builder credits(long freeCredits, long paidCredits, int expiryDays) {
            this.credits = new CreditAllocation(freeCredits, paidCredits, expiryDays);
            return this;
        }

        public PlanAccessEntry build() {
            Map<String, List<String>> modules = new LinkedHashMap<>();
            Map<String, ApplicationGrant> permissions = new LinkedHashMap<>();
            for (String appCode : applications) {
                if (wildcardApplications.contains(appCode)) {
                    permissions.put(appCode, ApplicationGrant.allModules());
                } else {
                    Map<String, PermissionGrant> grants = moduleGrants.get(appCode);
                    modules.put(appCode, new ArrayList<>(grants.keySet()));
                    permissions.put(appCode, ApplicationGrant.modules(grants));
                }
            }
            return new PlanAccessEntry(planId, new ArrayList<>(applications), modules, permissions, credits);
        }
    }
}
