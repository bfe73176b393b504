package tech.bizsuite.entitlements.plan;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable table of subscription plan id → {@link PlanAccessEntry}.
 *
 * Plan ids are bare lowercase tokens ("free", "starter", ...). Every id the billing side
 * can emit needs an entry here, otherwise strict resolution fails for it.
 */
public final class PlanAccessProjection {

    private final Map<String, PlanAccessEntry> entries;

    private PlanAccessProjection(Map<String, PlanAccessEntry> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    /**
     * @throws IllegalStateException if two entries share a plan id
     */
    public static PlanAccessProjection of(Collection<PlanAccessEntry> entries) {
        Map<String, PlanAccessEntry> byPlan = new LinkedHashMap<>();
        for (PlanAccessEntry entry : entries) {
            if (byPlan.putIfAbsent(entry.planId(), entry) != null) {
                throw new IllegalStateException("Duplicate plan id in projection: " + entry.planId());
            }
        }
        return new PlanAccessProjection(byPlan);
    }

    public static PlanAccessProjection of(PlanAccessEntry... entries) {
        return of(List.of(entries));
    }

    public Optional<PlanAccessEntry> find(String planId) {
        if (planId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(planId));
    }

    public boolean contains(String planId) {
        return planId != null && entries.containsKey(planId);
    }

    /**
     * Plan ids in declaration order.
     */
    public List<String> planIds() {
        return List.copyOf(entries.keySet());
    }

    public List<PlanAccessEntry> entries() {
        return List.copyOf(entries.values());
    }

    @Override
    public String toString() {
        return "PlanAccessProjection" + entries.keySet();
    }
}
