package tech.bizsuite.entitlements.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;
import tech.bizsuite.entitlements.catalog.CapabilityCatalog;
import tech.bizsuite.entitlements.catalog.suite.BusinessSuiteCatalog;
import tech.bizsuite.entitlements.plan.PlanAccessProjection;
import tech.bizsuite.entitlements.plan.suite.SubscriptionPlans;

/**
 * CDI producer for the immutable catalog and plan projection.
 *
 * Services receive both through injection instead of reaching for the suite declarations
 * directly, so a deployment (or a test) can substitute its own catalog by providing an
 * alternative producer.
 */
@ApplicationScoped
public class EntitlementsProducer {

    private static final Logger LOG = Logger.getLogger(EntitlementsProducer.class);

    @Produces
    @Singleton
    public CapabilityCatalog capabilityCatalog() {
        CapabilityCatalog catalog = BusinessSuiteCatalog.create();
        LOG.infof("Loaded capability catalog: %d applications, %d modules, %d permissions (fingerprint %s)",
            catalog.applicationCount(), catalog.moduleCount(), catalog.permissionCount(), catalog.fingerprint());
        return catalog;
    }

    @Produces
    @Singleton
    public PlanAccessProjection planAccessProjection() {
        PlanAccessProjection projection = SubscriptionPlans.create();
        LOG.infof("Loaded plan access projection: plans=%s", projection.planIds());
        return projection;
    }
}
