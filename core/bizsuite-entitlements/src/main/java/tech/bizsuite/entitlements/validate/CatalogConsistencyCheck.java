package tech.bizsuite.entitlements.validate;

import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.bizsuite.entitlements.config.EntitlementsConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates the catalog and the plan projection when the application starts.
 *
 * <p>Defects are logged as warnings. With
 * {@code bizsuite.entitlements.validation.fail-on-error=true} they abort startup instead.
 */
@ApplicationScoped
public class CatalogConsistencyCheck {

    private static final Logger LOG = Logger.getLogger(CatalogConsistencyCheck.class);

    private final MatrixValidator matrixValidator;
    private final PlanAccessValidator planAccessValidator;
    private final EntitlementsConfig.Validation config;

    @Inject
    public CatalogConsistencyCheck(MatrixValidator matrixValidator,
                                   PlanAccessValidator planAccessValidator,
                                   EntitlementsConfig config) {
        this.matrixValidator = matrixValidator;
        this.planAccessValidator = planAccessValidator;
        this.config = config.validation();
    }

    void onStart(@Observes StartupEvent event) {
        if (!config.onStartup()) {
            LOG.debug("Entitlement consistency check disabled");
            return;
        }
        check();
    }

    /**
     * Run both validators.
     *
     * @return every defect found, catalog defects first
     * @throws CatalogValidationException if defects were found and fail-on-error is set
     */
    public List<String> check() {
        MatrixValidationReport report = matrixValidator.report();
        List<String> errors = new ArrayList<>(report.errors());
        errors.addAll(planAccessValidator.validate());

        if (errors.isEmpty()) {
            LOG.infof("Entitlement data valid: %d applications, %d modules, %d permissions",
                report.summary().totalApplications(),
                report.summary().totalModules(),
                report.summary().totalPermissions());
            return errors;
        }

        errors.forEach(error -> LOG.warnf("Entitlement data defect: %s", error));
        if (config.failOnError()) {
            throw new CatalogValidationException(errors);
        }
        LOG.warnf("Entitlement data has %d defect(s), continuing", errors.size());
        return errors;
    }
}
