package tech.bizsuite.entitlements.validate;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.bizsuite.entitlements.catalog.ApplicationDefinition;
import tech.bizsuite.entitlements.catalog.CapabilityCatalog;
import tech.bizsuite.entitlements.catalog.ModuleDefinition;
import tech.bizsuite.entitlements.catalog.PermissionCode;
import tech.bizsuite.entitlements.catalog.PermissionDefinition;
import tech.bizsuite.entitlements.query.MatrixSummary;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Walks the catalog and reports authoring mistakes as readable messages.
 *
 * <p>Checks run independently of each other; a defect in one application does not stop the
 * rest from being checked. An empty list means the catalog is valid. Nothing consults the
 * result at runtime except the startup consistency check.
 */
@ApplicationScoped
public class MatrixValidator {

    private final CapabilityCatalog catalog;

    @Inject
    public MatrixValidator(CapabilityCatalog catalog) {
        this.catalog = catalog;
    }

    public List<String> validate() {
        return validate(catalog);
    }

    public MatrixValidationReport report() {
        List<String> errors = validate(catalog);
        return new MatrixValidationReport(errors.isEmpty(), errors, MatrixSummary.of(catalog));
    }

    public static List<String> validate(CapabilityCatalog catalog) {
        List<String> errors = new ArrayList<>();

        for (ApplicationDefinition app : catalog.applications()) {
            String appCode = app.appCode();

            if (app.appName().isBlank()) {
                errors.add("App " + appCode + " missing appName");
            }
            if (!PermissionCode.isValidSegment(appCode)) {
                errors.add("App code " + appCode + " contains '" + PermissionCode.SEPARATOR + "'");
            }

            if (app.modules().isEmpty()) {
                errors.add("App " + appCode + " has no modules defined");
                continue;
            }

            Set<String> moduleCodes = new HashSet<>();
            for (ModuleDefinition module : app.modules()) {
                validateModule(appCode, module, moduleCodes, errors);
            }
        }

        return errors;
    }

    private static void validateModule(String appCode, ModuleDefinition module, Set<String> seenModules,
                                       List<String> errors) {
        String path = appCode + "." + module.moduleCode();

        if (!seenModules.add(module.moduleCode())) {
            errors.add("Duplicate module " + path);
        }
        if (!module.moduleCode().isEmpty() && !PermissionCode.isValidSegment(module.moduleCode())) {
            errors.add("Module code " + path + " contains '" + PermissionCode.SEPARATOR + "'");
        }
        if (module.permissions().isEmpty()) {
            errors.add("Module " + path + " has no permissions defined");
        }

        Set<String> codes = new HashSet<>();
        for (PermissionDefinition permission : module.permissions()) {
            if (permission.code().isBlank() || permission.name().isBlank()) {
                errors.add("Permission in " + path + " missing code or name");
                continue;
            }
            if (!PermissionCode.isValidSegment(permission.code())) {
                errors.add("Permission " + path + "." + permission.code() + " contains '" + PermissionCode.SEPARATOR + "'");
            }
            if (!codes.add(permission.code())) {
                errors.add("Duplicate permission " + path + "." + permission.code());
            }
        }
    }
}
