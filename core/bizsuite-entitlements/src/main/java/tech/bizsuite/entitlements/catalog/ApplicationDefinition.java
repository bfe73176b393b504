package tech.bizsuite.entitlements.catalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Top-level product area of the business suite.
 *
 * Modules keep their declaration order. That order carries no meaning for
 * authorization but is preserved for display and for plan expansion.
 */
public record ApplicationDefinition(
    String appCode,
    String appName,
    String description,
    String icon,
    String baseUrl,
    String version,
    boolean core,
    int sortOrder,
    List<ModuleDefinition> modules
) {

    public ApplicationDefinition {
        if (appCode == null || appCode.isBlank()) {
            throw new IllegalArgumentException("appCode cannot be null or empty");
        }
        appName = appName == null ? "" : appName;
        description = description == null ? "" : description;
        icon = icon == null ? "" : icon;
        baseUrl = baseUrl == null ? "" : baseUrl;
        version = version == null ? "" : version;
        modules = modules == null ? List.of() : List.copyOf(modules);
    }

    /**
     * Find a module of this application by its code.
     */
    public Optional<ModuleDefinition> findModule(String moduleCode) {
        if (moduleCode == null) {
            return Optional.empty();
        }
        return modules.stream()
            .filter(m -> m.moduleCode().equals(moduleCode))
            .findFirst();
    }

    /**
     * Module codes in declaration order.
     */
    public List<String> moduleCodes() {
        return modules.stream().map(ModuleDefinition::moduleCode).toList();
    }

    public static Builder builder(String appCode) {
        return new Builder(appCode);
    }

    /**
     * Fluent builder used by the catalog declarations.
     */
    public static final class Builder {
        private final String appCode;
        private String appName;
        private String description;
        private String icon;
        private String baseUrl;
        private String version;
        private boolean core;
        private int sortOrder;
        private final List<ModuleDefinition> modules = new ArrayList<>();

        private Builder(String appCode) {
            this.appCode = appCode;
        }

        public Builder name(String appName) {
            this.appName = appName;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder icon(String icon) {
            this.icon = icon;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder core(boolean core) {
            this.core = core;
            return this;
        }

        public Builder sortOrder(int sortOrder) {
            this.sortOrder = sortOrder;
            return this;
        }

        public Builder module(ModuleDefinition module) {
            modules.add(module);
            return this;
        }

        public ApplicationDefinition build() {
            return new ApplicationDefinition(appCode, appName, description, icon, baseUrl,
                version, core, sortOrder, modules);
        }
    }
}
