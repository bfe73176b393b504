package tech.bizsuite.entitlements.derived;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hand-curated aliases layered on top of an application's catalog modules.
 *
 * <ul>
 *   <li>{@code moduleAliases} - module keyword → extra module names it unlocks (umbrellas such as
 *       {@code accounts_receivable}, and older consumer-facing names)</li>
 *   <li>{@code compositeActions} - legacy action → legacy actions it is the union of</li>
 * </ul>
 *
 * Alias keys do not have to be catalog modules.
 */
public final class UmbrellaAliases {

    public static final UmbrellaAliases NONE = builder().build();

    public static final UmbrellaAliases ACCOUNTING = builder()
        // accounts receivable
        .alias("invoices", "accounts_receivable")
        .alias("customers", "accounts_receivable")
        .alias("credit_notes", "accounts_receivable")
        .alias("sales_orders", "accounts_receivable")
        .alias("estimates", "accounts_receivable")
        // accounts payable
        .alias("bills", "accounts_payable")
        .alias("vendors", "accounts_payable")
        .alias("purchase_orders", "accounts_payable")
        .alias("expense_reports", "accounts_payable")
        .alias("vendor_credits", "accounts_payable")
        // older sidebar module names
        .alias("general_ledger", "accounting")
        .alias("chart_of_accounts", "accounting")
        .alias("journal_entries", "accounting")
        .alias("budgeting", "financial_planning")
        .alias("banking", "bank_accounts", "bank_reconciliation", "cash_flow")
        .alias("tax", "tax_management", "gst", "tds", "tax_compliance")
        .alias("payroll", "payroll_employees", "payroll_runs", "payroll_payslips")
        .alias("reports", "financial_statements")
        .alias("analytics", "reports")
        .alias("compliance", "audit")
        .alias("projects", "time_tracking", "project_billing", "project_costing")
        .alias("system", "user_management", "system_admin", "settings", "admin_settings", "rbac")
        .composite("manage_accounting", "manage_general_ledger", "manage_chart_of_accounts")
        .composite("view_accounting", "view_general_ledger", "view_chart_of_accounts")
        .composite("manage_entities", "manage_multi_entity")
        .composite("view_entities", "view_multi_entity")
        .build();

    private final Map<String, List<String>> moduleAliases;
    private final Map<String, List<String>> compositeActions;

    private UmbrellaAliases(Map<String, List<String>> moduleAliases, Map<String, List<String>> compositeActions) {
        this.moduleAliases = moduleAliases;
        this.compositeActions = compositeActions;
    }

    /**
     * Aliases registered for an application, {@link #NONE} when it has none.
     */
    public static UmbrellaAliases forApplication(String appCode) {
        if ("accounting".equals(appCode)) {
            return ACCOUNTING;
        }
        return NONE;
    }

    public Map<String, List<String>> moduleAliases() {
        return moduleAliases;
    }

    public Map<String, List<String>> compositeActions() {
        return compositeActions;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, List<String>> moduleAliases = new LinkedHashMap<>();
        private final Map<String, List<String>> compositeActions = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder alias(String keyword, String... modules) {
            moduleAliases.computeIfAbsent(keyword, k -> new ArrayList<>()).addAll(List.of(modules));
            return this;
        }

        public Builder composite(String action, String... sourceActions) {
            compositeActions.put(action, List.of(sourceActions));
            return this;
        }

        public UmbrellaAliases build() {
            return new UmbrellaAliases(freeze(moduleAliases), freeze(compositeActions));
        }

        private static Map<String, List<String>> freeze(Map<String, List<String>> source) {
            Map<String, List<String>> copy = new LinkedHashMap<>();
            source.forEach((key, values) -> copy.put(key, List.copyOf(values)));
            return Collections.unmodifiableMap(copy);
        }
    }
}
