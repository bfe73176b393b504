package tech.bizsuite.entitlements.validate;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.bizsuite.entitlements.config.EntitlementsConfig;
import tech.bizsuite.entitlements.query.MatrixSummary;
import tech.bizsuite.entitlements.support.EntitlementFixtures;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CatalogConsistencyCheckTest {

    private static final MatrixSummary SUMMARY = new MatrixSummary(1, 1, 1);

    @Mock
    private MatrixValidator matrixValidator;

    @Mock
    private PlanAccessValidator planAccessValidator;

    private CatalogConsistencyCheck check(boolean failOnError) {
        EntitlementsConfig config = EntitlementFixtures.config(
            Map.of("bizsuite.entitlements.validation.fail-on-error", String.valueOf(failOnError)));
        return new CatalogConsistencyCheck(matrixValidator, planAccessValidator, config);
    }

    @Test
    @DisplayName("check should return nothing when both validators are clean")
    void check_shouldReturnEmpty_whenDataValid() {
        when(matrixValidator.report()).thenReturn(new MatrixValidationReport(true, List.of(), SUMMARY));
        when(planAccessValidator.validate()).thenReturn(List.of());

        assertThat(check(true).check()).isEmpty();
    }

    @Test
    @DisplayName("check should only warn when fail-on-error is off")
    void check_shouldReturnDefects_whenFailOnErrorOff() {
        when(matrixValidator.report()).thenReturn(
            new MatrixValidationReport(false, List.of("App hr has no modules defined"), SUMMARY));
        when(planAccessValidator.validate()).thenReturn(List.of("Plan free references unknown application hr"));

        assertThat(check(false).check()).containsExactly(
            "App hr has no modules defined",
            "Plan free references unknown application hr");
    }

    @Test
    @DisplayName("check should throw when fail-on-error is on and defects exist")
    void check_shouldThrow_whenFailOnErrorOn() {
        when(matrixValidator.report()).thenReturn(new MatrixValidationReport(true, List.of(), SUMMARY));
        when(planAccessValidator.validate()).thenReturn(List.of("Plan free references unknown application hr"));

        assertThatThrownBy(() -> check(true).check())
            .isInstanceOf(CatalogValidationException.class)
            .hasMessageContaining("1 defect(s)")
            .satisfies(e -> assertThat(((CatalogValidationException) e).getErrors()).hasSize(1));
    }
}
