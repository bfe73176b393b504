package tech.bizsuite.entitlements.catalog;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PermissionCodeTest {

    @Test
    @DisplayName("parse should split a three-segment code")
    void parse_shouldSplitSegments_whenCodeHasThreeSegments() {
        PermissionCode code = PermissionCode.parse("project_management.tasks.change_status");

        assertThat(code.appCode()).isEqualTo("project_management");
        assertThat(code.moduleCode()).isEqualTo("tasks");
        assertThat(code.code()).isEqualTo("change_status");
        assertThat(code.toString()).isEqualTo("project_management.tasks.change_status");
    }

    @Test
    @DisplayName("parse should reject codes that do not have exactly three segments")
    void parse_shouldThrow_whenSegmentCountIsWrong() {
        assertThatThrownBy(() -> PermissionCode.parse("crm.leads"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Invalid permission code format");
        assertThatThrownBy(() -> PermissionCode.parse("crm.credit_config.view.extra"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PermissionCode.parse(""))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot be null or empty");
    }

    @Test
    @DisplayName("parse should reject empty segments")
    void parse_shouldThrow_whenSegmentIsEmpty() {
        assertThatThrownBy(() -> PermissionCode.parse("crm..read"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("moduleCode");
    }

    @Test
    @DisplayName("format should refuse a segment containing a dot")
    void format_shouldThrow_whenSegmentContainsDot() {
        assertThatThrownBy(() -> PermissionCode.format("crm", "settings", "credit_config.view"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot contain '.'");
    }

    @Test
    @DisplayName("isValidSegment should accept underscores and reject dots and blanks")
    void isValidSegment_shouldClassifySegments() {
        assertThat(PermissionCode.isValidSegment("credit_config_view")).isTrue();
        assertThat(PermissionCode.isValidSegment("credit_config.view")).isFalse();
        assertThat(PermissionCode.isValidSegment(" ")).isFalse();
        assertThat(PermissionCode.isValidSegment(null)).isFalse();
    }
}
