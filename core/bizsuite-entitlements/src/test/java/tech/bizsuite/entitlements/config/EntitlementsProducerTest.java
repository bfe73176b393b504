package tech.bizsuite.entitlements.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.bizsuite.entitlements.catalog.CapabilityCatalog;
import tech.bizsuite.entitlements.plan.PlanAccessProjection;

import static org.assertj.core.api.Assertions.*;

class EntitlementsProducerTest {

    private final EntitlementsProducer producer = new EntitlementsProducer();

    @Test
    @DisplayName("producer should provide the business suite catalog and plans")
    void producer_shouldProvideSuiteData() {
        CapabilityCatalog catalog = producer.capabilityCatalog();
        PlanAccessProjection projection = producer.planAccessProjection();

        assertThat(catalog.applicationCount()).isEqualTo(6);
        assertThat(projection.planIds()).contains("free");
    }

    @Test
    @DisplayName("two produced catalogs should be equal and share a fingerprint")
    void producer_shouldBeDeterministic() {
        assertThat(producer.capabilityCatalog()).isEqualTo(producer.capabilityCatalog());
        assertThat(producer.capabilityCatalog().fingerprint()).isEqualTo(producer.capabilityCatalog().fingerprint());
    }
}
