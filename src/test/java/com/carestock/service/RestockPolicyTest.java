package com.carestock.service;

import com.carestock.dto.DepletionForecast;
import com.carestock.dto.RequestOrigin;
import com.carestock.dto.RestockPriority;
import com.carestock.dto.RestockRequestSpec;
import com.carestock.dto.RestockStatus;
import com.carestock.dto.SkipReason;
import com.carestock.dto.UrgencyTier;
import com.carestock.entity.InventoryItem;
import com.carestock.entity.RestockRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RestockPolicyTest {

    private final DepletionForecaster forecaster = new DepletionForecaster();
    private RestockPolicy policy;

    @BeforeEach
    void setUp() {
        policy = new RestockPolicy();
        ReflectionTestUtils.setField(policy, "triggerTier", UrgencyTier.HIGH);
        ReflectionTestUtils.setField(policy, "quantityStrategy", RestockPolicy.QuantityStrategy.COVERAGE_DAYS);
        ReflectionTestUtils.setField(policy, "coverageDays", 7);
        ReflectionTestUtils.setField(policy, "fixedQuantity", 100);
        ReflectionTestUtils.setField(policy, "minimumQuantity", 1);
    }

    private InventoryItem item(int stock, double usage) {
        return InventoryItem.builder().id(7L).name("Gauze roll").category("Supply")
            .unit("rolls").currentStock(stock).dailyUsage(usage).build();
    }

    private RestockRequest openRequest() {
        return RestockRequest.builder().id(99L).itemId(7L).quantity(10)
            .priority(RestockPriority.HIGH).status(RestockStatus.PENDING).build();
    }

    @Test
    void evaluate_criticalItem_producesCriticalSpec() {
        InventoryItem item = item(45, 10);

        Optional<RestockRequestSpec> spec = policy.evaluate(item, forecaster.forecast(item), Optional.empty());

        assertThat(spec).isPresent();
        assertThat(spec.get().getItemId()).isEqualTo(7L);
        assertThat(spec.get().getPriority()).isEqualTo(RestockPriority.CRITICAL);
        assertThat(spec.get().getQuantity()).isEqualTo(70);
        assertThat(spec.get().getDaysRemaining()).isEqualTo(4L);
        assertThat(spec.get().getOrigin()).isEqualTo(RequestOrigin.AUTOMATIC);
    }

    @Test
    void evaluate_highItem_producesHighSpec() {
        InventoryItem item = item(80, 10);

        Optional<RestockRequestSpec> spec = policy.evaluate(item, forecaster.forecast(item), Optional.empty());

        assertThat(spec).map(RestockRequestSpec::getPriority).contains(RestockPriority.HIGH);
    }

    @Test
    void evaluate_normalItem_producesNothing() {
        InventoryItem item = item(120, 10);

        RestockPolicy.Decision decision = policy.decide(item, forecaster.forecast(item), Optional.empty());

        assertThat(decision.shouldCreate()).isFalse();
        assertThat(decision.skipReason()).isEqualTo(SkipReason.BELOW_TRIGGER);
    }

    @Test
    void evaluate_unknownUsage_neverCreates() {
        InventoryItem item = item(0, 0);

        RestockPolicy.Decision decision = policy.decide(item, forecaster.forecast(item), Optional.empty());

        assertThat(decision.shouldCreate()).isFalse();
        assertThat(decision.skipReason()).isEqualTo(SkipReason.UNKNOWN_USAGE);
    }

    @Test
    void evaluate_existingOpenRequest_producesNothing() {
        InventoryItem item = item(10, 10);

        RestockPolicy.Decision decision = policy.decide(item, forecaster.forecast(item), Optional.of(openRequest()));

        assertThat(decision.shouldCreate()).isFalse();
        assertThat(decision.skipReason()).isEqualTo(SkipReason.OPEN_REQUEST_EXISTS);
    }

    @Test
    void evaluate_criticalOnlyTrigger_ignoresHighItems() {
        ReflectionTestUtils.setField(policy, "triggerTier", UrgencyTier.CRITICAL);
        InventoryItem high = item(80, 10);
        InventoryItem critical = item(20, 10);

        assertThat(policy.evaluate(high, forecaster.forecast(high), Optional.empty())).isEmpty();
        assertThat(policy.evaluate(critical, forecaster.forecast(critical), Optional.empty())).isPresent();
    }

    @Test
    void quantityFor_coverageRoundsUpAndIgnoresFloatNoise() {
        assertThat(policy.quantityFor(item(5, 2.5))).isEqualTo(18);
        ReflectionTestUtils.setField(policy, "coverageDays", 10);
        assertThat(policy.quantityFor(item(5, 0.7))).isEqualTo(7);
    }

    @Test
    void quantityFor_zeroUsage_fallsBackToFixedQuantity() {
        assertThat(policy.quantityFor(item(5, 0))).isEqualTo(100);
    }

    @Test
    void quantityFor_fixedStrategy_ignoresUsage() {
        ReflectionTestUtils.setField(policy, "quantityStrategy", RestockPolicy.QuantityStrategy.FIXED);
        ReflectionTestUtils.setField(policy, "fixedQuantity", 250);

        assertThat(policy.quantityFor(item(5, 40))).isEqualTo(250);
    }

    @Test
    void quantityFor_neverBelowMinimum() {
        ReflectionTestUtils.setField(policy, "minimumQuantity", 50);

        assertThat(policy.quantityFor(item(1, 0.2))).isEqualTo(50);
    }

    @Test
    void validate_rejectsNormalTriggerTier() {
        ReflectionTestUtils.setField(policy, "triggerTier", UrgencyTier.NORMAL);

        assertThatThrownBy(() -> policy.validate()).isInstanceOf(IllegalStateException.class);
    }
}
