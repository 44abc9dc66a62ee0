package com.carestock.service;

import com.carestock.dto.DepletionForecast;
import com.carestock.dto.RequestOrigin;
import com.carestock.dto.RestockPriority;
import com.carestock.dto.RestockRequestSpec;
import com.carestock.dto.SkipReason;
import com.carestock.dto.UrgencyTier;
import com.carestock.entity.InventoryItem;
import com.carestock.entity.RestockRequest;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Decides whether a forecast warrants an automatic restock request and sizes it.
 * Pure: the sweep commits whatever this returns.
 *
 * <p>Quantity strategies:
 * <ul>
 *   <li>{@code COVERAGE_DAYS}: {@code ceil(dailyUsage * coverageDays)}, or the fixed quantity
 *       when there is no usage signal</li>
 *   <li>{@code FIXED}: always {@code fixedQuantity}</li>
 * </ul>
 * Both are floored at {@code minimumQuantity}.
 */
@Service
public class RestockPolicy {

    private static final double EPS = 1e-9;

    public enum QuantityStrategy { COVERAGE_DAYS, FIXED }

    @Value("${restock.policy.trigger-tier:HIGH}")
    private UrgencyTier triggerTier = UrgencyTier.HIGH;

    @Value("${restock.policy.quantity-strategy:COVERAGE_DAYS}")
    private QuantityStrategy quantityStrategy = QuantityStrategy.COVERAGE_DAYS;

    @Value("${restock.policy.coverage-days:7}")
    private int coverageDays = 7;

    @Value("${restock.policy.fixed-quantity:100}")
    private int fixedQuantity = 100;

    @Value("${restock.policy.minimum-quantity:1}")
    private int minimumQuantity = 1;

    @PostConstruct
    void validate() {
        if (triggerTier != UrgencyTier.HIGH && triggerTier != UrgencyTier.CRITICAL) {
            throw new IllegalStateException("restock.policy.trigger-tier must be HIGH or CRITICAL, was " + triggerTier);
        }
        if (coverageDays < 1 || fixedQuantity < 1 || minimumQuantity < 1) {
            throw new IllegalStateException("restock.policy coverage-days, fixed-quantity and minimum-quantity must be >= 1");
        }
    }

    public Optional<RestockRequestSpec> evaluate(
            InventoryItem item, DepletionForecast forecast, Optional<RestockRequest> openRequest) {
        return Optional.ofNullable(decide(item, forecast, openRequest).spec());
    }

    public Decision decide(InventoryItem item, DepletionForecast forecast, Optional<RestockRequest> openRequest) {
        UrgencyTier tier = forecast.getTier();
        if (tier == UrgencyTier.UNKNOWN) {
            return Decision.skip(SkipReason.UNKNOWN_USAGE);
        }
        if (!tier.isAtLeast(triggerTier)) {
            return Decision.skip(SkipReason.BELOW_TRIGGER);
        }
        if (openRequest.isPresent()) {
            return Decision.skip(SkipReason.OPEN_REQUEST_EXISTS);
        }
        return Decision.create(RestockRequestSpec.builder()
            .itemId(item.getId())
            .quantity(quantityFor(item))
            .priority(RestockPriority.fromTier(tier))
            .daysRemaining(forecast.getRemainingDays())
            .origin(RequestOrigin.AUTOMATIC)
            .build());
    }

    public int quantityFor(InventoryItem item) {
        int quantity = fixedQuantity;
        if (quantityStrategy == QuantityStrategy.COVERAGE_DAYS && item.getDailyUsage() > 0.0) {
            double coverage = Math.ceil(item.getDailyUsage() * coverageDays - EPS);
            quantity = coverage >= Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) coverage;
        }
        return Math.max(minimumQuantity, quantity);
    }

    public record Decision(RestockRequestSpec spec, SkipReason skipReason) {
        static Decision create(RestockRequestSpec spec) {
            return new Decision(spec, null);
        }

        static Decision skip(SkipReason reason) {
            return new Decision(null, reason);
        }

        public boolean shouldCreate() {
            return spec != null;
        }
    }
}
