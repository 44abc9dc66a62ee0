package com.carestock.service;

import com.carestock.dto.DepletionForecast;
import com.carestock.dto.UrgencyTier;
import com.carestock.entity.InventoryItem;
import org.springframework.stereotype.Service;

/**
 * Turns an item's on-hand quantity and average daily usage into whole days of stock left
 * and an urgency tier. Stateless; the same inputs always give the same forecast.
 */
@Service
public class DepletionForecaster {

    static final long CRITICAL_MAX_DAYS = 5;
    static final long HIGH_MAX_DAYS = 10;

    public DepletionForecast forecast(InventoryItem item) {
        return forecast(item.getCurrentStock(), item.getDailyUsage());
    }

    public DepletionForecast forecast(int currentStock, double dailyUsage) {
        // Also rejects NaN.
        if (!(dailyUsage > 0.0)) {
            return DepletionForecast.unknown();
        }
        long remainingDays = (long) Math.floor(currentStock / dailyUsage);
        return DepletionForecast.builder()
            .remainingDays(remainingDays)
            .tier(tierFor(remainingDays))
            .build();
    }

    public UrgencyTier tierFor(long remainingDays) {
        if (remainingDays <= CRITICAL_MAX_DAYS) {
            return UrgencyTier.CRITICAL;
        }
        if (remainingDays <= HIGH_MAX_DAYS) {
            return UrgencyTier.HIGH;
        }
        return UrgencyTier.NORMAL;
    }
}
