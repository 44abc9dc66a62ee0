package com.carestock.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DepletionForecast {
    Long remainingDays;
    UrgencyTier tier;

    public static DepletionForecast unknown() {
        return new DepletionForecast(null, UrgencyTier.UNKNOWN);
    }

    @JsonIgnore
    public boolean isKnown() {
        return remainingDays != null;
    }
}
