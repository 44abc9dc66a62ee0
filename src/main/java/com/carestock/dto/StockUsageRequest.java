package com.carestock.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class StockUsageRequest {

    @NotNull(message = "itemId is required")
    Long itemId;

    @Min(value = 0, message = "quantityUsed must be >= 0")
    int quantityUsed;
}
