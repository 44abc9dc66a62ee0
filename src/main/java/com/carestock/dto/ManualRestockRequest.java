package com.carestock.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ManualRestockRequest {

    @NotNull(message = "itemId is required")
    Long itemId;

    @Min(value = 1, message = "quantity must be >= 1")
    int quantity;

    /** Derived from the item's current forecast when omitted. */
    RestockPriority priority;

    @Size(max = 1000, message = "comments must be at most 1000 characters")
    String comments;
}
