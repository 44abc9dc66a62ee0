package com.carestock.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class InventoryItemRequest {

    Long facilityId;

    @NotBlank(message = "name is required")
    @Size(max = 255, message = "name must be at most 255 characters")
    String name;

    @NotBlank(message = "category is required")
    @Size(max = 50, message = "category must be at most 50 characters")
    String category;

    @NotBlank(message = "unit is required")
    @Size(max = 30, message = "unit must be at most 30 characters")
    String unit;

    @Min(value = 0, message = "currentStock must be >= 0")
    int currentStock;

    @DecimalMin(value = "0.0", message = "dailyUsage must be >= 0")
    double dailyUsage;
}
