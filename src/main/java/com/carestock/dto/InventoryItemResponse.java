package com.carestock.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InventoryItemResponse {
    Long id;
    Long facilityId;
    String name;
    String category;
    String unit;
    int currentStock;
    double dailyUsage;
    DepletionForecast forecast;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant updatedAt;
}
