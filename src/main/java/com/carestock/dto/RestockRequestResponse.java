package com.carestock.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RestockRequestResponse {
    Long id;
    Long itemId;
    Long facilityId;
    int quantity;
    RestockPriority priority;
    RestockStatus status;
    RequestOrigin origin;
    Long daysRemaining;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant requestedAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant decidedAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant fulfilledAt;
    String comments;
}
