package com.carestock.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RestockRequestSpec {
    Long itemId;
    int quantity;
    RestockPriority priority;
    Long daysRemaining;
    RequestOrigin origin;
    String comments;
}
