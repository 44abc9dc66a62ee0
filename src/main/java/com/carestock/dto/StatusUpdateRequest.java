package com.carestock.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class StatusUpdateRequest {

    @NotNull(message = "status is required")
    RestockStatus status;

    @Size(max = 1000, message = "comments must be at most 1000 characters")
    String comments;
}
