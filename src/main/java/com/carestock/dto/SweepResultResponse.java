package com.carestock.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class SweepResultResponse {
    SweepMode mode;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant startedAt;
    int evaluatedCount;
    List<RestockRequestResponse> created;
    List<RestockRequestSpec> proposed;
    List<SkippedItem> skipped;

    @Value
    @Builder
    public static class SkippedItem {
        Long itemId;
        SkipReason reason;
    }
}
