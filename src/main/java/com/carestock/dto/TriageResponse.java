package com.carestock.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class TriageResponse {
    String patientId;
    String urgencyLevel;
    UrgencyTier tier;
    List<String> recommendedActions;
    String reasoning;
}
