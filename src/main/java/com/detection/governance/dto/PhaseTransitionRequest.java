package com.detection.governance.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PhaseTransitionRequest {

    @NotBlank(message = "Target phase is required")
    private String targetPhase;

    private String notes;
}
