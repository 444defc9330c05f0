package com.detection.governance.dto;

import com.detection.governance.model.DdlcPhase;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PhaseInfo {
    private DdlcPhase phase;
    private int order;
    private String displayName;
    private String description;
    private String estimatedDuration;
    private DdlcPhase nextPhase;    // null for the terminal phase

    public static PhaseInfo from(DdlcPhase phase) {
        return PhaseInfo.builder()
                .phase(phase)
                .order(phase.ordinal() + 1)
                .displayName(phase.getDisplayName())
                .description(phase.getDescription())
                .estimatedDuration(phase.getEstimatedDuration())
                .nextPhase(phase.isTerminal() ? null : phase.next())
                .build();
    }
}
