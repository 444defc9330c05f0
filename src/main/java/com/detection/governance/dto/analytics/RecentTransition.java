package com.detection.governance.dto.analytics;

import com.detection.governance.model.TransitionKind;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A phase advancement or merge taken from an item's change log. For merges the
 * from/to values are branch names.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecentTransition {

    @JsonProperty("item_id")
    private String itemId;

    @JsonProperty("package_name")
    private String packageName;

    private TransitionKind kind;

    @JsonProperty("from_phase")
    private String fromPhase;

    @JsonProperty("to_phase")
    private String toPhase;

    private String actor;

    private LocalDateTime timestamp;

    private String notes;
}
