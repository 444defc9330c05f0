package com.detection.governance.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of a full-store audit of dependency, dependent and fork references.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphIntegrityReport {

    private int checkedItems;
    private LocalDateTime checkedAt;

    // References to ids that no longer resolve
    @Builder.Default
    private List<String> danglingReferences = new ArrayList<>();

    // Edges present on one side only
    @Builder.Default
    private List<String> asymmetricEdges = new ArrayList<>();

    // originalId / forks pairs that disagree
    @Builder.Default
    private List<String> forkMismatches = new ArrayList<>();

    @Builder.Default
    private List<DependencyCycle> cycles = new ArrayList<>();

    public boolean isConsistent() {
        return danglingReferences.isEmpty() && asymmetricEdges.isEmpty()
                && forkMismatches.isEmpty() && cycles.isEmpty();
    }

    public int issueCount() {
        return danglingReferences.size() + asymmetricEdges.size() + forkMismatches.size() + cycles.size();
    }
}
