package com.detection.governance.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Contributors plus the append-only change log and review trail of an item.
 * Entries are immutable; only the lists grow.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Collaboration {

    @Builder.Default
    private Set<String> contributors = new LinkedHashSet<>();

    private String lastModifiedBy;

    @Builder.Default
    private List<ChangeLogEntry> changeLog = new ArrayList<>();

    @Builder.Default
    private List<ReviewEntry> reviews = new ArrayList<>();

    public Collaboration copy() {
        return Collaboration.builder()
                .contributors(new LinkedHashSet<>(contributors))
                .lastModifiedBy(lastModifiedBy)
                .changeLog(new ArrayList<>(changeLog))
                .reviews(new ArrayList<>(reviews))
                .build();
    }
}
