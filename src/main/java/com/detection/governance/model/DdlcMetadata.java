package com.detection.governance.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed lifecycle metadata: current phase, test progress and recorded test outcomes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DdlcMetadata {

    @Builder.Default
    private DdlcPhase ddlcPhase = DdlcPhase.REQUIREMENT;

    @Builder.Default
    private TestStatus testStatus = TestStatus.NOT_STARTED;

    @Builder.Default
    private List<TestResult> testResults = new ArrayList<>();

    private String validationNotes;

    public boolean hasTestResults() {
        return testResults != null && !testResults.isEmpty();
    }

    public DdlcMetadata copy() {
        return DdlcMetadata.builder()
                .ddlcPhase(ddlcPhase)
                .testStatus(testStatus)
                .testResults(testResults == null ? new ArrayList<>() : new ArrayList<>(testResults))
                .validationNotes(validationNotes)
                .build();
    }
}
