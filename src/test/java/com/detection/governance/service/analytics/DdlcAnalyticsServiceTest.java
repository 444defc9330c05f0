package com.detection.governance.service.analytics;

import com.detection.governance.dto.analytics.ContentStatistics;
import com.detection.governance.dto.analytics.DdlcAnalyticsReport;
import com.detection.governance.dto.analytics.PhaseBottleneck;
import com.detection.governance.dto.analytics.RecentTransition;
import com.detection.governance.model.ReviewStatus;
import com.detection.governance.model.TestOutcome;
import com.detection.governance.model.TestResult;
import com.detection.governance.model.TransitionKind;
import com.detection.governance.support.GovernanceFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.detection.governance.support.GovernanceFixture.ANALYST;
import static com.detection.governance.support.GovernanceFixture.REVIEWER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.assertj.core.api.Assertions.tuple;

class DdlcAnalyticsServiceTest {

    private GovernanceFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new GovernanceFixture();
    }

    @Test
    @DisplayName("development holding 60% of items is a high severity bottleneck")
    void flagsDominantPhaseAsHighBottleneck() {
        seedPhases(2, 1, 6, 1);

        DdlcAnalyticsReport report = fixture.analyticsService.computeAnalytics();

        assertThat(report.getTotalPackages()).isEqualTo(10);
        assertThat(report.getPhaseDistribution()).containsExactly(
                entry("requirement", 2), entry("design", 1), entry("development", 6),
                entry("testing", 1), entry("deployed", 0), entry("monitoring", 0));
        assertThat(report.getPhaseBottlenecks()).singleElement().satisfies(bottleneck -> {
            assertThat(bottleneck.getPhase()).isEqualTo("development");
            assertThat(bottleneck.getCount()).isEqualTo(6);
            assertThat(bottleneck.getShare()).isEqualTo(0.6);
            assertThat(bottleneck.getSeverity()).isEqualTo("high");
        });
    }

    @Test
    void shareBetweenThresholdsIsMediumAndTerminalPhaseIsNeverFlagged() {
        seedPhases(0, 4, 0, 0, 0, 6);

        List<PhaseBottleneck> bottlenecks = fixture.analyticsService.computeAnalytics().getPhaseBottlenecks();

        assertThat(bottlenecks).extracting(PhaseBottleneck::getPhase, PhaseBottleneck::getSeverity)
                .containsExactly(tuple("design", "medium"));
    }

    @Test
    void customThresholdsAreHonoured() {
        seedPhases(2, 1, 6, 1);
        DdlcAnalyticsService strict = new DdlcAnalyticsService(fixture.store, fixture.lockManager,
                AnalyticsSettings.builder().bottleneckThreshold(0.15).highSeverityThreshold(0.7).build(), fixture.clock);

        List<PhaseBottleneck> bottlenecks = strict.computeAnalytics().getPhaseBottlenecks();

        assertThat(bottlenecks).extracting(PhaseBottleneck::getPhase).containsExactly("requirement", "development");
        assertThat(bottlenecks).extracting(PhaseBottleneck::getSeverity).containsOnly("medium");
    }

    @Test
    void emptyStoreYieldsZeroes() {
        DdlcAnalyticsReport report = fixture.analyticsService.computeAnalytics();

        assertThat(report.getTotalPackages()).isZero();
        assertThat(report.getPhaseDistribution()).hasSize(6).containsValue(0).doesNotContainValue(1);
        assertThat(report.getCompletionRate().getCompletionPercentage()).isZero();
        assertThat(report.getQualityMetrics().getSuccessRate()).isZero();
        assertThat(report.getPhaseBottlenecks()).isEmpty();
        assertThat(report.getRecentTransitions()).isEmpty();
        assertThat(report.getAveragePhaseTime()).isEmpty();
    }

    @Test
    void completionCountsPublishedOrDeployedItems() {
        seedPhases(2, 0, 0, 0, 1, 1);
        fixture.workflowService.createPullRequest("item-0", "main", "ready", ANALYST);
        fixture.workflowService.reviewContent("item-0", ReviewStatus.APPROVED, "ok", REVIEWER);
        fixture.workflowService.mergeContent("item-0", ANALYST);

        DdlcAnalyticsReport report = fixture.analyticsService.computeAnalytics();

        assertThat(report.getCompletionRate().getDeployedPackages()).isEqualTo(3);
        assertThat(report.getCompletionRate().getTotalPackages()).isEqualTo(4);
        assertThat(report.getCompletionRate().getCompletionPercentage()).isEqualTo(75);
    }

    @Test
    void qualityMetricsOnlyCountItemsWithResults() {
        seedPhases(3);
        fixture.phaseTracker.recordTestResults("item-0", List.of(
                result(TestOutcome.PASSED), result(TestOutcome.PASSED), result(TestOutcome.FAILED)), ANALYST);
        fixture.phaseTracker.recordTestResults("item-1", List.of(result(TestOutcome.PENDING)), ANALYST);

        DdlcAnalyticsReport report = fixture.analyticsService.computeAnalytics();

        assertThat(report.getQualityMetrics().getTotalTests()).isEqualTo(4);
        assertThat(report.getQualityMetrics().getPassedTests()).isEqualTo(2);
        assertThat(report.getQualityMetrics().getFailedTests()).isEqualTo(1);
        assertThat(report.getQualityMetrics().getSuccessRate()).isEqualTo(50);
        assertThat(report.getQualityMetrics().getPackagesWithTests()).isEqualTo(2);
    }

    @Test
    void recentTransitionsAreNewestFirstAndIncludeMerges() {
        fixture.register("I1", "Brute force logins");
        fixture.advanceClock(Duration.ofHours(1));
        fixture.phaseTracker.advancePhase("I1", ANALYST, "scoped");
        fixture.advanceClock(Duration.ofHours(1));
        fixture.workflowService.createPullRequest("I1", "main", "ready", ANALYST);
        fixture.workflowService.reviewContent("I1", ReviewStatus.APPROVED, "ok", REVIEWER);
        fixture.advanceClock(Duration.ofHours(1));
        fixture.workflowService.mergeContent("I1", ANALYST);

        List<RecentTransition> transitions = fixture.analyticsService.computeAnalytics().getRecentTransitions();

        assertThat(transitions).hasSize(2);
        assertThat(transitions.get(0).getKind()).isEqualTo(TransitionKind.MERGE);
        assertThat(transitions.get(1).getKind()).isEqualTo(TransitionKind.PHASE);
        assertThat(transitions.get(1).getFromPhase()).isEqualTo("requirement");
        assertThat(transitions.get(1).getToPhase()).isEqualTo("design");
        assertThat(transitions.get(1).getNotes()).isEqualTo("scoped");
        assertThat(transitions.get(1).getPackageName()).isEqualTo("Brute force logins");
    }

    @Test
    void recentTransitionsAreLimited() {
        fixture.register("I1", "Brute force logins");
        fixture.register("I2", "Impossible travel");
        for (int i = 0; i < 5; i++) {
            fixture.advanceClock(Duration.ofMinutes(1));
            fixture.phaseTracker.advancePhase("I1", ANALYST, null);
            fixture.phaseTracker.advancePhase("I2", ANALYST, null);
        }

        assertThat(fixture.analyticsService.computeAnalytics().getRecentTransitions()).hasSize(10);
        DdlcAnalyticsService shortFeed = new DdlcAnalyticsService(fixture.store, fixture.lockManager,
                AnalyticsSettings.builder().recentTransitionsLimit(3).build(), fixture.clock);
        assertThat(shortFeed.computeAnalytics().getRecentTransitions())
                .extracting(RecentTransition::getToPhase)
                .containsOnly("monitoring", "deployed");
    }

    @Test
    void averagePhaseTimeCoversOnlyPhasesThatWereLeft() {
        fixture.register("I1", "Brute force logins");
        fixture.register("I2", "Impossible travel");
        fixture.advanceClock(Duration.ofHours(2));
        fixture.phaseTracker.advancePhase("I1", ANALYST, null);
        fixture.advanceClock(Duration.ofHours(2));
        fixture.phaseTracker.advancePhase("I2", ANALYST, null);
        fixture.advanceClock(Duration.ofMinutes(90));
        fixture.phaseTracker.advancePhase("I1", ANALYST, null);

        DdlcAnalyticsReport report = fixture.analyticsService.computeAnalytics();

        assertThat(report.getAveragePhaseTime()).containsOnlyKeys("requirement", "design");
        assertThat(report.getAveragePhaseTime().get("requirement").getAverageHours()).isEqualTo(3.0);
        assertThat(report.getAveragePhaseTime().get("requirement").getSampleCount()).isEqualTo(2);
        assertThat(report.getAveragePhaseTime().get("design").getAverageHours()).isEqualTo(3.5);
        assertThat(report.getAveragePhaseTime().get("design").getSampleCount()).isEqualTo(1);
    }

    @Test
    void statisticsBreakDownItems() {
        seedPhases(1, 2);

        ContentStatistics statistics = fixture.analyticsService.computeStatistics();

        assertThat(statistics.getTotal()).isEqualTo(3);
        assertThat(statistics.getByContentType()).containsEntry("correlation", 3);
        assertThat(statistics.getByStatus()).containsEntry("draft", 3);
        assertThat(statistics.getByCategory()).containsEntry("Credential Access", 3);
        assertThat(statistics.getBySeverity()).containsEntry("high", 3);
        assertThat(statistics.getByPhase()).containsEntry("requirement", 1).containsEntry("design", 2)
                .containsEntry("monitoring", 0);
    }

    /**
     * Registers items named item-0, item-1, ... and advances them so that counts[i] items sit in
     * the i-th phase.
     */
    private void seedPhases(int... counts) {
        int next = 0;
        for (int phase = 0; phase < counts.length; phase++) {
            for (int n = 0; n < counts[phase]; n++) {
                String id = "item-" + next++;
                fixture.register(id, "Package " + id);
                for (int step = 0; step < phase; step++) {
                    fixture.phaseTracker.advancePhase(id, ANALYST, null);
                }
            }
        }
    }

    private static TestResult result(TestOutcome outcome) {
        return TestResult.builder().testType("Query Syntax").outcome(outcome).build();
    }
}
