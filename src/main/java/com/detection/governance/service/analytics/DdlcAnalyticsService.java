package com.detection.governance.service.analytics;

import com.detection.governance.dto.analytics.CompletionRate;
import com.detection.governance.dto.analytics.ContentStatistics;
import com.detection.governance.dto.analytics.DdlcAnalyticsReport;
import com.detection.governance.dto.analytics.PhaseBottleneck;
import com.detection.governance.dto.analytics.PhaseTime;
import com.detection.governance.dto.analytics.QualityMetrics;
import com.detection.governance.dto.analytics.RecentTransition;
import com.detection.governance.model.ChangeLogEntry;
import com.detection.governance.model.ContentItem;
import com.detection.governance.model.ContentStatus;
import com.detection.governance.model.DdlcPhase;
import com.detection.governance.model.TestOutcome;
import com.detection.governance.model.TestResult;
import com.detection.governance.model.TransitionKind;
import com.detection.governance.service.concurrency.ItemLockManager;
import com.detection.governance.store.ContentItemStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Read-only lifecycle analytics. Every report is computed from one consistent snapshot of the
 * store, so a fork or dependency edit in flight is either fully visible or not at all.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DdlcAnalyticsService {

    private static final double MILLIS_PER_HOUR = 3_600_000d;

    private final ContentItemStore store;
    private final ItemLockManager lockManager;
    private final AnalyticsSettings settings;
    private final Clock clock;

    public DdlcAnalyticsReport computeAnalytics() {
        List<ContentItem> items = lockManager.withSnapshot(store::list);
        log.debug("Computing DDLC analytics over {} items", items.size());

        Map<DdlcPhase, Integer> distribution = phaseDistribution(items);
        Map<String, Integer> distributionByValue = new LinkedHashMap<>();
        distribution.forEach((phase, count) -> distributionByValue.put(phase.getValue(), count));

        return DdlcAnalyticsReport.builder()
                .totalPackages(items.size())
                .phaseDistribution(distributionByValue)
                .completionRate(completionRate(items))
                .phaseBottlenecks(bottlenecks(distribution, items.size()))
                .qualityMetrics(qualityMetrics(items))
                .recentTransitions(recentTransitions(items))
                .averagePhaseTime(averagePhaseTime(items))
                .generatedAt(LocalDateTime.now(clock))
                .build();
    }

    public ContentStatistics computeStatistics() {
        List<ContentItem> items = lockManager.withSnapshot(store::list);

        Map<String, Integer> byPhase = new LinkedHashMap<>();
        phaseDistribution(items).forEach((phase, count) -> byPhase.put(phase.getValue(), count));

        return ContentStatistics.builder()
                .total(items.size())
                .byContentType(countBy(items, item -> item.getContentType() == null ? null : item.getContentType().getValue()))
                .byStatus(countBy(items, item -> item.getStatus() == null ? null : item.getStatus().getValue()))
                .byCategory(countBy(items, ContentItem::getCategory))
                .bySeverity(countBy(items, ContentItem::getSeverity))
                .byPhase(byPhase)
                .build();
    }

    private Map<DdlcPhase, Integer> phaseDistribution(List<ContentItem> items) {
        Map<DdlcPhase, Integer> distribution = new EnumMap<>(DdlcPhase.class);
        for (DdlcPhase phase : DdlcPhase.values()) {
            distribution.put(phase, 0);
        }
        items.forEach(item -> distribution.merge(item.currentPhase(), 1, Integer::sum));
        return distribution;
    }

    private CompletionRate completionRate(List<ContentItem> items) {
        int deployed = (int) items.stream()
                .filter(item -> item.getStatus() == ContentStatus.PUBLISHED
                        || item.currentPhase() == DdlcPhase.DEPLOYED
                        || item.currentPhase() == DdlcPhase.MONITORING)
                .count();
        return CompletionRate.builder()
                .deployedPackages(deployed)
                .totalPackages(items.size())
                .completionPercentage(percentage(deployed, items.size()))
                .build();
    }

    private List<PhaseBottleneck> bottlenecks(Map<DdlcPhase, Integer> distribution, int total) {
        List<PhaseBottleneck> bottlenecks = new ArrayList<>();
        if (total == 0) {
            return bottlenecks;
        }
        distribution.forEach((phase, count) -> {
            double share = (double) count / total;
            if (!phase.isTerminal() && share > settings.getBottleneckThreshold()) {
                bottlenecks.add(PhaseBottleneck.builder()
                        .phase(phase.getValue())
                        .count(count)
                        .share(Math.round(share * 100) / 100.0)
                        .severity(share > settings.getHighSeverityThreshold() ? "high" : "medium")
                        .build());
            }
        });
        if (!bottlenecks.isEmpty()) {
            log.info("Detected {} phase bottleneck(s): {}", bottlenecks.size(),
                    bottlenecks.stream().map(PhaseBottleneck::getPhase).toList());
        }
        return bottlenecks;
    }

    private QualityMetrics qualityMetrics(List<ContentItem> items) {
        List<TestResult> results = items.stream()
                .filter(item -> item.getMetadata().hasTestResults())
                .flatMap(item -> item.getMetadata().getTestResults().stream())
                .toList();
        int passed = (int) results.stream().filter(r -> r.getOutcome() == TestOutcome.PASSED).count();
        int failed = (int) results.stream().filter(r -> r.getOutcome() == TestOutcome.FAILED).count();

        return QualityMetrics.builder()
                .totalTests(results.size())
                .passedTests(passed)
                .failedTests(failed)
                .successRate(percentage(passed, results.size()))
                .packagesWithTests((int) items.stream().filter(item -> item.getMetadata().hasTestResults()).count())
                .build();
    }

    private List<RecentTransition> recentTransitions(List<ContentItem> items) {
        List<RecentTransition> transitions = new ArrayList<>();
        for (ContentItem item : items) {
            for (ChangeLogEntry entry : item.getCollaboration().getChangeLog()) {
                if (!entry.hasTransition()) {
                    continue;
                }
                transitions.add(RecentTransition.builder()
                        .itemId(item.getId())
                        .packageName(item.getName())
                        .kind(entry.getTransition().getKind())
                        .fromPhase(entry.getTransition().getFrom())
                        .toPhase(entry.getTransition().getTo())
                        .actor(entry.getAuthor())
                        .timestamp(entry.getTimestamp())
                        .notes(entry.getTransition().getNotes() == null ? "" : entry.getTransition().getNotes())
                        .build());
            }
        }
        return transitions.stream()
                .sorted(Comparator.comparing(RecentTransition::getTimestamp,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(settings.getRecentTransitionsLimit())
                .toList();
    }

    /**
     * Time spent in a phase runs from the entry that put the item there (its first change-log
     * entry for the starting phase) to the entry that moved it out. Phases never left contribute
     * no sample.
     */
    private Map<String, PhaseTime> averagePhaseTime(List<ContentItem> items) {
        Map<DdlcPhase, List<Duration>> samples = new EnumMap<>(DdlcPhase.class);

        for (ContentItem item : items) {
            List<ChangeLogEntry> changeLog = item.getCollaboration().getChangeLog();
            if (changeLog.isEmpty()) {
                continue;
            }
            LocalDateTime enteredAt = changeLog.get(0).getTimestamp();
            for (ChangeLogEntry entry : changeLog) {
                if (!entry.hasTransition() || entry.getTransition().getKind() != TransitionKind.PHASE) {
                    continue;
                }
                DdlcPhase left = DdlcPhase.fromValue(entry.getTransition().getFrom());
                if (enteredAt != null && entry.getTimestamp() != null) {
                    samples.computeIfAbsent(left, k -> new ArrayList<>())
                            .add(Duration.between(enteredAt, entry.getTimestamp()));
                }
                enteredAt = entry.getTimestamp();
            }
        }

        Map<String, PhaseTime> averages = new LinkedHashMap<>();
        samples.forEach((phase, durations) -> {
            double meanMillis = durations.stream().mapToLong(Duration::toMillis).average().orElse(0);
            averages.put(phase.getValue(), PhaseTime.builder()
                    .averageHours(Math.round(meanMillis / MILLIS_PER_HOUR * 10) / 10.0)
                    .sampleCount(durations.size())
                    .build());
        });
        return averages;
    }

    private static Map<String, Integer> countBy(List<ContentItem> items, Function<ContentItem, String> key) {
        Map<String, Integer> counts = new TreeMap<>();
        for (ContentItem item : items) {
            String value = key.apply(item);
            counts.merge(value == null || value.isBlank() ? "unspecified" : value, 1, Integer::sum);
        }
        return counts;
    }

    private static long percentage(int part, int total) {
        return total > 0 ? Math.round((double) part / total * 100) : 0;
    }
}
