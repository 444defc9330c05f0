package com.detection.governance.service.graph;

import com.detection.governance.dto.graph.GraphIntegrityReport;
import com.detection.governance.model.ContentItem;
import com.detection.governance.service.concurrency.ItemLockManager;
import com.detection.governance.store.ContentItemStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Audits the whole store for broken graph references: ids that do not resolve, edges recorded
 * on one side only, fork back-references that disagree, and dependency cycles.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GraphConsistencyChecker {

    private final ContentItemStore store;
    private final ItemLockManager lockManager;
    private final DependencyCycleDetector cycleDetector;
    private final Clock clock;

    public GraphIntegrityReport check() {
        List<ContentItem> items = lockManager.withSnapshot(store::list);
        Map<String, ContentItem> byId = items.stream()
                .collect(Collectors.toMap(ContentItem::getId, Function.identity(), (a, b) -> a, LinkedHashMap::new));

        GraphIntegrityReport report = GraphIntegrityReport.builder()
                .checkedItems(items.size())
                .checkedAt(LocalDateTime.now(clock))
                .build();

        for (ContentItem item : items) {
            String id = item.getId();

            for (String dependencyId : item.getDependencies()) {
                ContentItem dependency = byId.get(dependencyId);
                if (dependency == null) {
                    report.getDanglingReferences().add(id + ".dependencies -> " + dependencyId);
                } else if (!dependency.getDependents().contains(id)) {
                    report.getAsymmetricEdges().add(id + " depends on " + dependencyId
                            + " but is missing from its dependents");
                }
            }

            for (String dependentId : item.getDependents()) {
                ContentItem dependent = byId.get(dependentId);
                if (dependent == null) {
                    report.getDanglingReferences().add(id + ".dependents -> " + dependentId);
                } else if (!dependent.getDependencies().contains(id)) {
                    report.getAsymmetricEdges().add(id + " lists dependent " + dependentId
                            + " which does not depend on it");
                }
            }

            for (String forkId : item.getForks()) {
                ContentItem fork = byId.get(forkId);
                if (fork == null) {
                    report.getDanglingReferences().add(id + ".forks -> " + forkId);
                } else if (!id.equals(fork.getOriginalId())) {
                    report.getForkMismatches().add(id + " lists fork " + forkId
                            + " whose originalId is " + fork.getOriginalId());
                }
            }

            if (item.getOriginalId() != null) {
                ContentItem original = byId.get(item.getOriginalId());
                if (original == null) {
                    report.getDanglingReferences().add(id + ".originalId -> " + item.getOriginalId());
                } else if (!original.getForks().contains(id)) {
                    report.getForkMismatches().add(id + " was forked from " + item.getOriginalId()
                            + " which does not list it as a fork");
                }
            }
        }

        Map<String, Set<String>> adjacency = byId.values().stream()
                .collect(Collectors.toMap(ContentItem::getId, ContentItem::getDependencies));
        report.getCycles().addAll(cycleDetector.findCycles(adjacency));

        if (report.isConsistent()) {
            log.debug("Graph integrity check passed for {} items", items.size());
        } else {
            log.warn("Graph integrity check found {} issue(s) across {} items", report.issueCount(), items.size());
        }
        return report;
    }
}
