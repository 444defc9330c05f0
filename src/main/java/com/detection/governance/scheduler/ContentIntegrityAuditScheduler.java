package com.detection.governance.scheduler;

import com.detection.governance.dto.graph.GraphIntegrityReport;
import com.detection.governance.service.graph.GraphConsistencyChecker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically audits dependency and fork references across the whole store.
 * Findings are logged only; nothing is repaired automatically.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ContentIntegrityAuditScheduler {

    private final GraphConsistencyChecker consistencyChecker;

    @Scheduled(fixedRateString = "${governance.integrity.check-interval-ms:3600000}",
            initialDelayString = "${governance.integrity.initial-delay-ms:60000}")
    public void auditGraphIntegrity() {
        log.debug("Running content graph integrity audit...");
        try {
            GraphIntegrityReport report = consistencyChecker.check();
            if (!report.isConsistent()) {
                report.getDanglingReferences().forEach(ref -> log.warn("Dangling reference: {}", ref));
                report.getAsymmetricEdges().forEach(edge -> log.warn("Half-applied edge: {}", edge));
                report.getForkMismatches().forEach(fork -> log.warn("Fork mismatch: {}", fork));
                report.getCycles().forEach(cycle -> log.warn("Dependency cycle: {}", cycle.getDescription()));
            }
        } catch (Exception e) {
            log.error("Content graph integrity audit failed: {}", e.getMessage(), e);
        }
    }
}
