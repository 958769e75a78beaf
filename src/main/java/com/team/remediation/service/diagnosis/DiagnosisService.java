package com.team.remediation.service.diagnosis;

import com.team.remediation.model.diagnosis.AffectedEntity;
import com.team.remediation.model.diagnosis.DiagnosticBundle;
import com.team.remediation.model.diagnosis.Diagnosis;
import com.team.remediation.service.target.TargetSystemClient;
import com.team.remediation.util.SignalTruncator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collects a bounded diagnostic bundle for an entity and classifies it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DiagnosisService {

    private final TargetSystemClient targetSystem;
    private final SignalTruncator signalTruncator;
    private final PatternDetector patternDetector;
    private final Clock clock;

    public Diagnosis diagnose(AffectedEntity entity, String reviewerFeedback) {
        List<String> raw;
        try {
            raw = targetSystem.collectSignals(entity);
        } catch (RuntimeException e) {
            log.warn("Collecting signals for {} failed, diagnosing without them: {}", entity.getId(), e.getMessage());
            raw = List.of();
        }
        return diagnose(entity, raw, reviewerFeedback);
    }

    public Diagnosis diagnose(AffectedEntity entity, List<String> rawSignals, String reviewerFeedback) {
        Map<String, String> metadata = new LinkedHashMap<>();
        if (entity.getScope() != null) {
            metadata.put("scope", entity.getScope());
        }
        if (entity.getReason() != null) {
            metadata.put("reason", entity.getReason());
        }
        metadata.put("restart_count", String.valueOf(entity.getRestartCount()));

        DiagnosticBundle bundle = new DiagnosticBundle(entity.getId(), signalTruncator.truncateAll(rawSignals),
                clock.instant(), metadata, reviewerFeedback);
        Set<String> patterns = patternDetector.detect(bundle);

        if (patterns.isEmpty()) {
            log.info("No known pattern for {}: manual investigation required", entity.getId());
        } else {
            log.info("Entity {} matched pattern(s) {}", entity.getId(), patterns);
        }
        return new Diagnosis(entity, bundle, patterns);
    }

    public String categoryOf(String patternId) {
        return patternDetector.categoryOf(patternId);
    }
}
