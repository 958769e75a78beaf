package com.team.remediation.service.diagnosis;

import com.team.remediation.config.RemediationConfig;
import com.team.remediation.model.diagnosis.AffectedEntity;
import com.team.remediation.model.diagnosis.Diagnosis;
import com.team.remediation.model.diagnosis.PatternIds;
import com.team.remediation.service.target.TargetSystemClient;
import com.team.remediation.util.SignalTruncator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DiagnosisServiceTest {

    private TargetSystemClient target;
    private DiagnosisService diagnosisService;
    private final AffectedEntity entity = AffectedEntity.builder()
            .id("api-1").scope("payments").reason("CrashLoopBackOff").restartCount(4).build();

    @BeforeEach
    void setUp() {
        target = mock(TargetSystemClient.class);
        RemediationConfig config = new RemediationConfig();
        diagnosisService = new DiagnosisService(target, new SignalTruncator(config),
                PatternDetector.withDefaults(), Clock.systemUTC());
    }

    @Test
    void detectsFailureBuriedInTheMiddleOfALongLog() {
        String log = IntStream.range(0, 50)
                .mapToObj(i -> i == 25
                        ? "2026-03-01T10:00:25Z dial tcp 10.0.0.7:5432: connection refused"
                        : "2026-03-01T10:00:" + i + "Z INFO request served " + "x".repeat(45))
                .collect(Collectors.joining("\n"));
        assertThat(log.length()).isGreaterThan(3500);
        when(target.collectSignals(entity)).thenReturn(List.of(log));

        Diagnosis diagnosis = diagnosisService.diagnose(entity, null);

        assertThat(diagnosis.patterns()).containsExactly(PatternIds.DEPENDENCY_UNAVAILABLE);
        assertThat(diagnosis.bundle().rawSignals()).singleElement()
                .satisfies(signal -> assertThat(signal).contains("connection refused").hasSizeLessThanOrEqualTo(2000));
    }

    @Test
    void signalCollectionFailureLeavesEntityForManualInvestigation() {
        when(target.collectSignals(entity)).thenThrow(new IllegalStateException("kubectl logs failed"));

        Diagnosis diagnosis = diagnosisService.diagnose(entity, "check the db");

        assertThat(diagnosis.hasPattern()).isFalse();
        assertThat(diagnosis.bundle().reviewerFeedback()).isEqualTo("check the db");
        assertThat(diagnosis.bundle().metadata()).containsEntry("scope", "payments").containsEntry("restart_count", "4");
    }
}
