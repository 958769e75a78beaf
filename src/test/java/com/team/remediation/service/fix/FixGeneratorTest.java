package com.team.remediation.service.fix;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.team.remediation.config.KnowledgeGraphConfig;
import com.team.remediation.config.RemediationConfig;
import com.team.remediation.config.TargetSystemConfig;
import com.team.remediation.model.diagnosis.AffectedEntity;
import com.team.remediation.model.diagnosis.DiagnosticBundle;
import com.team.remediation.model.diagnosis.PatternIds;
import com.team.remediation.model.graph.Node;
import com.team.remediation.model.graph.NodeType;
import com.team.remediation.model.proposal.FixProposal;
import com.team.remediation.model.proposal.ProposalSource;
import com.team.remediation.model.proposal.RiskLevel;
import com.team.remediation.service.diagnosis.PatternDetector;
import com.team.remediation.service.generation.GenerativeBackend;
import com.team.remediation.service.graph.KnowledgeGraph;
import com.team.remediation.service.graph.KnowledgeGraphStore;
import com.team.remediation.service.search.InMemorySimilarityIndex;
import com.team.remediation.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FixGeneratorTest {

    private static final String VALID_RESPONSE = """
            ```json
            {"root_cause": "JVM heap larger than the container limit", "fix_id": "increase_memory_limit",
             "risk_level": "LOW",
             "command": ["kubectl", "set", "resources", "deployment/api", "-n", "payments", "--limits=memory=1Gi"],
             "rollback_command": ["kubectl", "set", "resources", "deployment/api", "-n", "payments", "--limits=memory=512Mi"],
             "rationale": "OOMKilled with exit code 137"}
            ```
            """;

    private final MutableClock clock = MutableClock.at("2026-03-01T10:00:00Z");
    private GenerativeBackend backend;
    private KnowledgeGraph knowledgeGraph;
    private FixGenerator generator;

    private final AffectedEntity entity = AffectedEntity.builder()
            .id("api-1").scope("payments").workload("api").container("app")
            .reason("OOMKilled").attributes(new HashMap<>(Map.of(AffectedEntity.MEMORY_LIMIT, "512Mi")))
            .build();

    private final DiagnosticBundle bundle = DiagnosticBundle.of("api-1",
            List.of("Last State: Terminated", "Reason: OOMKilled", "Exit Code: 137"), clock.instant());

    @BeforeEach
    void setUp() {
        backend = mock(GenerativeBackend.class);
        when(backend.isAvailable()).thenReturn(true);

        KnowledgeGraphConfig graphConfig = new KnowledgeGraphConfig();
        graphConfig.setPersistenceEnabled(false);
        knowledgeGraph = new KnowledgeGraph(mock(KnowledgeGraphStore.class), graphConfig, clock);

        RemediationConfig config = new RemediationConfig();
        config.setGenerationTimeout(Duration.ofMillis(200));
        TargetSystemConfig targetConfig = new TargetSystemConfig();

        generator = new FixGenerator(
                new FixContextBuilder(knowledgeGraph, new InMemorySimilarityIndex(), config),
                new FixPromptBuilder(),
                new FixResponseParser(new ObjectMapper()),
                new ConfidenceCalculator(),
                new FallbackRuleTable(),
                new ProposalValidator(),
                backend, config, targetConfig, clock);
    }

    private FixProposal generateForOom() {
        Set<String> patterns = PatternDetector.withDefaults().detect(bundle);
        assertThat(patterns).containsExactly(PatternIds.RESOURCE_EXHAUSTION);
        return generator.generate("wf-1", entity, bundle, patterns);
    }

    @Test
    void backendFailureFallsBackToAValidProposal() {
        when(backend.generate(anyString(), anyDouble())).thenReturn(Mono.error(new RuntimeException("503")));

        FixProposal proposal = generateForOom();

        assertThat(proposal.getSource()).isEqualTo(ProposalSource.FALLBACK);
        assertThat(proposal.getConfidence()).isLessThanOrEqualTo(0.75);
        assertThat(proposal.getRollbackAction().isEmpty()).isFalse();
        assertThat(new ProposalValidator().isValid(proposal)).isTrue();
    }

    @Test
    void resourceExhaustionFallbackIsLowRiskAndRestoresPriorLimit() {
        when(backend.isAvailable()).thenReturn(false);

        FixProposal proposal = generateForOom();

        assertThat(proposal.getRiskLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(proposal.getProposedAction().command()).last().isEqualTo("--limits=memory=1024Mi");
        assertThat(proposal.getRollbackAction().command()).last().isEqualTo("--limits=memory=512Mi");
        assertThat(proposal.getWorkflowId()).isEqualTo("wf-1");
        assertThat(proposal.getId()).startsWith("fp-");
        verify(backend, never()).generate(anyString(), anyDouble());
    }

    @Test
    void backendTimeoutFallsBack() {
        when(backend.generate(anyString(), anyDouble())).thenReturn(Mono.never());

        assertThat(generateForOom().getSource()).isEqualTo(ProposalSource.FALLBACK);
    }

    @Test
    void unparseableResponseFallsBack() {
        when(backend.generate(anyString(), anyDouble())).thenReturn(Mono.just("Sure! Just restart it."));

        assertThat(generateForOom().getSource()).isEqualTo(ProposalSource.FALLBACK);
    }

    @Test
    void disallowedCommandFallsBack() {
        when(backend.generate(anyString(), anyDouble())).thenReturn(Mono.just(
                VALID_RESPONSE.replace("[\"kubectl\", \"set\"", "[\"bash\", \"set\"")));

        assertThat(generateForOom().getSource()).isEqualTo(ProposalSource.FALLBACK);
    }

    @Test
    void generatedProposalWithoutHistoryHasLowEvidenceConfidence() {
        when(backend.generate(anyString(), anyDouble())).thenReturn(Mono.just(VALID_RESPONSE));

        FixProposal proposal = generateForOom();

        assertThat(proposal.getSource()).isEqualTo(ProposalSource.GENERATED);
        assertThat(proposal.getFixId()).isEqualTo("increase_memory_limit");
        assertThat(proposal.getConfidence()).isBetween(0.40, 0.50);
        assertThat(proposal.getRationale()).contains("No similar past fixes on record.");
    }

    @Test
    void generatedProposalConfidenceFollowsRecordedOutcomes() {
        Node fix = Node.of(NodeType.FIX, "increase_memory_limit", "Increase memory limit");
        for (int i = 0; i < 5; i++) {
            knowledgeGraph.recordRemediation("cause:resource_exhaustion", fix, true, clock.instant());
        }
        when(backend.generate(anyString(), anyDouble())).thenReturn(Mono.just(VALID_RESPONSE));

        FixProposal proposal = generateForOom();

        assertThat(proposal.getConfidence()).isCloseTo(0.95, within(1e-9));
        assertThat(proposal.getRationale()).contains("applied 5 time(s) before with a 100% success rate");
    }

    @Test
    void noPatternIsRejected() {
        assertThatThrownBy(() -> generator.generate("wf-1", entity, bundle, new LinkedHashSet<>()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
