package com.ryuqq.protocheck.adapter.analyzer;

import com.ryuqq.protocheck.application.engine.AnalysisStatistics;
import com.ryuqq.protocheck.application.engine.StateMachineAnalysis;
import com.ryuqq.protocheck.application.engine.StateMachineConfig;
import com.ryuqq.protocheck.core.document.ProtocolDocument;
import com.ryuqq.protocheck.core.model.ProtocolStateMachine;
import com.ryuqq.protocheck.core.outcome.Proof;
import com.ryuqq.protocheck.core.outcome.VerificationObligation;
import com.ryuqq.protocheck.core.phase.AnalysisPhase;
import com.ryuqq.protocheck.core.result.AnalysisWarning;
import com.ryuqq.protocheck.core.result.WarningKind;
import com.ryuqq.protocheck.core.spi.Extractor;
import com.ryuqq.protocheck.core.spi.FormalVerifier;
import com.ryuqq.protocheck.testkit.fixture.StateMachineFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * DefaultAnalysisEngine 유닛 테스트.
 *
 * <p>Extractor와 FormalVerifier는 Mockito mock, 시계는 AtomicLong으로 주입합니다.</p>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DefaultAnalysisEngineTest {

    @Mock
    private Extractor extractor;

    @Mock
    private FormalVerifier verifier;

    private final ProtocolDocument document = StateMachineFixtures.document("engine-test");

    // ============================================================
    // 1. 추출
    // ============================================================

    @Test
    void analyzeDocument_Extractor_예외면_EXTRACTION_FAILED_후_ABORTED() {
        // given
        when(extractor.extract(document)).thenThrow(new IllegalStateException("malformed"));
        DefaultAnalysisEngine engine = new DefaultAnalysisEngine(new StateMachineConfig(), extractor, verifier);

        // when
        StateMachineAnalysis analysis = engine.analyzeDocument(document);

        // then
        assertThat(analysis.finalPhase()).isEqualTo(AnalysisPhase.ABORTED);
        assertThat(analysis.stateMachines()).isEmpty();
        assertThat(analysis.warnings()).singleElement()
            .satisfies(warning -> {
                assertThat(warning.kind()).isEqualTo(WarningKind.EXTRACTION_FAILED);
                assertThat(warning.message()).contains("malformed");
            });
        verify(verifier, never()).verifyProperty(any());
    }

    @Test
    void analyzeDocument_null_기계는_무시됨() {
        // given
        ProtocolStateMachine machine = StateMachineFixtures.scenarioC();
        when(extractor.extract(document)).thenReturn(Arrays.asList(machine, null));
        StateMachineConfig config = new StateMachineConfig().withEnableLivenessVerification(false);
        DefaultAnalysisEngine engine = new DefaultAnalysisEngine(config, extractor, verifier);

        // when
        StateMachineAnalysis analysis = engine.analyzeDocument(document);

        // then
        assertThat(analysis.finalPhase()).isEqualTo(AnalysisPhase.DONE);
        assertThat(analysis.stateMachines()).containsExactly(machine);
        assertThat(analysis.warnings()).isEmpty();
    }

    // ============================================================
    // 2. Phase 구성
    // ============================================================

    @Test
    void analyzeDocument_도달성_비활성화면_활성_Phase를_건너뛰고_준수_검사는_수행함() {
        // given
        when(extractor.extract(document)).thenReturn(List.of(StateMachineFixtures.scenarioA()));
        StateMachineConfig config = new StateMachineConfig().withEnableReachability(false);
        DefaultAnalysisEngine engine = new DefaultAnalysisEngine(config, extractor, verifier);

        // when
        StateMachineAnalysis analysis = engine.analyzeDocument(document);

        // then
        assertThat(analysis.finalPhase()).isEqualTo(AnalysisPhase.DONE);
        assertThat(analysis.reachability()).isEmpty();
        assertThat(analysis.livenessAnalysis()).isEmpty();
        assertThat(analysis.protocolCompliance().compliant()).isTrue();
        assertThat(analysis.warnings())
            .extracting(AnalysisWarning::kind)
            .containsExactly(WarningKind.PHASE_SKIPPED);
        verify(verifier, never()).verifyProperty(any());
    }

    @Test
    void analyzeDocument_Phase_도중_시간이_만료되면_부분_결과와_함께_ABORTED() {
        // given: verifier 호출마다 시계가 10초 전진, 제한 시간 5초
        AtomicLong clock = new AtomicLong();
        ProtocolStateMachine first = StateMachineFixtures.withInvariants();
        ProtocolStateMachine second = StateMachineFixtures.livelockTrap();
        when(extractor.extract(document)).thenReturn(List.of(first, second));
        when(verifier.verifyProperty(any())).thenAnswer(invocation -> {
            clock.addAndGet(Duration.ofSeconds(10).toNanos());
            return Proof.of(invocation.<VerificationObligation>getArgument(0).obligationId(), "mock-verifier");
        });
        StateMachineConfig config = new StateMachineConfig().withTimeout(Duration.ofSeconds(5));
        DefaultAnalysisEngine engine = new DefaultAnalysisEngine(config, extractor, verifier, null, clock::get);

        // when
        StateMachineAnalysis analysis = engine.analyzeDocument(document);

        // then: 첫 번째 기계의 활성 분석은 끝났고 두 번째는 시작하지 않음
        assertThat(analysis.finalPhase()).isEqualTo(AnalysisPhase.ABORTED);
        assertThat(analysis.reachability()).containsOnlyKeys(first.getId(), second.getId());
        assertThat(analysis.livenessAnalysis()).containsOnlyKeys(first.getId());
        assertThat(analysis.warnings()).singleElement()
            .satisfies(warning -> {
                assertThat(warning.kind()).isEqualTo(WarningKind.TIMEOUT);
                assertThat(warning.message()).contains("LIVENESS");
            });
    }

    @Test
    void analyzeDocument_statistics에_경과_시간과_결과가_누적됨() {
        // given
        AtomicLong clock = new AtomicLong();
        when(extractor.extract(document)).thenAnswer(invocation -> {
            clock.addAndGet(Duration.ofMillis(40).toNanos());
            return List.of(StateMachineFixtures.scenarioB());
        });
        StateMachineConfig config = new StateMachineConfig().withEnableLivenessVerification(false);
        DefaultAnalysisEngine engine = new DefaultAnalysisEngine(config, extractor, verifier, null, clock::get);
        AnalysisStatistics statistics = new AnalysisStatistics();

        // when
        engine.analyzeDocument(document, statistics);

        // then
        assertThat(statistics.getDocumentsAnalyzed()).isEqualTo(1);
        assertThat(statistics.getMachinesAnalyzed()).isEqualTo(1);
        assertThat(statistics.getTotalAnalysisTime()).isEqualTo(Duration.ofMillis(40));
    }

    @Test
    void analyzeDocument_집계_분석_시간은_호출_전체의_경과_시간() {
        // given: 추출 단계에서만 시계가 40ms 전진
        AtomicLong clock = new AtomicLong();
        ProtocolStateMachine chain = StateMachineFixtures.scenarioA();
        ProtocolStateMachine loop = StateMachineFixtures.scenarioC();
        when(extractor.extract(document)).thenAnswer(invocation -> {
            clock.addAndGet(Duration.ofMillis(40).toNanos());
            return List.of(chain, loop);
        });
        StateMachineConfig config = new StateMachineConfig()
            .withEnableLivenessVerification(false)
            .withEnableProfiling(true);
        DefaultAnalysisEngine engine = new DefaultAnalysisEngine(config, extractor, verifier, null, clock::get);

        // when
        StateMachineAnalysis analysis = engine.analyzeDocument(document);

        // then
        assertThat(analysis.performanceByMachine()).containsOnlyKeys(chain.getId(), loop.getId());
        assertThat(analysis.performanceByMachine().values())
            .allSatisfy(metrics -> assertThat(metrics.analysisTime()).isEqualTo(Duration.ZERO));
        assertThat(analysis.performanceMetrics().analysisTime()).isEqualTo(Duration.ofMillis(40));
    }

    @Test
    void analyzeDocument_도달성_비활성화여도_유효한_머신은_분석된_것으로_집계됨() {
        // given
        when(extractor.extract(document)).thenReturn(List.of(
            StateMachineFixtures.scenarioA(), StateMachineFixtures.scenarioB(), StateMachineFixtures.invalidMachine()));
        StateMachineConfig config = new StateMachineConfig().withEnableReachability(false);
        DefaultAnalysisEngine engine = new DefaultAnalysisEngine(config, extractor, verifier);
        AnalysisStatistics statistics = new AnalysisStatistics();

        // when
        StateMachineAnalysis analysis = engine.analyzeDocument(document, statistics);

        // then
        assertThat(analysis.reachability()).isEmpty();
        assertThat(analysis.acceptedMachines()).hasSize(2);
        assertThat(statistics.getMachinesAnalyzed()).isEqualTo(2);
        assertThat(statistics.getMachinesSkipped()).isEqualTo(1);
    }

    // ============================================================
    // 3. 인자 검증
    // ============================================================

    @Test
    void analyzeDocument_null_인자면_예외() {
        // given
        DefaultAnalysisEngine engine = new DefaultAnalysisEngine(new StateMachineConfig(), extractor, verifier);

        // when & then
        assertThatThrownBy(() -> engine.analyzeDocument(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("document cannot be null");
        assertThatThrownBy(() -> engine.analyzeDocument(document, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("statistics cannot be null");
    }

    @Test
    void 생성자_필수_협력자가_null이면_예외() {
        StateMachineConfig config = new StateMachineConfig();

        assertThatThrownBy(() -> new DefaultAnalysisEngine(null, extractor, verifier))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("config cannot be null");
        assertThatThrownBy(() -> new DefaultAnalysisEngine(config, null, verifier))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("extractor cannot be null");
        assertThatThrownBy(() -> new DefaultAnalysisEngine(config, extractor, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("verifier cannot be null");
    }
}
