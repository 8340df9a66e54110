package com.ryuqq.protocheck.adapter.analyzer;

import com.ryuqq.protocheck.application.engine.StateMachineConfig;
import com.ryuqq.protocheck.core.model.MachineId;
import com.ryuqq.protocheck.core.model.ProtocolStateMachine;
import com.ryuqq.protocheck.core.outcome.FailureReason;
import com.ryuqq.protocheck.core.outcome.ObligationKind;
import com.ryuqq.protocheck.core.outcome.Proof;
import com.ryuqq.protocheck.core.outcome.VerificationFailure;
import com.ryuqq.protocheck.core.outcome.VerificationObligation;
import com.ryuqq.protocheck.core.phase.Deadline;
import com.ryuqq.protocheck.core.result.LivelockCycle;
import com.ryuqq.protocheck.core.result.LivenessProperty;
import com.ryuqq.protocheck.core.result.LivenessResult;
import com.ryuqq.protocheck.core.result.PropertyStatus;
import com.ryuqq.protocheck.core.result.ReachabilityResult;
import com.ryuqq.protocheck.core.result.SafetyViolation;
import com.ryuqq.protocheck.core.result.UnverifiedObligation;
import com.ryuqq.protocheck.core.result.ViolationSeverity;
import com.ryuqq.protocheck.core.spi.FormalVerifier;
import com.ryuqq.protocheck.core.spi.TemporalLogicSolver;
import com.ryuqq.protocheck.testkit.fixture.StateMachineFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.ryuqq.protocheck.testkit.fixture.StateMachineFixtures.event;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * LivenessAnalyzer 유닛 테스트.
 *
 * <p>Oracle은 Mockito mock으로 대체합니다.</p>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class LivenessAnalyzerTest {

    @Mock
    private FormalVerifier verifier;

    @Mock
    private TemporalLogicSolver solver;

    private final StateMachineConfig config = new StateMachineConfig();

    private static ReachabilityResult reachabilityOf(ProtocolStateMachine machine) {
        return new ReachabilityAnalyzer().analyze(machine, 100, Deadline.none());
    }

    // ============================================================
    // 1. Oracle 위임
    // ============================================================

    @Test
    void analyze_verifier가_예외를_던지면_ERROR로_미검증_처리됨() {
        // given
        ProtocolStateMachine machine = StateMachineFixtures.withInvariants();
        when(verifier.verifyProperty(any())).thenThrow(new IllegalStateException("boom"));
        LivenessAnalyzer analyzer = new LivenessAnalyzer(verifier, solver);

        // when
        LivenessResult result = analyzer.analyze(machine, reachabilityOf(machine), config);

        // then: 불변식 2개 + 종료 상태 C 1개
        assertThat(result.safetyViolations()).isEmpty();
        assertThat(result.unverifiedObligations())
            .hasSize(3)
            .allSatisfy(unverified -> {
                assertThat(unverified.reason()).isEqualTo(FailureReason.ERROR);
                assertThat(unverified.message()).isEqualTo("oracle failure: boom");
            });
        verify(verifier, times(3)).verifyProperty(any());
    }

    @Test
    void analyze_verifier가_null을_반환하면_증명으로_취급하지_않음() {
        // given
        ProtocolStateMachine machine = StateMachineFixtures.withInvariants();
        when(verifier.verifyProperty(any())).thenReturn(null);
        LivenessAnalyzer analyzer = new LivenessAnalyzer(verifier, solver);

        // when
        LivenessResult result = analyzer.analyze(machine, reachabilityOf(machine), config);

        // then
        assertThat(result.unverifiedObligations())
            .extracting(UnverifiedObligation::message)
            .containsOnly("oracle returned no outcome");
        assertThat(result.livenessProperties())
            .extracting(LivenessProperty::status)
            .containsExactly(PropertyStatus.UNVERIFIED);
    }

    @Test
    void analyze_시간_연산자_불변식은_solver로_위임됨() {
        // given
        ProtocolStateMachine machine = StateMachineFixtures.withTemporalInvariant();
        when(solver.solve(any())).thenAnswer(invocation ->
            Proof.of(invocation.<VerificationObligation>getArgument(0).obligationId(), "mock-solver"));
        when(verifier.verifyProperty(any())).thenAnswer(invocation ->
            Proof.of(invocation.<VerificationObligation>getArgument(0).obligationId(), "mock-verifier"));
        LivenessAnalyzer analyzer = new LivenessAnalyzer(verifier, solver);

        // when
        LivenessResult result = analyzer.analyze(machine, reachabilityOf(machine), config);

        // then: 안전성 의무는 solver, 활성 의무는 verifier
        assertThat(result.unverifiedObligations()).isEmpty();
        verify(solver, times(1)).solve(any());
        verify(verifier, times(1)).verifyProperty(any());
    }

    @Test
    void analyze_solver가_없으면_시간_연산자_불변식은_UNSUPPORTED() {
        // given
        ProtocolStateMachine machine = StateMachineFixtures.withTemporalInvariant();
        when(verifier.verifyProperty(any())).thenAnswer(invocation ->
            Proof.of(invocation.<VerificationObligation>getArgument(0).obligationId(), "mock-verifier"));
        LivenessAnalyzer analyzer = new LivenessAnalyzer(verifier, null);

        // when
        LivenessResult result = analyzer.analyze(machine, reachabilityOf(machine), config);

        // then
        assertThat(result.unverifiedObligations()).singleElement()
            .satisfies(unverified -> {
                assertThat(unverified.reason()).isEqualTo(FailureReason.UNSUPPORTED);
                assertThat(unverified.obligation().kind()).isEqualTo(ObligationKind.SAFETY);
            });
        verify(solver, never()).solve(any());
    }

    // ============================================================
    // 2. 안전성 위반
    // ============================================================

    @Test
    void analyze_초기_상태_위반은_CRITICAL_나머지는_HIGH() {
        // given: 안전성 의무는 반례 없이 반박, 활성 의무는 증명
        ProtocolStateMachine machine = StateMachineFixtures.withInvariants();
        when(verifier.verifyProperty(any())).thenAnswer(invocation -> {
            VerificationObligation obligation = invocation.getArgument(0);
            if (obligation.kind() == ObligationKind.SAFETY) {
                return VerificationFailure.refuted(obligation.obligationId(), "lock not held", List.of());
            }
            return Proof.of(obligation.obligationId(), "mock-verifier");
        });
        LivenessAnalyzer analyzer = new LivenessAnalyzer(verifier, solver);

        // when
        LivenessResult result = analyzer.analyze(machine, reachabilityOf(machine), config);

        // then: 반례가 없으면 증인 경로를 trace로 사용
        assertThat(result.safetyViolations())
            .extracting(SafetyViolation::severity)
            .containsExactly(ViolationSeverity.CRITICAL, ViolationSeverity.HIGH);
        assertThat(result.safetyViolations().get(1).violationTrace()).containsExactly("A", "B");
        assertThat(result.safetyViolations().get(1).obligationId()).isEqualTo("safety:invariants:B#0");
        assertThat(result.livenessProperties())
            .extracting(LivenessProperty::status)
            .containsExactly(PropertyStatus.VERIFIED);
    }

    // ============================================================
    // 3. 활성 / livelock
    // ============================================================

    @Test
    void analyze_닫힌_SCC가_종료_상태를_피하면_반례를_구성함() {
        // given
        ProtocolStateMachine machine = StateMachineFixtures.livelockTrap();
        when(verifier.verifyProperty(any())).thenAnswer(invocation ->
            VerificationFailure.unknown(invocation.<VerificationObligation>getArgument(0).obligationId(), "gave up"));
        LivenessAnalyzer analyzer = new LivenessAnalyzer(verifier, solver);

        // when
        LivenessResult result = analyzer.analyze(machine, reachabilityOf(machine), config);

        // then: 증인 경로 [A, B] + B를 지나는 순환 한 바퀴 [C, B]
        assertThat(result.livenessProperties()).singleElement()
            .satisfies(property -> {
                assertThat(property.status()).isEqualTo(PropertyStatus.REFUTED);
                assertThat(property.counterexample()).containsExactly("A", "B", "C", "B");
            });
        assertThat(result.livelockCycles()).containsExactly(new LivelockCycle(List.of("B", "C"), true));
        assertThat(result.deadlockStates()).isEmpty();
        assertThat(result.unverifiedObligations()).isEmpty();
    }

    @Test
    void analyze_자기_루프_단일_상태도_livelock으로_보고함() {
        // given: B는 자기 루프만 가지며 종료 상태 D로 빠져나갈 수 없음
        ProtocolStateMachine machine = ProtocolStateMachine.builder(MachineId.of("self-loop-trap"))
            .states("A", "B", "D")
            .initialState("A")
            .finalStates("D")
            .transition("A", "B", event("enter"))
            .transition("A", "D", event("finish"))
            .transition("B", "B", event("spin"))
            .build();
        LivenessAnalyzer analyzer = new LivenessAnalyzer(verifier, solver);

        // when
        LivenessResult result = analyzer.analyze(machine, reachabilityOf(machine),
            config.withEnableLivenessVerification(false));

        // then
        assertThat(result.livelockCycles()).containsExactly(new LivelockCycle(List.of("B"), true));
        assertThat(result.deadlockStates()).isEmpty();
    }

    @Test
    void analyze_활성_검증_비활성화면_Oracle을_호출하지_않음() {
        // given
        ProtocolStateMachine machine = StateMachineFixtures.livelockTrap();
        LivenessAnalyzer analyzer = new LivenessAnalyzer(verifier, solver);

        // when
        LivenessResult result = analyzer.analyze(machine, reachabilityOf(machine),
            config.withEnableLivenessVerification(false));

        // then
        assertThat(result.livelockCycles()).hasSize(1);
        assertThat(result.livenessProperties()).isEmpty();
        verify(verifier, never()).verifyProperty(any());
    }

    @Test
    void 생성자_verifier가_null이면_예외() {
        assertThatThrownBy(() -> new LivenessAnalyzer(null, solver))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("verifier cannot be null");
    }
}
