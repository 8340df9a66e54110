package com.ryuqq.protocheck.adapter.analyzer;

import com.ryuqq.protocheck.core.model.ProtocolStateMachine;
import com.ryuqq.protocheck.core.phase.Deadline;
import com.ryuqq.protocheck.core.result.PerformanceMetrics;
import com.ryuqq.protocheck.core.result.ReachabilityResult;
import com.ryuqq.protocheck.testkit.fixture.StateMachineFixtures;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PerformanceProfiler 유닛 테스트.
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
class PerformanceProfilerTest {

    private final PerformanceProfiler profiler = new PerformanceProfiler();

    @Test
    void profile_도달성_결과가_없어도_직접_SCC를_계산함() {
        // given
        ProtocolStateMachine machine = StateMachineFixtures.livelockTrap();

        // when
        PerformanceMetrics withoutReachability = profiler.profile(machine, null, Duration.ofMillis(3));
        ReachabilityResult reachability = new ReachabilityAnalyzer().analyze(machine, 100, Deadline.none());
        PerformanceMetrics withReachability = profiler.profile(machine, reachability, Duration.ofMillis(3));

        // then: A → {B, C}, A → D 이므로 최장 경로 1
        assertThat(withoutReachability).isEqualTo(withReachability);
        assertThat(withoutReachability.maxPathLength()).isEqualTo(1);
        assertThat(withoutReachability.cyclomaticComplexity()).isEqualTo(4 - 4 + 2);
        assertThat(withoutReachability.analysisTime()).isEqualTo(Duration.ofMillis(3));
    }

    @Test
    void cyclomaticComplexity_여러_약연결_요소면_2P를_반영함() {
        // given: {A,B,C} 체인 + 고립 상태 X
        ProtocolStateMachine machine = StateMachineFixtures.scenarioA().toBuilder().state("X").build();

        // when
        long first = profiler.cyclomaticComplexity(machine);
        long second = profiler.cyclomaticComplexity(machine);

        // then: 2 - 4 + 2·2 = 2, 반복 호출해도 동일
        assertThat(first).isEqualTo(2);
        assertThat(second).isEqualTo(first);
    }

    @Test
    void profile_메모리_추정_계수를_주입할_수_있음() {
        // given
        PerformanceProfiler custom = new PerformanceProfiler(10, 1);

        // when
        PerformanceMetrics metrics = custom.profile(StateMachineFixtures.scenarioA(), null, Duration.ZERO);

        // then
        assertThat(metrics.memoryUsageEstimate()).isEqualTo(3 * 10 + 2);
    }

    @Test
    void 생성자_음수_계수면_예외() {
        assertThatThrownBy(() -> new PerformanceProfiler(-1, 500))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("non-negative");
    }
}
