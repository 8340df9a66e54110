package com.ryuqq.protocheck.adapter.analyzer;

import com.ryuqq.protocheck.application.engine.AnalysisEngine;
import com.ryuqq.protocheck.application.engine.AnalysisStatistics;
import com.ryuqq.protocheck.application.engine.StateMachineAnalysis;
import com.ryuqq.protocheck.application.engine.StateMachineConfig;
import com.ryuqq.protocheck.core.document.ProtocolDocument;
import com.ryuqq.protocheck.core.model.MachineId;
import com.ryuqq.protocheck.core.model.ProtocolStateMachine;
import com.ryuqq.protocheck.core.model.StructuralError;
import com.ryuqq.protocheck.core.model.StructuralException;
import com.ryuqq.protocheck.core.outcome.FailureReason;
import com.ryuqq.protocheck.core.phase.AnalysisPhase;
import com.ryuqq.protocheck.core.phase.Deadline;
import com.ryuqq.protocheck.core.phase.PhaseTransition;
import com.ryuqq.protocheck.core.result.AnalysisWarning;
import com.ryuqq.protocheck.core.result.ComplianceResult;
import com.ryuqq.protocheck.core.result.LivenessResult;
import com.ryuqq.protocheck.core.result.PerformanceMetrics;
import com.ryuqq.protocheck.core.result.ReachabilityResult;
import com.ryuqq.protocheck.core.result.UnverifiedObligation;
import com.ryuqq.protocheck.core.result.WarningKind;
import com.ryuqq.protocheck.core.spi.Extractor;
import com.ryuqq.protocheck.core.spi.FormalVerifier;
import com.ryuqq.protocheck.core.spi.TemporalLogicSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.LongSupplier;
import java.util.stream.Collectors;

/**
 * 기본 분석 엔진 구현체.
 *
 * <p>문서에서 상태 기계를 추출한 뒤 분석기들을 의존 순서대로 실행하고 결과를 집계합니다.</p>
 *
 * <p><strong>Phase 진행:</strong></p>
 * <pre>
 * IDLE → EXTRACTING → [REACHABILITY] → [LIVENESS] → COMPLIANCE → [PERFORMANCE] → AGGREGATING → DONE
 *                                (어느 Phase에서든)                                         → ABORTED
 * </pre>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>Extractor 호출 (예외 시 EXTRACTION_FAILED + ABORTED)</li>
 *   <li>구조 검증: 구조 오류가 있거나 앞선 기계와 ID가 겹치는 기계는 STRUCTURAL_ERROR 경고 후 제외</li>
 *   <li>Phase 단위로 모든 유효 기계를 처리 (phase-major)</li>
 *   <li>각 Phase 시작 전과 기계별 단계 전에 Deadline 확인 (만료 시 TIMEOUT + ABORTED, 부분 결과 반환)</li>
 *   <li>기계 하나의 분석기 예외는 ANALYSIS_ERROR 경고로 기록하고 계속 진행</li>
 *   <li>집계 지표의 analysisTime은 호출 전체의 경과 시간, 머신별 지표는 해당 머신의 Phase 누적 시간</li>
 * </ol>
 *
 * <p>엔진은 설정과 Oracle 핸들만 보유하며, 호출마다 결과를 새로 할당하므로 thread-safe합니다.</p>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public final class DefaultAnalysisEngine implements AnalysisEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultAnalysisEngine.class);

    private final StateMachineConfig config;
    private final Extractor extractor;
    private final LongSupplier nanoClock;
    private final ReachabilityAnalyzer reachabilityAnalyzer;
    private final LivenessAnalyzer livenessAnalyzer;
    private final ComplianceChecker complianceChecker;
    private final PerformanceProfiler performanceProfiler;

    /**
     * 생성자 (TemporalLogicSolver 없음).
     *
     * @param config 분석 설정
     * @param extractor 상태 기계 추출기
     * @param verifier 정형 검증기
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public DefaultAnalysisEngine(StateMachineConfig config, Extractor extractor, FormalVerifier verifier) {
        this(config, extractor, verifier, null);
    }

    /**
     * 생성자.
     *
     * @param config 분석 설정
     * @param extractor 상태 기계 추출기
     * @param verifier 정형 검증기
     * @param solver 시간 논리 솔버 (null 허용)
     * @throws IllegalArgumentException config, extractor, verifier가 null인 경우
     */
    public DefaultAnalysisEngine(StateMachineConfig config, Extractor extractor, FormalVerifier verifier,
                                 TemporalLogicSolver solver) {
        this(config, extractor, verifier, solver, System::nanoTime);
    }

    /**
     * 생성자 (시계 주입, 테스트용).
     *
     * @param config 분석 설정
     * @param extractor 상태 기계 추출기
     * @param verifier 정형 검증기
     * @param solver 시간 논리 솔버 (null 허용)
     * @param nanoClock 나노초 단위 단조 시계
     * @throws IllegalArgumentException config, extractor, verifier, nanoClock이 null인 경우
     */
    public DefaultAnalysisEngine(StateMachineConfig config, Extractor extractor, FormalVerifier verifier,
                                 TemporalLogicSolver solver, LongSupplier nanoClock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (extractor == null) {
            throw new IllegalArgumentException("extractor cannot be null");
        }
        if (nanoClock == null) {
            throw new IllegalArgumentException("nanoClock cannot be null");
        }
        this.config = config;
        this.extractor = extractor;
        this.nanoClock = nanoClock;
        this.reachabilityAnalyzer = new ReachabilityAnalyzer();
        this.livenessAnalyzer = new LivenessAnalyzer(verifier, solver);
        this.complianceChecker = new ComplianceChecker();
        this.performanceProfiler = new PerformanceProfiler();
    }

    @Override
    public StateMachineAnalysis analyzeDocument(ProtocolDocument document) {
        if (document == null) {
            throw new IllegalArgumentException("document cannot be null");
        }
        return new AnalysisRun(document, Deadline.start(config.timeout(), nanoClock)).execute();
    }

    @Override
    public StateMachineAnalysis analyzeDocument(ProtocolDocument document, AnalysisStatistics statistics) {
        if (document == null) {
            throw new IllegalArgumentException("document cannot be null");
        }
        if (statistics == null) {
            throw new IllegalArgumentException("statistics cannot be null");
        }
        Deadline deadline = Deadline.start(config.timeout(), nanoClock);
        StateMachineAnalysis analysis = new AnalysisRun(document, deadline).execute();
        statistics.record(analysis, deadline.elapsed());
        return analysis;
    }

    @Override
    public StateMachineConfig getConfig() {
        return config;
    }

    /**
     * 호출 하나의 가변 상태.
     *
     * <p>엔진 인스턴스는 공유되므로 호출마다 새로 생성합니다.</p>
     */
    private final class AnalysisRun {

        private final ProtocolDocument document;
        private final Deadline deadline;
        private final List<AnalysisWarning> warnings = new ArrayList<>();
        private final List<ProtocolStateMachine> extracted = new ArrayList<>();
        private final List<ProtocolStateMachine> analyzable = new ArrayList<>();
        private final Map<MachineId, ReachabilityResult> reachability = new LinkedHashMap<>();
        private final Map<MachineId, LivenessResult> liveness = new LinkedHashMap<>();
        private final Map<MachineId, ComplianceResult> compliance = new LinkedHashMap<>();
        private final Map<MachineId, PerformanceMetrics> performance = new LinkedHashMap<>();
        private final Map<MachineId, Long> machineNanos = new LinkedHashMap<>();
        private AnalysisPhase phase = AnalysisPhase.IDLE;

        AnalysisRun(ProtocolDocument document, Deadline deadline) {
            this.document = document;
            this.deadline = deadline;
        }

        StateMachineAnalysis execute() {
            log.info("Analysis of document '{}' started (timeout: {})", document.name(), config.timeout());

            if (deadline.isExpired()) {
                return abort(AnalysisPhase.EXTRACTING);
            }
            advance(AnalysisPhase.EXTRACTING);
            if (!extract()) {
                return finish(AnalysisPhase.ABORTED);
            }
            if (extracted.isEmpty()) {
                warn(AnalysisWarning.of(WarningKind.NO_STATE_MACHINES,
                    "Document '" + document.name() + "' yielded no state machines"));
                advance(AnalysisPhase.AGGREGATING);
                return finish(AnalysisPhase.DONE);
            }
            validateMachines();

            if (config.enableReachability()) {
                if (!runPhase(AnalysisPhase.REACHABILITY, analyzable, this::analyzeReachability)) {
                    return abort(AnalysisPhase.REACHABILITY);
                }
            }

            if (config.isLivenessPhaseRequested()) {
                if (!config.enableReachability()) {
                    warn(AnalysisWarning.of(WarningKind.PHASE_SKIPPED,
                        "Liveness phase skipped: reachability analysis is disabled"));
                } else if (!runPhase(AnalysisPhase.LIVENESS, analyzedMachines(), this::analyzeLiveness)) {
                    return abort(AnalysisPhase.LIVENESS);
                }
            }

            if (!runPhase(AnalysisPhase.COMPLIANCE, analyzable, this::checkCompliance)) {
                return abort(AnalysisPhase.COMPLIANCE);
            }

            if (config.enableProfiling()) {
                if (!runPhase(AnalysisPhase.PERFORMANCE, analyzable, this::profile)) {
                    return abort(AnalysisPhase.PERFORMANCE);
                }
            }

            advance(AnalysisPhase.AGGREGATING);
            checkStateSpace();
            return finish(AnalysisPhase.DONE);
        }

        // ============================================================
        // Extraction / Validation
        // ============================================================

        private boolean extract() {
            List<ProtocolStateMachine> machines;
            try {
                machines = extractor.extract(document);
            } catch (Exception e) {
                log.error("Failed to extract state machines from document '{}'", document.name(), e);
                warn(AnalysisWarning.of(WarningKind.EXTRACTION_FAILED,
                    "Extraction failed for document '" + document.name() + "': " + describe(e)));
                return false;
            }
            if (machines != null) {
                for (ProtocolStateMachine machine : machines) {
                    if (machine != null) {
                        extracted.add(machine);
                    }
                }
            }
            log.debug("Extracted {} state machines from '{}'", extracted.size(), document.name());
            return true;
        }

        private void validateMachines() {
            Set<MachineId> seen = new HashSet<>();
            for (ProtocolStateMachine machine : extracted) {
                if (!seen.add(machine.getId())) {
                    log.warn("Skipping state machine with duplicate id {}", machine.getId());
                    warn(AnalysisWarning.of(WarningKind.STRUCTURAL_ERROR, machine.getId(),
                        "Duplicate machine id '" + machine.getId().getValue() + "': later definition skipped"));
                    continue;
                }
                List<StructuralError> errors = machine.validate();
                if (!errors.isEmpty()) {
                    log.warn("Skipping structurally invalid state machine {}", machine.getId());
                    warn(AnalysisWarning.of(WarningKind.STRUCTURAL_ERROR, machine.getId(),
                        errors.stream().map(StructuralError::message).collect(Collectors.joining("; "))));
                    continue;
                }
                analyzable.add(machine);
            }
        }

        // ============================================================
        // Phases
        // ============================================================

        /**
         * Phase 하나를 실행.
         *
         * @return Deadline 내에 완료되었으면 true
         */
        private boolean runPhase(AnalysisPhase next, List<ProtocolStateMachine> machines, MachineStep step) {
            if (deadline.isExpired()) {
                return false;
            }
            advance(next);
            for (ProtocolStateMachine machine : machines) {
                if (deadline.isExpired()) {
                    return false;
                }
                long start = nanoClock.getAsLong();
                try {
                    step.apply(machine);
                } catch (StructuralException e) {
                    log.warn("State machine {} rejected in {}: {}", machine.getId(), next, e.getMessage());
                    warn(AnalysisWarning.of(WarningKind.STRUCTURAL_ERROR, machine.getId(), e.getMessage()));
                } catch (Exception e) {
                    log.error("Failed to analyze {} in phase {}", machine.getId(), next, e);
                    warn(AnalysisWarning.of(WarningKind.ANALYSIS_ERROR, machine.getId(),
                        next + " failed: " + describe(e)));
                } finally {
                    machineNanos.merge(machine.getId(), Math.max(0L, nanoClock.getAsLong() - start), Long::sum);
                }
            }
            return true;
        }

        private void analyzeReachability(ProtocolStateMachine machine) {
            ReachabilityResult result = reachabilityAnalyzer.analyze(machine, config.maxStateSpace(), deadline);
            reachability.put(machine.getId(), result);
            if (result.cyclesTruncated()) {
                warn(AnalysisWarning.of(WarningKind.RESOURCE_BOUND_EXCEEDED, machine.getId(),
                    "Cycle enumeration stopped after " + result.cycles().size()
                        + " cycles (limit: " + config.maxStateSpace() + ")"));
            }
        }

        private void analyzeLiveness(ProtocolStateMachine machine) {
            LivenessResult result = livenessAnalyzer.analyze(machine, reachability.get(machine.getId()), config);
            liveness.put(machine.getId(), result);
            long oracleFailures = result.unverifiedObligations().stream()
                .map(UnverifiedObligation::reason)
                .filter(reason -> reason == FailureReason.ERROR || reason == FailureReason.TIMEOUT)
                .count();
            if (oracleFailures > 0) {
                warn(AnalysisWarning.of(WarningKind.VERIFIER_FAILURE, machine.getId(),
                    oracleFailures + " obligations could not be discharged by the verifier"));
            }
        }

        private void checkCompliance(ProtocolStateMachine machine) {
            compliance.put(machine.getId(), complianceChecker.check(machine));
        }

        private void profile(ProtocolStateMachine machine) {
            Duration elapsed = Duration.ofNanos(machineNanos.getOrDefault(machine.getId(), 0L));
            performance.put(machine.getId(),
                performanceProfiler.profile(machine, reachability.get(machine.getId()), elapsed));
        }

        private List<ProtocolStateMachine> analyzedMachines() {
            return analyzable.stream()
                .filter(machine -> reachability.containsKey(machine.getId()))
                .toList();
        }

        private void checkStateSpace() {
            long stateSpace = analyzable.stream().mapToLong(machine -> machine.getStates().size()).sum();
            if (stateSpace > config.maxStateSpace()) {
                warn(AnalysisWarning.of(WarningKind.STATE_SPACE_EXCEEDED,
                    "Aggregate state space " + stateSpace + " exceeds limit " + config.maxStateSpace()));
            }
        }

        // ============================================================
        // Termination
        // ============================================================

        private StateMachineAnalysis abort(AnalysisPhase during) {
            warn(AnalysisWarning.of(WarningKind.TIMEOUT,
                "Analysis exceeded timeout of " + config.timeout() + " during " + during
                    + " (elapsed: " + deadline.elapsed() + ")"));
            return finish(AnalysisPhase.ABORTED);
        }

        private StateMachineAnalysis finish(AnalysisPhase terminal) {
            advance(terminal);
            Duration elapsed = deadline.elapsed();
            StateMachineAnalysis analysis = new StateMachineAnalysis(
                extracted,
                analyzable.stream().map(ProtocolStateMachine::getId).toList(),
                reachability,
                liveness,
                ComplianceResult.merge(compliance.values()),
                PerformanceMetrics.aggregate(performance.values(), elapsed),
                performance,
                warnings,
                phase
            );
            log.info("Analysis of document '{}' finished: phase={}, machines={}/{}, warnings={}, elapsed={}",
                document.name(), phase, analyzable.size(), extracted.size(), warnings.size(), elapsed);
            return analysis;
        }

        private void advance(AnalysisPhase next) {
            phase = PhaseTransition.transition(phase, next);
        }

        private void warn(AnalysisWarning warning) {
            log.warn("[{}] {}", warning.kind(), warning.message());
            warnings.add(warning);
        }

        private String describe(Exception e) {
            return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        }
    }

    @FunctionalInterface
    private interface MachineStep {
        void apply(ProtocolStateMachine machine);
    }
}
