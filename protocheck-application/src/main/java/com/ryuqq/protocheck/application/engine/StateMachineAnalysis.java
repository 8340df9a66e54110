package com.ryuqq.protocheck.application.engine;

import com.ryuqq.protocheck.core.model.MachineId;
import com.ryuqq.protocheck.core.model.ProtocolStateMachine;
import com.ryuqq.protocheck.core.phase.AnalysisPhase;
import com.ryuqq.protocheck.core.result.AnalysisWarning;
import com.ryuqq.protocheck.core.result.ComplianceResult;
import com.ryuqq.protocheck.core.result.LivenessResult;
import com.ryuqq.protocheck.core.result.PerformanceMetrics;
import com.ryuqq.protocheck.core.result.ReachabilityResult;
import com.ryuqq.protocheck.core.result.WarningKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 문서 하나에 대한 분석 결과.
 *
 * <p>분석 호출마다 새로 생성되며 불변입니다. 타임아웃으로 중단된 경우에도
 * 그때까지 계산된 머신별 결과를 모두 담습니다.</p>
 *
 * <p><strong>필드 규칙:</strong></p>
 * <ul>
 *   <li>stateMachines: 추출된 모든 머신 (구조 오류나 ID 중복으로 건너뛴 머신 포함)</li>
 *   <li>acceptedMachines: 검증을 통과해 분석 대상이 된 머신 ID, 추출 순서</li>
 *   <li>reachability, livenessAnalysis, performanceByMachine: 분석된 머신만, 추출 순서</li>
 *   <li>protocolCompliance: 머신별 결과 병합 (머신이 없으면 준수, 점수 1.0)</li>
 *   <li>performanceMetrics: 머신별 지표 집계, analysisTime은 호출 전체 경과 시간 (프로파일링 비활성화 시 empty)</li>
 *   <li>finalPhase: DONE 또는 ABORTED</li>
 * </ul>
 *
 * @param stateMachines 추출된 머신
 * @param acceptedMachines 분석 대상으로 채택된 머신 ID
 * @param reachability 머신별 도달성 결과
 * @param livenessAnalysis 머신별 활성 결과
 * @param protocolCompliance 병합된 준수성 결과
 * @param performanceMetrics 집계 성능 지표
 * @param performanceByMachine 머신별 성능 지표
 * @param warnings 경고 (발생 순서)
 * @param finalPhase 최종 단계
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public record StateMachineAnalysis(
    List<ProtocolStateMachine> stateMachines,
    List<MachineId> acceptedMachines,
    Map<MachineId, ReachabilityResult> reachability,
    Map<MachineId, LivenessResult> livenessAnalysis,
    ComplianceResult protocolCompliance,
    PerformanceMetrics performanceMetrics,
    Map<MachineId, PerformanceMetrics> performanceByMachine,
    List<AnalysisWarning> warnings,
    AnalysisPhase finalPhase
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null이거나 finalPhase가 종료 상태가 아닌 경우
     */
    public StateMachineAnalysis {
        if (stateMachines == null || acceptedMachines == null) {
            throw new IllegalArgumentException("stateMachines and acceptedMachines cannot be null");
        }
        if (acceptedMachines.size() > stateMachines.size()) {
            throw new IllegalArgumentException(String.format(
                "acceptedMachines (%d) cannot exceed stateMachines (%d)", acceptedMachines.size(), stateMachines.size()));
        }
        if (reachability == null || livenessAnalysis == null || performanceByMachine == null) {
            throw new IllegalArgumentException("machines and per-machine results cannot be null");
        }
        if (protocolCompliance == null || performanceMetrics == null || warnings == null) {
            throw new IllegalArgumentException("compliance, metrics and warnings cannot be null");
        }
        if (finalPhase == null || !finalPhase.isTerminal()) {
            throw new IllegalArgumentException("finalPhase must be terminal (current: " + finalPhase + ")");
        }
        stateMachines = List.copyOf(stateMachines);
        acceptedMachines = List.copyOf(acceptedMachines);
        reachability = Collections.unmodifiableMap(new LinkedHashMap<>(reachability));
        livenessAnalysis = Collections.unmodifiableMap(new LinkedHashMap<>(livenessAnalysis));
        performanceByMachine = Collections.unmodifiableMap(new LinkedHashMap<>(performanceByMachine));
        warnings = List.copyOf(warnings);
    }

    /**
     * 머신 없는 결과 생성.
     *
     * @param finalPhase 최종 단계
     * @param warnings 경고
     * @return 빈 분석 결과
     */
    public static StateMachineAnalysis empty(AnalysisPhase finalPhase, List<AnalysisWarning> warnings) {
        return new StateMachineAnalysis(List.of(), List.of(), Map.of(), Map.of(), ComplianceResult.empty(),
            PerformanceMetrics.empty(), Map.of(), warnings, finalPhase);
    }

    /**
     * 모든 단계가 정상 완료되었는지 확인.
     *
     * @return finalPhase가 DONE이면 true
     */
    public boolean isComplete() {
        return finalPhase == AnalysisPhase.DONE;
    }

    /**
     * 검증 단계에서 제외된 머신 수.
     *
     * @return stateMachines 수 - acceptedMachines 수
     */
    public int skippedMachineCount() {
        return stateMachines.size() - acceptedMachines.size();
    }

    public boolean hasWarning(WarningKind kind) {
        return warnings.stream().anyMatch(warning -> warning.kind() == kind);
    }

    public List<AnalysisWarning> warningsOf(WarningKind kind) {
        return warnings.stream().filter(warning -> warning.kind() == kind).toList();
    }
}
