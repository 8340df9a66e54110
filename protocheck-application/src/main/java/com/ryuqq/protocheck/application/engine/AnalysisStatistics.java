package com.ryuqq.protocheck.application.engine;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 호출자가 소유하는 분석 누적 통계.
 *
 * <p>엔진은 호출 간 상태를 보관하지 않습니다. 여러 호출에 걸친 통계가 필요하면
 * 호출자가 이 객체를 생성해 {@link AnalysisEngine#analyzeDocument(com.ryuqq.protocheck.core.document.ProtocolDocument, AnalysisStatistics)}에
 * 전달합니다. 모든 카운터는 원자적으로 갱신되므로 동시 호출 간에 공유할 수 있습니다.</p>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public final class AnalysisStatistics {

    private final AtomicLong documentsAnalyzed = new AtomicLong();
    private final AtomicLong machinesAnalyzed = new AtomicLong();
    private final AtomicLong machinesSkipped = new AtomicLong();
    private final AtomicLong warningsEmitted = new AtomicLong();
    private final AtomicLong abortedAnalyses = new AtomicLong();
    private final AtomicLong unverifiedObligations = new AtomicLong();
    private final AtomicLong totalAnalysisNanos = new AtomicLong();

    /**
     * 분석 한 건 기록.
     *
     * @param analysis 분석 결과
     * @param elapsed 분석 소요 시간
     * @throws IllegalArgumentException analysis 또는 elapsed가 null인 경우
     */
    public void record(StateMachineAnalysis analysis, Duration elapsed) {
        if (analysis == null || elapsed == null) {
            throw new IllegalArgumentException("analysis and elapsed cannot be null");
        }
        documentsAnalyzed.incrementAndGet();
        machinesAnalyzed.addAndGet(analysis.acceptedMachines().size());
        machinesSkipped.addAndGet(analysis.skippedMachineCount());
        warningsEmitted.addAndGet(analysis.warnings().size());
        if (!analysis.isComplete()) {
            abortedAnalyses.incrementAndGet();
        }
        unverifiedObligations.addAndGet(analysis.livenessAnalysis().values().stream()
            .mapToLong(result -> result.unverifiedObligations().size())
            .sum());
        totalAnalysisNanos.addAndGet(elapsed.toNanos());
    }

    public long getDocumentsAnalyzed() {
        return documentsAnalyzed.get();
    }

    /**
     * 구조 검증을 통과해 분석 대상이 된 머신 수.
     *
     * <p>활성화된 Phase 구성과 무관하게 {@link StateMachineAnalysis#acceptedMachines()} 기준으로 셉니다.</p>
     *
     * @return 머신 수
     */
    public long getMachinesAnalyzed() {
        return machinesAnalyzed.get();
    }

    /**
     * 구조 오류 또는 ID 중복으로 분석에서 제외된 머신 수.
     *
     * @return 머신 수
     */
    public long getMachinesSkipped() {
        return machinesSkipped.get();
    }

    public long getWarningsEmitted() {
        return warningsEmitted.get();
    }

    public long getAbortedAnalyses() {
        return abortedAnalyses.get();
    }

    public long getUnverifiedObligations() {
        return unverifiedObligations.get();
    }

    public Duration getTotalAnalysisTime() {
        return Duration.ofNanos(totalAnalysisNanos.get());
    }

    @Override
    public String toString() {
        return "AnalysisStatistics{documents=" + documentsAnalyzed.get()
            + ", machines=" + machinesAnalyzed.get()
            + ", skipped=" + machinesSkipped.get()
            + ", warnings=" + warningsEmitted.get()
            + ", aborted=" + abortedAnalyses.get()
            + ", unverified=" + unverifiedObligations.get() + "}";
    }
}
