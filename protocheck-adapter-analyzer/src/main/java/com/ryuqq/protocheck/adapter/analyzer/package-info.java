/**
 * Analyzer Adapter Layer - AnalysisEngine 구현체.
 *
 * <p>이 패키지는 AnalysisEngine 인터페이스의 기본 구현체와 분석기들을 포함합니다.</p>
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.protocheck.adapter.analyzer.DefaultAnalysisEngine} - Phase 단위 오케스트레이터</li>
 *   <li>{@link com.ryuqq.protocheck.adapter.analyzer.ReachabilityAnalyzer} - BFS 도달성, SCC, 순환 열거</li>
 *   <li>{@link com.ryuqq.protocheck.adapter.analyzer.LivenessAnalyzer} - deadlock/livelock, safety/liveness 의무, fairness</li>
 *   <li>{@link com.ryuqq.protocheck.adapter.analyzer.ComplianceChecker} - 규칙 기반 준수 점수</li>
 *   <li>{@link com.ryuqq.protocheck.adapter.analyzer.PerformanceProfiler} - 크기/복잡도 지표</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-analyzer (DefaultAnalysisEngine)
 *   ↓ implements
 * application (AnalysisEngine interface)
 *   ↓ depends on
 * core (ProtocolStateMachine, 결과 타입, AnalysisPhase)
 *   ↓ depends on
 * core/spi (Extractor, FormalVerifier, TemporalLogicSolver)
 * </pre>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
package com.ryuqq.protocheck.adapter.analyzer;
