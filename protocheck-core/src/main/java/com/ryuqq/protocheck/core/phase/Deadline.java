package com.ryuqq.protocheck.core.phase;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * 협력적(cooperative) 타임아웃 기한.
 *
 * <p>분석기는 단계 경계와 사이클 열거 루프 안에서 {@link #isExpired()}를 확인하고
 * 스스로 중단합니다. 스레드를 인터럽트하지 않습니다.</p>
 *
 * <p>시계는 나노초 단위 {@link LongSupplier}로 주입할 수 있어 테스트에서 시간을 제어할 수 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Deadline deadline = Deadline.start(Duration.ofSeconds(60));
 * while (hasWork()) {
 *     if (deadline.isExpired()) {
 *         break; // 부분 결과 반환
 *     }
 *     step();
 * }
 * </pre>
 *
 * @author Protocheck Team
 * @since 1.0.0
 */
public final class Deadline {

    private final LongSupplier nanoClock;
    private final long startNanos;
    private final long timeoutNanos;

    private Deadline(LongSupplier nanoClock, Duration timeout) {
        if (nanoClock == null) {
            throw new IllegalArgumentException("nanoClock cannot be null");
        }
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative (current: " + timeout + ")");
        }
        this.nanoClock = nanoClock;
        this.startNanos = nanoClock.getAsLong();
        this.timeoutNanos = saturatedNanos(timeout);
    }

    /**
     * 시스템 시계로 기한 시작.
     *
     * @param timeout 시간 예산
     * @return Deadline 인스턴스
     */
    public static Deadline start(Duration timeout) {
        return new Deadline(System::nanoTime, timeout);
    }

    /**
     * 주입한 시계로 기한 시작.
     *
     * @param timeout 시간 예산
     * @param nanoClock 나노초 시계
     * @return Deadline 인스턴스
     */
    public static Deadline start(Duration timeout, LongSupplier nanoClock) {
        return new Deadline(nanoClock, timeout);
    }

    /**
     * 만료되지 않는 기한.
     *
     * @return 무제한 Deadline
     */
    public static Deadline none() {
        return new Deadline(System::nanoTime, Duration.ofNanos(Long.MAX_VALUE));
    }

    /**
     * 기한이 지났는지 확인.
     *
     * <p>timeout이 0이면 시작 즉시 만료됩니다.</p>
     *
     * @return 경과 시간이 timeout 이상이면 true
     */
    public boolean isExpired() {
        return elapsedNanos() >= timeoutNanos;
    }

    public Duration elapsed() {
        return Duration.ofNanos(elapsedNanos());
    }

    public Duration timeout() {
        return Duration.ofNanos(timeoutNanos);
    }

    /**
     * 남은 시간.
     *
     * @return 남은 시간 (만료되었으면 Duration.ZERO)
     */
    public Duration remaining() {
        long remaining = timeoutNanos - elapsedNanos();
        return remaining > 0 ? Duration.ofNanos(remaining) : Duration.ZERO;
    }

    private long elapsedNanos() {
        return Math.max(0L, nanoClock.getAsLong() - startNanos);
    }

    private static long saturatedNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
