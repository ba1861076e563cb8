package com.ryuqq.reviewflow.adapter.runner;

import java.util.concurrent.ThreadLocalRandom;

/**
 * 응답 대기 간격 계산기 (Exponential Backoff with Jitter).
 *
 * <p>리뷰어가 응답하지 않으면 대기 시간을 두 배씩 늘려 다시 요청합니다.
 * 여러 리뷰가 같은 리뷰어를 동시에 재촉하지 않도록 jitter를 더합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * wait = min(base * 2^(attempt-1) + jitter, max)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (base=2000ms, max=60000ms):</strong></p>
 * <ul>
 *   <li>attempt=1: 2000-2200ms</li>
 *   <li>attempt=2: 4000-4400ms</li>
 *   <li>attempt=6: 60000ms (max에서 절단)</li>
 * </ul>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;

    /**
     * 기본값: base=2000ms, max=60000ms, jitterFactor=0.1
     */
    public BackoffCalculator() {
        this(2000, 60000, 0.1);
    }

    /**
     * @param baseDelayMs 첫 대기 시간 (밀리초, 양수)
     * @param maxDelayMs 최대 대기 시간 (밀리초, baseDelayMs 이상)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be positive (current: " + baseDelayMs + ")");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
    }

    /**
     * 설정값으로 생성.
     */
    public static BackoffCalculator from(ReviewRunnerConfig config) {
        return new BackoffCalculator(config.backoffBaseMs(), config.backoffMaxMs(), config.jitterFactor());
    }

    /**
     * n번째 대기 시간 계산.
     *
     * @param attempt 대기 차수 (1부터 시작)
     * @return 대기 시간 (밀리초)
     * @throws IllegalArgumentException attempt가 양수가 아닌 경우
     */
    public long calculate(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
        // 2^62 이상은 overflow
        int shift = Math.min(attempt - 1, 62);
        long exponential = baseDelayMs > (maxDelayMs >> shift)
            ? maxDelayMs
            : Math.min(baseDelayMs << shift, maxDelayMs);

        long jitter = (long) (exponential * jitterFactor * ThreadLocalRandom.current().nextDouble());
        return Math.min(exponential + jitter, maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
