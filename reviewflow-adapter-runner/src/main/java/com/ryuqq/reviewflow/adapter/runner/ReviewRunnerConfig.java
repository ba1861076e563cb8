package com.ryuqq.reviewflow.adapter.runner;

/**
 * ConsensusReviewRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: 동시에 진행할 리뷰 수 (기본 4)</li>
 *   <li>maxResponseRetries: 투표/Position/수정본 재요청 횟수, 소진 시 Escalation (기본 3)</li>
 *   <li>maxRevisionCycles: REQUESTED_CHANGE로 인한 수정-재투표 반복 한도, 초과 시 교착 처리 (기본 2)</li>
 *   <li>backoffBaseMs / backoffMaxMs / jitterFactor: 응답 대기 간격 (기본 2000ms / 60000ms / 0.1)</li>
 *   <li>finishedRetentionMs: 끝난 리뷰의 상태를 조회할 수 있게 남겨두는 시간 (기본 10분)</li>
 * </ul>
 *
 * <p>토론 라운드 한도는 설정이 아니라 {@link ConsensusReviewRunner#MAX_DEBATE_ROUNDS}로 고정입니다.</p>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 * @param concurrency 동시 리뷰 수 (1 이상)
 * @param maxResponseRetries 재요청 횟수 (0 이상)
 * @param maxRevisionCycles 수정 반복 한도 (0 이상)
 * @param backoffBaseMs 첫 대기 시간 (밀리초, 양수)
 * @param backoffMaxMs 최대 대기 시간 (밀리초, backoffBaseMs 이상)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 * @param finishedRetentionMs 끝난 리뷰 보관 시간 (밀리초, 0 이상)
 */
public record ReviewRunnerConfig(
    int concurrency,
    int maxResponseRetries,
    int maxRevisionCycles,
    long backoffBaseMs,
    long backoffMaxMs,
    double jitterFactor,
    long finishedRetentionMs
) {

    /**
     * 기본 설정 생성자.
     */
    public ReviewRunnerConfig() {
        this(4, 3, 2, 2000, 60000, 0.1, 600_000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ReviewRunnerConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive (current: " + concurrency + ")");
        }
        if (maxResponseRetries < 0) {
            throw new IllegalArgumentException(
                "maxResponseRetries must be non-negative (current: " + maxResponseRetries + ")");
        }
        if (maxRevisionCycles < 0) {
            throw new IllegalArgumentException(
                "maxRevisionCycles must be non-negative (current: " + maxRevisionCycles + ")");
        }
        if (backoffBaseMs <= 0) {
            throw new IllegalArgumentException("backoffBaseMs must be positive (current: " + backoffBaseMs + ")");
        }
        if (backoffMaxMs < backoffBaseMs) {
            throw new IllegalArgumentException(
                "backoffMaxMs must be >= backoffBaseMs (base: " + backoffBaseMs + ", max: " + backoffMaxMs + ")");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")");
        }
        if (finishedRetentionMs < 0) {
            throw new IllegalArgumentException(
                "finishedRetentionMs must be non-negative (current: " + finishedRetentionMs + ")");
        }
    }

    public ReviewRunnerConfig withConcurrency(int concurrency) {
        return new ReviewRunnerConfig(concurrency, maxResponseRetries, maxRevisionCycles, backoffBaseMs, backoffMaxMs,
            jitterFactor, finishedRetentionMs);
    }

    public ReviewRunnerConfig withMaxResponseRetries(int maxResponseRetries) {
        return new ReviewRunnerConfig(concurrency, maxResponseRetries, maxRevisionCycles, backoffBaseMs, backoffMaxMs,
            jitterFactor, finishedRetentionMs);
    }

    public ReviewRunnerConfig withMaxRevisionCycles(int maxRevisionCycles) {
        return new ReviewRunnerConfig(concurrency, maxResponseRetries, maxRevisionCycles, backoffBaseMs, backoffMaxMs,
            jitterFactor, finishedRetentionMs);
    }

    /**
     * 대기 간격만 변경한 새 인스턴스 생성.
     */
    public ReviewRunnerConfig withBackoff(long backoffBaseMs, long backoffMaxMs, double jitterFactor) {
        return new ReviewRunnerConfig(concurrency, maxResponseRetries, maxRevisionCycles, backoffBaseMs, backoffMaxMs,
            jitterFactor, finishedRetentionMs);
    }

    public ReviewRunnerConfig withFinishedRetentionMs(long finishedRetentionMs) {
        return new ReviewRunnerConfig(concurrency, maxResponseRetries, maxRevisionCycles, backoffBaseMs, backoffMaxMs,
            jitterFactor, finishedRetentionMs);
    }
}
