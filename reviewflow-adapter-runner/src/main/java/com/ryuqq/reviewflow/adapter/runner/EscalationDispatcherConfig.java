package com.ryuqq.reviewflow.adapter.runner;

/**
 * EscalationDispatcher 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>threads: 동시에 사람에게 보낼 수 있는 결정 요청 수 (기본 4)</li>
 *   <li>scanIntervalMs: 놓친 Escalation을 다시 찾는 스캔 주기 (기본 30000ms)</li>
 * </ul>
 *
 * <p>결정 요청 하나가 스레드 하나를 오래 점유할 수 있습니다 (타임아웃 없음).
 * 동시에 열려 있을 Escalation 수를 기준으로 threads를 잡으세요.</p>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 * @param threads 결정 요청 스레드 수 (1 이상)
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수)
 */
public record EscalationDispatcherConfig(int threads, long scanIntervalMs) {

    public EscalationDispatcherConfig() {
        this(4, 30000);
    }

    public EscalationDispatcherConfig {
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be positive (current: " + threads + ")");
        }
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException("scanIntervalMs must be positive (current: " + scanIntervalMs + ")");
        }
    }

    public EscalationDispatcherConfig withThreads(int threads) {
        return new EscalationDispatcherConfig(threads, this.scanIntervalMs);
    }

    public EscalationDispatcherConfig withScanIntervalMs(long scanIntervalMs) {
        return new EscalationDispatcherConfig(this.threads, scanIntervalMs);
    }
}
