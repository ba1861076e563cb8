package com.ryuqq.reviewflow.core.escalation;

/**
 * Escalation 발생/처리 이벤트 구독자.
 *
 * <p>리스너는 이벤트를 발생시킨 스레드에서 동기적으로 호출됩니다.</p>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public interface EscalationListener {

    void onRaised(Escalation escalation);

    void onResolved(Escalation escalation);
}
