package com.ryuqq.reviewflow.core.escalation;

import com.ryuqq.reviewflow.core.model.Payload;

import java.util.Optional;

/**
 * Escalation에 대한 사람의 결정.
 *
 * @param verdict 승인/거부
 * @param text 결정 문구 (Chronicle에 그대로 기록)
 * @param replacement 승인 시 원래 내용 대신 반영할 내용 (없으면 null)
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public record EscalationDecision(EscalationVerdict verdict, String text, Payload replacement) {

    public EscalationDecision {
        if (verdict == null) {
            throw new IllegalArgumentException("verdict cannot be null");
        }
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("decision text cannot be null or blank");
        }
        if (replacement != null && verdict == EscalationVerdict.REJECT) {
            throw new IllegalArgumentException("a rejection cannot carry replacement content");
        }
    }

    public static EscalationDecision approve(String text) {
        return new EscalationDecision(EscalationVerdict.APPROVE, text, null);
    }

    public static EscalationDecision approveWith(String text, Payload replacement) {
        return new EscalationDecision(EscalationVerdict.APPROVE, text, replacement);
    }

    public static EscalationDecision reject(String text) {
        return new EscalationDecision(EscalationVerdict.REJECT, text, null);
    }

    public boolean isApproved() {
        return verdict == EscalationVerdict.APPROVE;
    }

    public Optional<Payload> replacementContent() {
        return Optional.ofNullable(replacement);
    }
}
