package com.ryuqq.reviewflow.core.resolver;

import com.ryuqq.reviewflow.core.model.Payload;

/**
 * 충돌 해결기가 비교하는 후보 하나.
 *
 * @param kind 후보 출처
 * @param label 사람이 읽을 수 있는 이름 (로그/Chronicle 기록용)
 * @param content 채택 시 반영될 내용 (RETAIN_CURRENT이면 null)
 * @param impact 기존 동작/내용을 바꾸는 정도 (작을수록 보수적)
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public record DecisionOption(OptionKind kind, String label, Payload content, int impact) {

    public DecisionOption {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("label cannot be null or blank");
        }
        if (kind != OptionKind.RETAIN_CURRENT && content == null) {
            throw new IllegalArgumentException(kind + " option requires content");
        }
        if (impact < 0) {
            throw new IllegalArgumentException("impact must be non-negative (current: " + impact + ")");
        }
    }

    public static DecisionOption proposed(Payload content, int impact) {
        return new DecisionOption(OptionKind.PROPOSED, "proposed", content, impact);
    }

    public static DecisionOption alternative(String label, Payload content, int impact) {
        return new DecisionOption(OptionKind.ALTERNATIVE, label, content, impact);
    }

    public static DecisionOption retainCurrent() {
        return new DecisionOption(OptionKind.RETAIN_CURRENT, "retain-current", null, 0);
    }

    /**
     * 이 후보를 채택하면 변경이 반영되는지 여부.
     */
    public boolean changesContent() {
        return kind != OptionKind.RETAIN_CURRENT;
    }
}
