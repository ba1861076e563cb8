package com.ryuqq.reviewflow.core.resolver;

/**
 * 충돌 해결 결과.
 *
 * <p>sealed interface로 두 가지 결과만 허용합니다:</p>
 * <ul>
 *   <li>{@link Adopt}: 후보 하나를 채택</li>
 *   <li>{@link Defer}: 규칙으로 결정할 수 없음, 사람에게 넘김</li>
 * </ul>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public sealed interface ResolverDecision permits ResolverDecision.Adopt, ResolverDecision.Defer {

    /**
     * 채택 근거.
     */
    enum Basis {
        /** Phase 안전 우선순위와 일치하는 관심사가 후보 하나만 지지 */
        PRIORITY,
        /** 영향도가 가장 작은 후보가 유일 */
        CONSERVATIVE
    }

    /**
     * 후보 채택.
     *
     * @param option 채택된 후보
     * @param basis 채택 근거
     */
    record Adopt(DecisionOption option, Basis basis) implements ResolverDecision {
        public Adopt {
            if (option == null || basis == null) {
                throw new IllegalArgumentException("option and basis cannot be null");
            }
        }

        public String describe() {
            return String.format("resolver adopted %s (%s, impact %d)", option.label(), basis, option.impact());
        }
    }

    /**
     * 결정 보류.
     *
     * @param reason 보류 사유
     */
    record Defer(String reason) implements ResolverDecision {
        public Defer {
            if (reason == null || reason.isBlank()) {
                throw new IllegalArgumentException("reason cannot be null or blank");
            }
        }
    }

    default boolean isAdopted() {
        return this instanceof Adopt;
    }
}
