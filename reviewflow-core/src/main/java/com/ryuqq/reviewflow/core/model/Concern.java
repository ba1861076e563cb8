package com.ryuqq.reviewflow.core.model;

/**
 * 토론 입장(position)이 근거로 삼는 관심사.
 *
 * <p>단계별 안전 우선순위를 표현합니다: 초기 단계는 테스트 가능성,
 * 중간 단계는 원본 충실도, 후기 단계는 품질을 우선합니다.</p>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public enum Concern {

    TESTABILITY,

    FIDELITY,

    QUALITY,

    /**
     * 단계 우선순위와 무관한 일반 관심사.
     */
    GENERAL;

    /**
     * 단계 순서에 따른 기본 안전 우선순위.
     *
     * <p>전체 단계를 세 구간으로 나누어 앞 구간은 TESTABILITY,
     * 가운데 구간은 FIDELITY, 마지막 구간은 QUALITY를 반환합니다.</p>
     *
     * @param ordinal 단계 번호 (1부터 시작)
     * @param totalPhases 전체 단계 수 (1 이상)
     * @return 해당 단계의 우선 관심사
     * @throws IllegalArgumentException 범위를 벗어난 값인 경우
     */
    public static Concern priorityFor(int ordinal, int totalPhases) {
        if (totalPhases < 1) {
            throw new IllegalArgumentException("totalPhases must be positive (current: " + totalPhases + ")");
        }
        if (ordinal < 1 || ordinal > totalPhases) {
            throw new IllegalArgumentException(
                String.format("ordinal must be between 1 and %d (current: %d)", totalPhases, ordinal));
        }
        // 0-based 위치를 세 구간으로 분할
        int band = (ordinal - 1) * 3 / totalPhases;
        return switch (band) {
            case 0 -> TESTABILITY;
            case 1 -> FIDELITY;
            default -> QUALITY;
        };
    }
}
