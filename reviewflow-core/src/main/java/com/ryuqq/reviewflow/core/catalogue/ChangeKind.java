package com.ryuqq.reviewflow.core.catalogue;

/**
 * 잠긴 카탈로그 항목에 대한 변경 요청의 분류.
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public enum ChangeKind {

    /**
     * 의미가 바뀌지 않는 정정 (오탈자, 서식).
     * 즉시 새 버전을 만들고 알림만 남깁니다.
     */
    CLERICAL,

    /**
     * 내용의 의미가 바뀌는 변경. 항상 Escalation을 거칩니다.
     */
    BEHAVIORAL,

    /**
     * 삭제. 잠긴 항목에 대해서는 항상 거부됩니다.
     */
    DELETION
}
