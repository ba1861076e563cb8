package com.ryuqq.reviewflow.core.catalogue;

/**
 * 잠긴 카탈로그 항목이 새 버전으로 대체될 때의 구독자.
 *
 * <p>CLERICAL 변경(즉시 적용)과 승인된 BEHAVIORAL 변경 모두 통지됩니다.
 * 리스너는 대체를 수행한 스레드에서 동기적으로 호출됩니다.</p>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public interface CatalogueListener {

    /**
     * @param archived 보관된 이전 버전 (SUPERSEDED)
     * @param next     새로 잠긴 버전
     * @param request  대체를 일으킨 변경 요청
     */
    void onSuperseded(CatalogueEntry archived, CatalogueEntry next, ChangeRequest request);
}
