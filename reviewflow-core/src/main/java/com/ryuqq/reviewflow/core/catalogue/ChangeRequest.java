package com.ryuqq.reviewflow.core.catalogue;

import com.ryuqq.reviewflow.core.model.Payload;
import com.ryuqq.reviewflow.core.model.Role;
import com.ryuqq.reviewflow.core.model.WorkItemId;

/**
 * 카탈로그 항목 변경 요청.
 *
 * @param kind 변경 분류
 * @param newContent 새 내용 (DELETION이면 null)
 * @param reason 변경 사유
 * @param requestedBy 요청 역할
 * @param dependentItem 결정이 날 때까지 차단할 Work Item (없으면 null)
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public record ChangeRequest(
    ChangeKind kind,
    Payload newContent,
    String reason,
    Role requestedBy,
    WorkItemId dependentItem
) {

    public ChangeRequest {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (kind != ChangeKind.DELETION && newContent == null) {
            throw new IllegalArgumentException(kind + " change requires new content");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        if (requestedBy == null) {
            throw new IllegalArgumentException("requestedBy cannot be null");
        }
    }

    public static ChangeRequest clerical(Payload newContent, String reason, Role requestedBy) {
        return new ChangeRequest(ChangeKind.CLERICAL, newContent, reason, requestedBy, null);
    }

    public static ChangeRequest behavioral(Payload newContent, String reason, Role requestedBy, WorkItemId dependentItem) {
        return new ChangeRequest(ChangeKind.BEHAVIORAL, newContent, reason, requestedBy, dependentItem);
    }

    public static ChangeRequest deletion(String reason, Role requestedBy) {
        return new ChangeRequest(ChangeKind.DELETION, null, reason, requestedBy, null);
    }
}
