package com.ryuqq.reviewflow.core.exception;

import com.ryuqq.reviewflow.core.model.WorkItemId;

/**
 * Work Item에 이미 활성 제안이 있는 상태에서 배정/제출을 시도함.
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public class DuplicateSubmissionException extends ReviewFlowException {

    public static final String ERROR_CODE = "ROUTE-001";

    private final WorkItemId workItemId;

    public DuplicateSubmissionException(WorkItemId workItemId, String detail) {
        super(ERROR_CODE, "Duplicate submission for " + workItemId + ": " + detail);
        this.workItemId = workItemId;
    }

    public WorkItemId getWorkItemId() {
        return workItemId;
    }
}
