package com.ryuqq.reviewflow.core.exception;

import com.ryuqq.reviewflow.core.model.EntryId;

/**
 * 잠긴 카탈로그 항목을 직접 변경하거나 삭제하려 함.
 *
 * <p>항상 거부되며, 다른 연산으로 조용히 변환되지 않습니다.</p>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public class CatalogueLockViolationException extends ReviewFlowException {

    public static final String ERROR_CODE = "CAT-001";

    private final EntryId entryId;
    private final int version;

    public CatalogueLockViolationException(EntryId entryId, int version, String attempted) {
        super(ERROR_CODE, String.format("%s is locked at version %d, rejected: %s", entryId, version, attempted));
        this.entryId = entryId;
        this.version = version;
    }

    public EntryId getEntryId() {
        return entryId;
    }

    public int getVersion() {
        return version;
    }
}
