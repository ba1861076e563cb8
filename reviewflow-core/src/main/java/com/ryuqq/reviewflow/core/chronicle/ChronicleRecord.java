package com.ryuqq.reviewflow.core.chronicle;

import com.ryuqq.reviewflow.core.model.Position;
import com.ryuqq.reviewflow.core.model.ProposalId;
import com.ryuqq.reviewflow.core.model.ReviewVote;
import com.ryuqq.reviewflow.core.model.Role;
import com.ryuqq.reviewflow.core.model.WorkItemId;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Chronicle에 확정된 기록. 생성 후 변경되지 않습니다.
 *
 * @param sequence 전역 순번 (1부터, 빈틈 없음)
 * @param recordedAt 기록 시각
 * @param draft 기록 내용
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public record ChronicleRecord(long sequence, Instant recordedAt, ChronicleDraft draft) {

    public ChronicleRecord {
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be positive (current: " + sequence + ")");
        }
        if (recordedAt == null) {
            throw new IllegalArgumentException("recordedAt cannot be null");
        }
        if (draft == null) {
            throw new IllegalArgumentException("draft cannot be null");
        }
    }

    public ProposalId proposalId() {
        return draft.proposalId();
    }

    public WorkItemId workItemId() {
        return draft.workItemId();
    }

    public int phase() {
        return draft.phase();
    }

    public String beforeRef() {
        return draft.beforeRef();
    }

    public String afterRef() {
        return draft.afterRef();
    }

    public Set<Role> requiredRoles() {
        return draft.requiredRoles();
    }

    public List<ReviewVote> votes() {
        return draft.votes();
    }

    public List<Position> positions() {
        return draft.positions();
    }

    public String decision() {
        return draft.decision();
    }

    public DecisionBasis basis() {
        return draft.basis();
    }

    public List<String> catalogueRefs() {
        return draft.catalogueRefs();
    }
}
