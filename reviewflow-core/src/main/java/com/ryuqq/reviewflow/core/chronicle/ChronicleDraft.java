package com.ryuqq.reviewflow.core.chronicle;

import com.ryuqq.reviewflow.core.model.Position;
import com.ryuqq.reviewflow.core.model.ProposalId;
import com.ryuqq.reviewflow.core.model.ReviewVote;
import com.ryuqq.reviewflow.core.model.Role;
import com.ryuqq.reviewflow.core.model.WorkItemId;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Chronicle에 추가하기 전의 리뷰 기록.
 *
 * <p>순번과 기록 시각은 {@code ChronicleStore}가 부여합니다.
 * 완결성(필수 역할 투표, 결정 문구)은 저장소가 append 시점에 검증합니다.</p>
 *
 * @param proposalId 제안 식별자
 * @param workItemId Work Item 식별자
 * @param phase Phase 번호
 * @param beforeRef 변경 전 스냅샷 참조
 * @param afterRef 변경 후 스냅샷 참조
 * @param requiredRoles 필수 리뷰어 역할
 * @param votes 전체 투표 기록 (모든 라운드)
 * @param positions 토론 기록
 * @param decision 최종 결정 문구
 * @param basis 결정 근거
 * @param catalogueRefs 참조/변경된 카탈로그 항목 ("ID@vN")
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public record ChronicleDraft(
    ProposalId proposalId,
    WorkItemId workItemId,
    int phase,
    String beforeRef,
    String afterRef,
    Set<Role> requiredRoles,
    List<ReviewVote> votes,
    List<Position> positions,
    String decision,
    DecisionBasis basis,
    List<String> catalogueRefs
) {

    public ChronicleDraft {
        if (proposalId == null) {
            throw new IllegalArgumentException("proposalId cannot be null");
        }
        if (workItemId == null) {
            throw new IllegalArgumentException("workItemId cannot be null");
        }
        if (phase < 1) {
            throw new IllegalArgumentException("phase must be positive (current: " + phase + ")");
        }
        if (basis == null) {
            throw new IllegalArgumentException("basis cannot be null");
        }
        requiredRoles = requiredRoles == null || requiredRoles.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(requiredRoles));
        votes = votes == null ? List.of() : List.copyOf(votes);
        positions = positions == null ? List.of() : List.copyOf(positions);
        catalogueRefs = catalogueRefs == null ? List.of() : List.copyOf(catalogueRefs);
        beforeRef = beforeRef == null ? "" : beforeRef;
        afterRef = afterRef == null ? "" : afterRef;
    }

    /**
     * 순번과 기록 시각을 붙여 확정 기록으로 변환.
     */
    public ChronicleRecord sequenced(long sequence, Instant recordedAt) {
        return new ChronicleRecord(sequence, recordedAt, this);
    }
}
