package com.ryuqq.reviewflow.core.model;

import java.util.Optional;

/**
 * Work Item 하나에 대한 변경 제안.
 *
 * <p>내용(content)은 엔진에게 불투명하며, 엔진은 메타데이터만 읽습니다:
 * 제안 역할, 대상 Work Item, 대상 카탈로그 항목, 선언된 영향도.</p>
 *
 * <p><strong>영향도(impact):</strong> 변경이 기존 동작/내용을 얼마나 바꾸는지를
 * 제안자가 선언한 0 이상의 정수입니다. 교착 상태에서 보수적인 선택지를
 * 고를 때만 사용됩니다.</p>
 *
 * @param id 제안 식별자
 * @param workItemId 대상 Work Item
 * @param phase 제안이 속한 단계
 * @param proposer 제안 역할
 * @param content 제안 내용
 * @param target 대상 카탈로그 항목 (순수 코드 변경이면 null)
 * @param impact 선언된 영향도 (0 이상)
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public record ChangeProposal(
    ProposalId id,
    WorkItemId workItemId,
    int phase,
    Role proposer,
    Payload content,
    EntryId target,
    int impact
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public ChangeProposal {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (workItemId == null) {
            throw new IllegalArgumentException("workItemId cannot be null");
        }
        if (phase < 1) {
            throw new IllegalArgumentException("phase must be positive (current: " + phase + ")");
        }
        if (proposer == null) {
            throw new IllegalArgumentException("proposer cannot be null");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        if (impact < 0) {
            throw new IllegalArgumentException("impact must be non-negative (current: " + impact + ")");
        }
    }

    /**
     * 카탈로그 항목을 대상으로 하는 제안 생성.
     */
    public static ChangeProposal forEntry(WorkItemId workItemId, int phase, Role proposer,
                                          Payload content, EntryId target, int impact) {
        return new ChangeProposal(ProposalId.random(), workItemId, phase, proposer, content, target, impact);
    }

    /**
     * Chronicle에만 기록되는 순수 코드 변경 제안 생성.
     */
    public static ChangeProposal forCode(WorkItemId workItemId, int phase, Role proposer,
                                         Payload content, int impact) {
        return new ChangeProposal(ProposalId.random(), workItemId, phase, proposer, content, null, impact);
    }

    /**
     * 대상 카탈로그 항목 조회.
     *
     * @return 대상 항목 (순수 코드 변경이면 empty)
     */
    public Optional<EntryId> targetEntry() {
        return Optional.ofNullable(target);
    }

    /**
     * 내용만 바꾼 새 제안 생성 (제안자의 수정본).
     *
     * @param revised 수정된 내용
     * @return 새 ChangeProposal (id 동일)
     */
    public ChangeProposal withContent(Payload revised) {
        return new ChangeProposal(id, workItemId, phase, proposer, revised, target, impact);
    }
}
