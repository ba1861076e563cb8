package com.ryuqq.reviewflow.core.resolver;

import com.ryuqq.reviewflow.core.model.ChangeProposal;
import com.ryuqq.reviewflow.core.model.Concern;
import com.ryuqq.reviewflow.core.model.Position;

import java.util.List;

/**
 * 토론 2라운드 후에도 합의가 없을 때 해결기에 넘기는 입력.
 *
 * @param proposal 분쟁 중인 제안 (마지막 수정본)
 * @param phasePriority 해당 Phase의 안전 우선순위
 * @param positions 모든 토론 라운드의 Position
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public record ResolutionRequest(ChangeProposal proposal, Concern phasePriority, List<Position> positions) {

    public ResolutionRequest {
        if (proposal == null) {
            throw new IllegalArgumentException("proposal cannot be null");
        }
        if (phasePriority == null) {
            throw new IllegalArgumentException("phasePriority cannot be null");
        }
        positions = positions == null ? List.of() : List.copyOf(positions);
    }
}
