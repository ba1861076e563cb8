package com.ryuqq.reviewflow.core.resolver;

import com.ryuqq.reviewflow.core.model.Concern;
import com.ryuqq.reviewflow.core.model.Position;
import com.ryuqq.reviewflow.core.model.Stance;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 토론이 끝난 뒤 남은 분쟁을 규칙으로 판정하는 순수 함수.
 *
 * <p><strong>후보:</strong></p>
 * <ul>
 *   <li>PROPOSED: 제안 내용, SUPPORT Position이 지지</li>
 *   <li>ALTERNATIVE: 대안을 제시한 Position마다 하나 (같은 내용이면 하나로 합침)</li>
 *   <li>RETAIN_CURRENT: 대안 없이 OPPOSE한 Position이 지지, 영향도 0</li>
 * </ul>
 *
 * <p><strong>규칙 (순서대로):</strong></p>
 * <ol>
 *   <li>Phase 우선 관심사와 같은 concern의 Position이 지지하는 후보가 정확히 하나면 채택</li>
 *   <li>여러 개면 그 후보들만 남기고, 없으면 지지받는 후보 전체로 다음 규칙 적용</li>
 *   <li>영향도가 유일하게 가장 작은 후보 채택</li>
 *   <li>그 외에는 보류</li>
 * </ol>
 *
 * <p>상태를 갖지 않으며 같은 입력에는 항상 같은 결과를 냅니다.</p>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public final class ConflictResolver {

    public ResolverDecision decide(ResolutionRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }

        Map<DecisionOption, List<Position>> backed = candidates(request);
        if (backed.isEmpty()) {
            return new ResolverDecision.Defer("no option is backed by any position");
        }

        Concern priority = request.phasePriority();
        List<DecisionOption> prioritized = backed.entrySet().stream()
            .filter(e -> e.getValue().stream().anyMatch(p -> p.concern() == priority))
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());

        if (prioritized.size() == 1) {
            return new ResolverDecision.Adopt(prioritized.get(0), ResolverDecision.Basis.PRIORITY);
        }

        List<DecisionOption> pool = prioritized.isEmpty() ? new ArrayList<>(backed.keySet()) : prioritized;
        int lowest = pool.stream().mapToInt(DecisionOption::impact).min().orElseThrow();
        List<DecisionOption> mostConservative = pool.stream()
            .filter(o -> o.impact() == lowest)
            .collect(Collectors.toList());

        if (mostConservative.size() == 1) {
            return new ResolverDecision.Adopt(mostConservative.get(0), ResolverDecision.Basis.CONSERVATIVE);
        }

        return new ResolverDecision.Defer(String.format(
            "%d options tie at impact %d: %s", mostConservative.size(), lowest,
            mostConservative.stream().map(DecisionOption::label).collect(Collectors.joining(", "))));
    }

    private Map<DecisionOption, List<Position>> candidates(ResolutionRequest request) {
        Map<DecisionOption, List<Position>> backed = new LinkedHashMap<>();
        DecisionOption proposed = DecisionOption.proposed(request.proposal().content(), request.proposal().impact());
        DecisionOption retain = DecisionOption.retainCurrent();

        for (Position position : request.positions()) {
            DecisionOption option;
            if (position.stance() == Stance.SUPPORT) {
                option = proposed;
            } else if (position.alternative() != null) {
                option = alternativeFor(backed, position);
            } else {
                option = retain;
            }
            backed.computeIfAbsent(option, k -> new ArrayList<>()).add(position);
        }
        return backed;
    }

    private DecisionOption alternativeFor(Map<DecisionOption, List<Position>> backed, Position position) {
        for (DecisionOption existing : backed.keySet()) {
            if (existing.kind() == OptionKind.ALTERNATIVE
                && existing.content().equals(position.alternative())
                && existing.impact() == position.alternativeImpact()) {
                return existing;
            }
        }
        return DecisionOption.alternative(
            "alternative-" + position.role().name().toLowerCase(), position.alternative(), position.alternativeImpact());
    }
}
