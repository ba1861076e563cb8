package com.ryuqq.reviewflow.core.model;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 전체 단계 구성 (정적 설정).
 *
 * <p>단계별 필수 리뷰어 역할과 안전 우선순위를 조회하는 테이블 역할을 합니다.
 * 단계 번호는 1부터 N까지 빠짐없이 연속해야 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * PhasePlan plan = PhasePlan.builder()
 *     .phase("inventory")
 *         .reviewers(Role.ARCHITECT, Role.TEST_ENGINEER)
 *         .criterion("items-done", "all work items done", CriterionKind.ALL_WORK_ITEMS_DONE)
 *         .and()
 *     .phase("translation")
 *         .reviewers(Role.DOMAIN_EXPERT, Role.QUALITY_REVIEWER)
 *         .manualCriterion("signoff", "architect sign-off")
 *         .and()
 *     .build();
 * </pre>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public final class PhasePlan {

    private final List<PhaseDefinition> phases;

    private PhasePlan(List<PhaseDefinition> phases) {
        if (phases == null || phases.isEmpty()) {
            throw new IllegalArgumentException("a phase plan needs at least one phase");
        }
        for (int i = 0; i < phases.size(); i++) {
            if (phases.get(i).ordinal() != i + 1) {
                throw new IllegalArgumentException(
                    "phase ordinals must be contiguous from 1 (position " + i + " has ordinal " + phases.get(i).ordinal() + ")");
            }
        }
        this.phases = List.copyOf(phases);
    }

    /**
     * 정의 목록으로 PhasePlan 생성.
     *
     * @param phases 단계 정의 (ordinal 순서)
     * @return PhasePlan
     * @throws IllegalArgumentException 비어있거나 번호가 연속하지 않는 경우
     */
    public static PhasePlan of(List<PhaseDefinition> phases) {
        return new PhasePlan(phases);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 단계 수.
     */
    public int size() {
        return phases.size();
    }

    /**
     * 단계 정의 조회.
     *
     * @param ordinal 단계 번호
     * @return 단계 정의
     * @throws IllegalArgumentException 존재하지 않는 단계인 경우
     */
    public PhaseDefinition definition(int ordinal) {
        if (ordinal < 1 || ordinal > phases.size()) {
            throw new IllegalArgumentException(
                String.format("unknown phase %d (plan has %d phases)", ordinal, phases.size()));
        }
        return phases.get(ordinal - 1);
    }

    /**
     * 단계의 필수 리뷰어 역할 (RequiredReviewerRoles).
     */
    public Set<Role> requiredReviewers(int ordinal) {
        return definition(ordinal).requiredReviewers();
    }

    /**
     * 단계의 안전 우선순위.
     */
    public Concern safetyPriority(int ordinal) {
        return definition(ordinal).safetyPriority();
    }

    public List<PhaseDefinition> phases() {
        return phases;
    }

    /**
     * PhasePlan 빌더.
     */
    public static final class Builder {

        private final List<PhaseBuilder> pending = new ArrayList<>();

        private Builder() {
        }

        /**
         * 다음 순서의 단계 추가.
         *
         * @param name 단계 이름
         * @return 단계 빌더
         */
        public PhaseBuilder phase(String name) {
            PhaseBuilder builder = new PhaseBuilder(this, pending.size() + 1, name);
            pending.add(builder);
            return builder;
        }

        /**
         * PhasePlan 생성.
         *
         * <p>안전 우선순위를 지정하지 않은 단계는
         * {@link Concern#priorityFor(int, int)}의 기본값을 사용합니다.</p>
         */
        public PhasePlan build() {
            int total = pending.size();
            List<PhaseDefinition> definitions = new ArrayList<>(total);
            for (PhaseBuilder builder : pending) {
                Concern priority = builder.priority != null
                    ? builder.priority
                    : Concern.priorityFor(builder.ordinal, total);
                definitions.add(new PhaseDefinition(
                    builder.ordinal, builder.name, builder.criteria, builder.reviewers, priority));
            }
            return new PhasePlan(definitions);
        }
    }

    /**
     * 단계 하나의 빌더.
     */
    public static final class PhaseBuilder {

        private final Builder parent;
        private final int ordinal;
        private final String name;
        private final List<CriterionDefinition> criteria = new ArrayList<>();
        private final Set<Role> reviewers = EnumSet.noneOf(Role.class);
        private Concern priority;

        private PhaseBuilder(Builder parent, int ordinal, String name) {
            this.parent = parent;
            this.ordinal = ordinal;
            this.name = name;
        }

        public PhaseBuilder reviewers(Role... roles) {
            reviewers.addAll(List.of(roles));
            return this;
        }

        public PhaseBuilder criterion(String id, String description, CriterionKind kind) {
            criteria.add(new CriterionDefinition(id, description, kind));
            return this;
        }

        public PhaseBuilder manualCriterion(String id, String description) {
            return criterion(id, description, CriterionKind.MANUAL);
        }

        public PhaseBuilder safetyPriority(Concern concern) {
            this.priority = concern;
            return this;
        }

        /**
         * 상위 빌더로 복귀.
         */
        public Builder and() {
            return parent;
        }
    }
}
