package com.ryuqq.reviewflow.core.model;

/**
 * 외부 인벤토리로부터 수신한 Work Item 기술자.
 *
 * @param id 불투명 식별자
 * @param phase 배정된 단계 (1 이상)
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public record WorkItemDescriptor(WorkItemId id, int phase) {

    public WorkItemDescriptor {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (phase < 1) {
            throw new IllegalArgumentException("phase must be positive (current: " + phase + ")");
        }
    }

    public static WorkItemDescriptor of(String id, int phase) {
        return new WorkItemDescriptor(WorkItemId.of(id), phase);
    }
}
