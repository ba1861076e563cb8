package com.ryuqq.reviewflow.core.catalogue;

import com.ryuqq.reviewflow.core.model.EntryId;
import com.ryuqq.reviewflow.core.model.Payload;
import com.ryuqq.reviewflow.core.statemachine.EntryStatus;

import java.time.Instant;
import java.util.Optional;

/**
 * 규칙 카탈로그 항목의 한 버전.
 *
 * <p>불변 record입니다. 상태 변경은 새 인스턴스를 만들며,
 * 잠긴(LOCKED) 버전의 내용은 절대 바뀌지 않습니다.</p>
 *
 * @param id 항목 식별자 (버전 간 동일)
 * @param version 버전 번호 (1부터)
 * @param status 이 버전의 상태
 * @param content 규칙 내용
 * @param supersedes 이 버전이 대체한 이전 버전 번호 (최초 버전이면 null)
 * @param note 보관 메모 (정정 diff 메모, 무효화 사유 등, 없으면 빈 문자열)
 * @param updatedAt 마지막 상태 변경 시각
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public record CatalogueEntry(
    EntryId id,
    int version,
    EntryStatus status,
    Payload content,
    Integer supersedes,
    String note,
    Instant updatedAt
) {

    public CatalogueEntry {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (version < 1) {
            throw new IllegalArgumentException("version must be positive (current: " + version + ")");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        if (supersedes != null && supersedes >= version) {
            throw new IllegalArgumentException(
                String.format("supersedes (%d) must point to an earlier version than %d", supersedes, version));
        }
        if (updatedAt == null) {
            throw new IllegalArgumentException("updatedAt cannot be null");
        }
        note = note == null ? "" : note;
    }

    /**
     * 최초 DRAFT 버전 생성.
     */
    public static CatalogueEntry draft(EntryId id, Payload content, Instant now) {
        return new CatalogueEntry(id, 1, EntryStatus.DRAFT, content, null, "", now);
    }

    /**
     * 버전 참조 문자열 (예: "RULE-004@v2").
     */
    public String ref() {
        return id.getValue() + "@v" + version;
    }

    public Optional<Integer> supersededVersion() {
        return Optional.ofNullable(supersedes);
    }

    /**
     * 상태만 바꾼 새 인스턴스 (전이 검증 포함).
     *
     * @throws IllegalStateException 허용되지 않는 전이인 경우
     */
    public CatalogueEntry transitionTo(EntryStatus next, String newNote, Instant now) {
        status.validateTransition(next);
        return new CatalogueEntry(id, version, next, content, supersedes, newNote == null ? note : newNote, now);
    }

    /**
     * 같은 버전에서 내용을 교체한 DRAFT 인스턴스 (잠금 이전 버전 전용).
     *
     * @throws IllegalStateException 잠금 이후 상태인 경우
     */
    public CatalogueEntry redraft(Payload newContent, Instant now) {
        if (!status.isMutable()) {
            throw new IllegalStateException("Cannot redraft " + ref() + " in status " + status);
        }
        return new CatalogueEntry(id, version, EntryStatus.DRAFT, newContent, supersedes, note, now);
    }

    /**
     * 이 버전을 대체하는 다음 버전 생성.
     *
     * @param newContent 새 내용
     * @param newStatus 새 버전의 상태
     * @param newNote 새 버전의 메모
     * @param now 시각
     * @return version+1, supersedes=version 인 새 항목
     */
    public CatalogueEntry successor(Payload newContent, EntryStatus newStatus, String newNote, Instant now) {
        return new CatalogueEntry(id, version + 1, newStatus, newContent, version, newNote, now);
    }
}
