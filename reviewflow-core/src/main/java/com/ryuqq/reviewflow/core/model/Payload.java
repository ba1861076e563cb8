package com.ryuqq.reviewflow.core.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 제안 또는 카탈로그 항목의 내용 (엔진에게는 불투명).
 *
 * <p>엔진은 내용을 해석하지 않으며, 스냅샷 참조를 만들기 위한
 * 다이제스트 계산에만 사용합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>규칙 텍스트: Payload.of("amounts are rounded half-even")</li>
 *   <li>코드 변경 설명: Payload.of("{\"file\":\"Parser.java\",\"hunks\":3}")</li>
 *   <li>빈 Payload: Payload.empty()</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가. 동일한 Payload는
 * 조회할 때마다 바이트 단위로 동일한 내용을 반환합니다.</p>
 *
 * @author ReviewFlow Team
 * @since 1.0.0
 */
public final class Payload {

    private final String value;

    private Payload(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Payload value cannot be null (use Payload.empty())");
        }
        this.value = value;
    }

    /**
     * Payload 생성.
     *
     * @param value Payload 값 (null 불가, 빈 문자열 허용)
     * @return Payload 인스턴스
     * @throws IllegalArgumentException value가 null인 경우
     */
    public static Payload of(String value) {
        return new Payload(value);
    }

    /**
     * 빈 Payload 생성.
     *
     * @return 빈 Payload 인스턴스
     */
    public static Payload empty() {
        return new Payload("");
    }

    /**
     * Payload 값 조회.
     *
     * @return Payload 값
     */
    public String getValue() {
        return value;
    }

    /**
     * Payload가 비어있는지 확인.
     *
     * @return 비어있으면 true
     */
    public boolean isEmpty() {
        return value.isEmpty();
    }

    /**
     * 내용의 SHA-256 다이제스트 (소문자 hex).
     *
     * @return 64자 hex 문자열
     */
    public String digest() {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // 모든 JDK는 SHA-256을 제공해야 함
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Chronicle의 before/after 필드에 사용하는 스냅샷 참조.
     *
     * @return "sha256:" 접두사가 붙은 다이제스트
     */
    public String snapshotRef() {
        return "sha256:" + digest();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Payload payload = (Payload) o;
        return value.equals(payload.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Payload{" + value.length() + " chars}";
    }
}
