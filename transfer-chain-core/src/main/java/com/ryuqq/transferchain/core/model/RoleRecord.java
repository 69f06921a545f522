package com.ryuqq.transferchain.core.model;

/**
 * 역할(규제자, 참여자) 등록 기록.
 *
 * <p>존재 여부만 의미가 있습니다. identity 필드는 저장된 값이 비어있지 않도록
 * 하기 위한 것이며 규칙은 이 값을 읽지 않습니다.</p>
 *
 * @param identity 역할을 가진 서명자 ID
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public record RoleRecord(
    String identity
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException identity가 null이거나 빈 문자열인 경우
     */
    public RoleRecord {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("identity cannot be null or blank");
        }
    }
}
