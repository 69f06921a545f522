package com.ryuqq.transferchain.core.model;

/**
 * 자산 소유 기록.
 *
 * <p>{@code address(ASSET, name)}에 저장됩니다. 이름당 한 번만 생성되고,
 * 양도가 승인되면 owner만 바뀌며 삭제되지 않습니다.</p>
 *
 * @param name 자산 이름
 * @param owner 현재 소유자 (서명자 ID)
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public record Asset(
    String name,
    String owner
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name 또는 owner가 null인 경우
     */
    public Asset {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
    }
}
