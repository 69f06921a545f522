package com.ryuqq.transferchain.core.model;

/**
 * 규제자 결정을 기다리는 양도.
 *
 * <p>{@code address(TRANSFER_APPROVE, asset)}에 저장됩니다.
 * owner는 승인 시 새 소유자가 될 구매자입니다.</p>
 *
 * @param name 자산 이름
 * @param owner 예정된 새 소유자
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public record TransferApproval(
    String name,
    String owner
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name 또는 owner가 null인 경우
     */
    public TransferApproval {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
    }
}
