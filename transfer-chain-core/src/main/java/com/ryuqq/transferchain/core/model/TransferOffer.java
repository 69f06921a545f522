package com.ryuqq.transferchain.core.model;

/**
 * 구매자 확인을 기다리는 양도 제안.
 *
 * <p>{@code address(TRANSFER_ACKN, asset)}에 저장됩니다.
 * owner는 다음에 확인해야 할 지정 구매자입니다.</p>
 *
 * @param asset 자산 이름
 * @param owner 지정 구매자
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public record TransferOffer(
    String asset,
    String owner
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException asset 또는 owner가 null인 경우
     */
    public TransferOffer {
        if (asset == null) {
            throw new IllegalArgumentException("asset cannot be null");
        }
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
    }
}
