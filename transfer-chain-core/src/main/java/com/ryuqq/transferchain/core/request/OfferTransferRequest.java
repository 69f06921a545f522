package com.ryuqq.transferchain.core.request;

/**
 * 소유자의 양도 제안 요청.
 *
 * @param asset 자산 이름
 * @param newOwner 제안받는 새 소유자 (확인해야 할 구매자)
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public record OfferTransferRequest(String asset, String newOwner) implements ActionRequest {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException asset 또는 newOwner가 null이거나 빈 문자열인 경우
     */
    public OfferTransferRequest {
        ActionRequest.requireAsset(asset);
        if (newOwner == null || newOwner.isBlank()) {
            throw new IllegalArgumentException("newOwner cannot be null or blank");
        }
    }

    @Override
    public TransferAction action() {
        return TransferAction.TRANSFER;
    }
}
