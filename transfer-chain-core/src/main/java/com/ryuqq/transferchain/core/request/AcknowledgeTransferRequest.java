package com.ryuqq.transferchain.core.request;

/**
 * 지정 구매자의 양도 확인 요청.
 *
 * @param asset 자산 이름
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public record AcknowledgeTransferRequest(String asset) implements ActionRequest {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException asset이 null이거나 빈 문자열인 경우
     */
    public AcknowledgeTransferRequest {
        ActionRequest.requireAsset(asset);
    }

    @Override
    public TransferAction action() {
        return TransferAction.ACKNOWLEDGE;
    }
}
