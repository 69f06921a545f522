package com.ryuqq.transferchain.core.request;

/**
 * 규제자의 양도 승인 요청.
 *
 * @param asset 자산 이름
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public record ApproveTransferRequest(String asset) implements ActionRequest {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException asset이 null이거나 빈 문자열인 경우
     */
    public ApproveTransferRequest {
        ActionRequest.requireAsset(asset);
    }

    @Override
    public TransferAction action() {
        return TransferAction.ACCEPT;
    }
}
