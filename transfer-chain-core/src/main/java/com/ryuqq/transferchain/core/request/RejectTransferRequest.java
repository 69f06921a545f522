package com.ryuqq.transferchain.core.request;

/**
 * 예정 소유자의 양도 거절 요청.
 *
 * @param asset 자산 이름
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public record RejectTransferRequest(String asset) implements ActionRequest {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException asset이 null이거나 빈 문자열인 경우
     */
    public RejectTransferRequest {
        ActionRequest.requireAsset(asset);
    }

    @Override
    public TransferAction action() {
        return TransferAction.REJECT;
    }
}
