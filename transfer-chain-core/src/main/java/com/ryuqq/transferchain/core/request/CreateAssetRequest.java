package com.ryuqq.transferchain.core.request;

/**
 * 자산 생성 요청. 서명자가 최초 소유자가 됩니다.
 *
 * @param asset 자산 이름
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public record CreateAssetRequest(String asset) implements ActionRequest {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException asset이 null이거나 빈 문자열인 경우
     */
    public CreateAssetRequest {
        ActionRequest.requireAsset(asset);
    }

    @Override
    public TransferAction action() {
        return TransferAction.CREATE;
    }
}
