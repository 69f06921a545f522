package com.ryuqq.transferchain.core.request;

/**
 * 디코딩된 트랜잭션 요청 (tagged variant).
 *
 * <p>action마다 필요한 필드만 가진 record 하나가 대응됩니다:</p>
 * <ul>
 *   <li>{@link CreateAssetRequest} - create</li>
 *   <li>{@link OfferTransferRequest} - transfer (newOwner 포함)</li>
 *   <li>{@link AcknowledgeTransferRequest} - acknowledge</li>
 *   <li>{@link ApproveTransferRequest} - accept</li>
 *   <li>{@link RejectTransferRequest} - reject</li>
 * </ul>
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public sealed interface ActionRequest
    permits CreateAssetRequest, OfferTransferRequest, AcknowledgeTransferRequest,
            ApproveTransferRequest, RejectTransferRequest {

    /**
     * 요청의 action 종류.
     *
     * @return action
     */
    TransferAction action();

    /**
     * 대상 자산 이름.
     *
     * @return 자산 이름
     */
    String asset();

    /**
     * 자산 이름 검증 (각 record의 compact constructor에서 사용).
     *
     * @param asset 자산 이름
     * @throws IllegalArgumentException asset이 null이거나 빈 문자열인 경우
     */
    static void requireAsset(String asset) {
        if (asset == null || asset.isBlank()) {
            throw new IllegalArgumentException("asset cannot be null or blank");
        }
    }
}
