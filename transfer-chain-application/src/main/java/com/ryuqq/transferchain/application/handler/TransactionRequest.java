package com.ryuqq.transferchain.application.handler;

import java.util.Arrays;

/**
 * 처리할 트랜잭션 입력.
 *
 * <p>서명 검증은 호스트가 이미 마쳤다고 가정합니다.
 * signer는 인증된 공개키(hex) 등 서명자 ID입니다.</p>
 *
 * @param signer 인증된 서명자 ID
 * @param payload JSON 페이로드 바이트 {@code {action, asset, owner?}}
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public record TransactionRequest(
    String signer,
    byte[] payload
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException signer가 비어있거나 payload가 null인 경우
     */
    public TransactionRequest {
        if (signer == null || signer.isBlank()) {
            throw new IllegalArgumentException("signer cannot be null or blank");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        payload = payload.clone();
    }

    /**
     * 페이로드 복사본 조회.
     *
     * @return 페이로드 바이트 복사본
     */
    @Override
    public byte[] payload() {
        return payload.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TransactionRequest other)) {
            return false;
        }
        return signer.equals(other.signer) && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * signer.hashCode() + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "TransactionRequest[signer=" + signer + ", payload=" + payload.length + " bytes]";
    }
}
