package com.ryuqq.transferchain.core.request;

import com.ryuqq.transferchain.core.outcome.Fail;
import com.ryuqq.transferchain.core.outcome.RejectionCode;

/**
 * 페이로드를 {@link ActionRequest}로 디코딩할 수 없음.
 *
 * <p>code는 {@link RejectionCode#INVALID_ACTION} 또는 {@link RejectionCode#MALFORMED_PAYLOAD}입니다.</p>
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public class InvalidRequestException extends RuntimeException {

    private final RejectionCode code;

    /**
     * 생성자.
     *
     * @param code 거절 사유
     * @param message 오류 메시지
     */
    public InvalidRequestException(RejectionCode code, String message) {
        super(message);
        this.code = code;
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param code 거절 사유
     * @param message 오류 메시지
     * @param cause 원인
     */
    public InvalidRequestException(RejectionCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * 거절 사유 조회.
     *
     * @return 거절 사유
     */
    public RejectionCode code() {
        return code;
    }

    /**
     * 거절 결과로 변환.
     *
     * @return Fail
     */
    public Fail toFail() {
        return Fail.of(code, getMessage());
    }
}
