package com.ryuqq.transferchain.core.codec;

/**
 * 상태 레코드 인코딩/디코딩 실패.
 *
 * <p>빈 바이트열, 손상된 JSON, 필수 필드 누락 시 발생합니다.
 * 전이 엔진은 이 예외를 {@code DECODE_FAILURE} 거절로 변환합니다.</p>
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public class CodecException extends RuntimeException {

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     */
    public CodecException(String message) {
        super(message);
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param message 오류 메시지
     * @param cause 원인
     */
    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
