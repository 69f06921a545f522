package com.ryuqq.transferchain.core.outcome;

/**
 * 거절된 요청.
 *
 * <p>검증 규칙 위반으로 상태를 변경하지 않는 결과입니다.
 * 같은 상태에서 같은 요청을 재시도해도 같은 결과가 나오므로 재시도하지 않습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>ASSET_ALREADY_EXISTS - "Asset name in use"</li>
 *   <li>NOT_OWNER - "Only an Asset's owner may transfer it"</li>
 *   <li>NOT_REGULATOR - "You are not a regulator"</li>
 * </ul>
 *
 * @param code 거절 사유 코드
 * @param message 사람이 읽을 수 있는 메시지
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public record Fail(
    RejectionCode code,
    String message
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException code가 null이거나 message가 비어있는 경우
     */
    public Fail {
        if (code == null) {
            throw new IllegalArgumentException("code cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * Fail 생성.
     *
     * @param code 거절 사유 코드
     * @param message 오류 메시지
     * @return Fail 인스턴스
     * @throws IllegalArgumentException code가 null이거나 message가 비어있는 경우
     */
    public static Fail of(RejectionCode code, String message) {
        return new Fail(code, message);
    }
}
