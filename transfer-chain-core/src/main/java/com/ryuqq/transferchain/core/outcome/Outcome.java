package com.ryuqq.transferchain.core.outcome;

/**
 * 상태 전이 결과.
 *
 * <p>Outcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 유효한 요청, 커밋할 write-set 포함</li>
 *   <li>{@link Fail}: 거절된 요청, 쓰기 없음</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.
 * 재시도 케이스는 없습니다. 재시도 정책은 호스트 런타임의 몫입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Outcome outcome = engine.apply(signer, request, state);
 * if (outcome instanceof Ok ok) {
 *     state.set(ok.writeSet().entries());
 * } else if (outcome instanceof Fail fail) {
 *     log.info("Rejected: {} {}", fail.code(), fail.message());
 * }
 * </pre>
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Ok, Fail {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 거절인지 확인.
     *
     * @return 거절 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
