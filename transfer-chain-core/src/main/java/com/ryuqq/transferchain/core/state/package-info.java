/**
 * 상태 쓰기 묶음과 역할 등록.
 *
 * <p>{@link com.ryuqq.transferchain.core.state.WriteSet}은 한 트랜잭션이 만드는 쓰기 전체이며,
 * 빈 값은 주소 삭제를 뜻합니다.</p>
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
package com.ryuqq.transferchain.core.state;
