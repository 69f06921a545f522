package com.ryuqq.transferchain.core.rule;

import com.ryuqq.transferchain.core.outcome.Outcome;
import com.ryuqq.transferchain.core.request.ActionRequest;
import com.ryuqq.transferchain.core.spi.StateStore;

/**
 * 단일 action에 대한 상태 전이 규칙.
 *
 * <p>규칙은 필요한 주소만 읽고, 검증 후 전체 write-set을 계산합니다.
 * 쓰기는 하지 않습니다. 커밋은 호출자의 책임입니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>같은 상태와 같은 요청에 대해 항상 같은 Outcome (결정성)</li>
 *   <li>{@code StateStore.get}만 호출, {@code set}은 호출하지 않음</li>
 *   <li>StateStoreException은 잡지 않고 그대로 전파</li>
 * </ul>
 *
 * @param <R> 처리하는 요청 타입
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public interface TransitionRule<R extends ActionRequest> {

    /**
     * 규칙 적용.
     *
     * @param request 디코딩된 요청
     * @param signer 인증된 서명자 ID
     * @param state 상태 조회용 StateStore
     * @return Ok(write-set) 또는 Fail
     * @throws com.ryuqq.transferchain.core.codec.CodecException 저장된 레코드를 디코딩할 수 없는 경우
     * @throws com.ryuqq.transferchain.core.spi.StateStoreException 상태 조회 실패 시
     */
    Outcome apply(R request, String signer, StateStore state);
}
