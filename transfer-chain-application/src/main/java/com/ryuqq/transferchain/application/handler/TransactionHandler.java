package com.ryuqq.transferchain.application.handler;

import com.ryuqq.transferchain.core.outcome.Outcome;
import com.ryuqq.transferchain.core.spi.StateStore;

/**
 * 트랜잭션 처리기.
 *
 * <p>호스트 원장이 트랜잭션마다 호출하는 진입점입니다.
 * 페이로드를 해석하고 상태 전이를 계산한 뒤, 성공 시 write-set을 한 번에 커밋합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * TransactionHandler handler = new TransferChainHandler(new NamespaceConfig());
 * Outcome outcome = handler.apply(new TransactionRequest(signer, payload), context);
 *
 * if (outcome instanceof Fail fail) {
 *     // 호스트는 트랜잭션을 무효 처리 (fail.code(), fail.message())
 * }
 * </pre>
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public interface TransactionHandler {

    /**
     * 등록 메타데이터 조회.
     *
     * @return 패밀리 이름, 버전, 콘텐츠 타입, 네임스페이스
     */
    HandlerRegistration registration();

    /**
     * 트랜잭션 하나를 처리.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>페이로드 디코딩 (실패 시 INVALID_ACTION 또는 MALFORMED_PAYLOAD)</li>
     *   <li>전이 엔진 실행 (필요한 주소만 조회)</li>
     *   <li>Ok → write-set 전체를 단일 set 호출로 커밋</li>
     *   <li>Fail → 아무것도 쓰지 않음</li>
     * </ol>
     *
     * @param request 서명자와 페이로드
     * @param state 이 트랜잭션의 상태 뷰
     * @return Ok(커밋된 write-set) 또는 Fail
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws com.ryuqq.transferchain.core.spi.StateStoreException 조회/커밋 실패 또는 쓰기 충돌 시
     */
    Outcome apply(TransactionRequest request, StateStore state);
}
