/**
 * Transfer Chain Application Layer - 트랜잭션 처리 API.
 *
 * <p>호스트 원장이 넘겨준 서명자와 페이로드를 받아 상태 전이를 계산하고,
 * 결과 write-set을 StateStore에 원자적으로 커밋합니다.</p>
 *
 * <h2>핵심 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.transferchain.application.handler.TransactionHandler} - 트랜잭션 처리기</li>
 *   <li>{@link com.ryuqq.transferchain.application.handler.TransferChainHandler} - 기본 구현</li>
 *   <li>{@link com.ryuqq.transferchain.application.handler.TransactionRequest} - 서명자 + 페이로드</li>
 *   <li>{@link com.ryuqq.transferchain.application.handler.HandlerRegistration} - 등록 메타데이터</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 상태 저장소는 core의 StateStore 포트로만 접근</li>
 *   <li><strong>원자적 커밋:</strong> write-set은 단일 set 호출로 커밋</li>
 *   <li><strong>재시도 없음:</strong> 거절은 값(Fail), 인프라 오류는 예외로 전파</li>
 * </ul>
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
package com.ryuqq.transferchain.application.handler;
