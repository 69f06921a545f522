/**
 * 상태 전이 엔진.
 *
 * <p>{@link com.ryuqq.transferchain.core.engine.TransitionEngine}은 요청 종류에 맞는 규칙을 골라
 * 적용하고 {@link com.ryuqq.transferchain.core.outcome.Outcome}을 반환합니다.
 * 커밋은 호출자(application 모듈)가 담당합니다.</p>
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
package com.ryuqq.transferchain.core.engine;
