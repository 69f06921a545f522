/**
 * 원장에 저장되는 레코드.
 *
 * <ul>
 *   <li>{@link com.ryuqq.transferchain.core.model.Asset} - 자산과 현재 소유자</li>
 *   <li>{@link com.ryuqq.transferchain.core.model.TransferOffer} - 구매자 확인을 기다리는 이전 제안</li>
 *   <li>{@link com.ryuqq.transferchain.core.model.TransferApproval} - 규제자 결정을 기다리는 이전</li>
 *   <li>{@link com.ryuqq.transferchain.core.model.RoleRecord} - 규제자/참여자 등록 (존재 여부만 의미 있음)</li>
 * </ul>
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
package com.ryuqq.transferchain.core.model;
