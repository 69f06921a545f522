package com.ryuqq.transferchain.core.outcome;

/**
 * 요청 거절 사유.
 *
 * <p>모든 검증 실패는 하나의 "거절된 요청" 분류에 속하며 코어 내부에서 재시도되지 않습니다.</p>
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public enum RejectionCode {

    /** 같은 이름의 자산이 이미 존재. */
    ASSET_ALREADY_EXISTS,

    /** 자산이 존재하지 않음. */
    ASSET_NOT_FOUND,

    /** 서명자가 자산 소유자가 아님. */
    NOT_OWNER,

    /** 확인 대기 중인 양도 제안이 없음. */
    NO_PENDING_TRANSFER,

    /** 서명자가 지정 구매자가 아님. */
    NOT_DESIGNATED_BUYER,

    /** 승인 대기 중인 양도가 없음. */
    NO_PENDING_APPROVAL,

    /** 서명자가 등록된 규제자가 아님. */
    NOT_REGULATOR,

    /** 알 수 없는 action. */
    INVALID_ACTION,

    /** 페이로드 형식 오류 또는 필수 필드 누락. */
    MALFORMED_PAYLOAD,

    /** 저장된 레코드 디코딩 실패. */
    DECODE_FAILURE
}
