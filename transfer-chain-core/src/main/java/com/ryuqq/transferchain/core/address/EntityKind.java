package com.ryuqq.transferchain.core.address;

/**
 * 주소 공간 내 엔티티 종류와 2자리 hex 태그.
 *
 * <p><strong>태그 배치:</strong></p>
 * <pre>
 * 00  ASSET             자산 소유 기록
 * 10  TRANSFER          예약됨 (현재 어떤 규칙도 쓰지 않음)
 * 11  TRANSFER_ACKN     구매자 확인 대기 중인 양도 제안
 * 12  TRANSFER_APPROVE  규제자 승인 대기 중인 양도
 * 20  REGULATOR         규제자 역할 (존재 여부만 의미)
 * 21  PARTICIPANT       참여자 역할 (존재 여부만 의미)
 * </pre>
 *
 * <p>태그 값은 원장에 이미 기록된 주소와 호환되어야 하므로 변경 불가입니다.</p>
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public enum EntityKind {

    /**
     * 자산.
     */
    ASSET("00"),

    /**
     * 예약된 양도 슬롯.
     */
    TRANSFER("10"),

    /**
     * 구매자 확인 슬롯.
     */
    TRANSFER_ACKN("11"),

    /**
     * 규제자 승인 슬롯.
     */
    TRANSFER_APPROVE("12"),

    /**
     * 규제자.
     */
    REGULATOR("20"),

    /**
     * 참여자.
     */
    PARTICIPANT("21");

    private final String code;

    EntityKind(String code) {
        this.code = code;
    }

    /**
     * 2자리 hex 태그 조회.
     *
     * @return 태그 (예: "00")
     */
    public String code() {
        return code;
    }
}
