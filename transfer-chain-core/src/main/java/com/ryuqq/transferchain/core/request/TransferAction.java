package com.ryuqq.transferchain.core.request;

import java.util.Optional;

/**
 * 트랜잭션 action 종류와 페이로드 상의 이름.
 *
 * <p>wire 이름은 기존 클라이언트와의 호환을 위해 고정입니다.</p>
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public enum TransferAction {

    /** 자산 생성. */
    CREATE("create"),

    /** 양도 제안. */
    TRANSFER("transfer"),

    /** 지정 구매자의 확인. */
    ACKNOWLEDGE("acknowledge"),

    /** 규제자 승인. */
    ACCEPT("accept"),

    /** 예정 소유자의 거절. */
    REJECT("reject");

    private final String wireName;

    TransferAction(String wireName) {
        this.wireName = wireName;
    }

    /**
     * 페이로드에 쓰이는 action 이름.
     *
     * @return wire 이름 (예: "create")
     */
    public String wireName() {
        return wireName;
    }

    /**
     * wire 이름으로 action 조회.
     *
     * @param wireName 페이로드의 action 값
     * @return 일치하는 action, 없으면 empty
     */
    public static Optional<TransferAction> fromWireName(String wireName) {
        for (TransferAction action : values()) {
            if (action.wireName.equals(wireName)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
