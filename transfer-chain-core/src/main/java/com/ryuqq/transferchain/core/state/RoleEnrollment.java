package com.ryuqq.transferchain.core.state;

import com.ryuqq.transferchain.core.address.AddressScheme;
import com.ryuqq.transferchain.core.address.EntityKind;
import com.ryuqq.transferchain.core.codec.CanonicalCodec;
import com.ryuqq.transferchain.core.model.RoleRecord;

/**
 * 역할(규제자, 참여자) 등록 write-set 생성기.
 *
 * <p>역할 등록은 트랜잭션 action이 아니라 원장 외부 절차입니다.
 * 호스트(또는 테스트)가 초기 상태를 구성할 때 이 write-set을 StateStore에 직접 커밋합니다.</p>
 *
 * <pre>
 * store.set(enrollment.enroll(EntityKind.REGULATOR, "regulator1").entries());
 * </pre>
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public final class RoleEnrollment {

    private final AddressScheme addressScheme;
    private final CanonicalCodec codec;

    /**
     * 생성자.
     *
     * @param addressScheme 주소 체계
     * @param codec 레코드 코덱
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RoleEnrollment(AddressScheme addressScheme, CanonicalCodec codec) {
        if (addressScheme == null) {
            throw new IllegalArgumentException("addressScheme cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        this.addressScheme = addressScheme;
        this.codec = codec;
    }

    /**
     * 역할 등록 write-set 생성.
     *
     * @param role REGULATOR 또는 PARTICIPANT
     * @param identity 서명자 ID
     * @return 역할 기록 하나를 쓰는 WriteSet
     * @throws IllegalArgumentException role이 역할 종류가 아니거나 identity가 비어있는 경우
     */
    public WriteSet enroll(EntityKind role, String identity) {
        return WriteSet.builder()
            .put(roleAddress(role, identity), codec.encode(new RoleRecord(identity)))
            .build();
    }

    /**
     * 역할 해제 write-set 생성.
     *
     * @param role REGULATOR 또는 PARTICIPANT
     * @param identity 서명자 ID
     * @return 역할 기록을 삭제하는 WriteSet
     * @throws IllegalArgumentException role이 역할 종류가 아니거나 identity가 비어있는 경우
     */
    public WriteSet revoke(EntityKind role, String identity) {
        return WriteSet.builder()
            .clear(roleAddress(role, identity))
            .build();
    }

    private String roleAddress(EntityKind role, String identity) {
        if (role != EntityKind.REGULATOR && role != EntityKind.PARTICIPANT) {
            throw new IllegalArgumentException("role must be REGULATOR or PARTICIPANT, but was: " + role);
        }
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("identity cannot be null or blank");
        }
        return addressScheme.address(role, identity);
    }
}
