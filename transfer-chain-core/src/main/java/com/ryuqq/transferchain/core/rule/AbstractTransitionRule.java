package com.ryuqq.transferchain.core.rule;

import com.ryuqq.transferchain.core.address.AddressScheme;
import com.ryuqq.transferchain.core.codec.CanonicalCodec;
import com.ryuqq.transferchain.core.request.ActionRequest;
import com.ryuqq.transferchain.core.spi.StateStore;

import java.util.List;
import java.util.Map;

/**
 * 규칙 공통 기반 클래스.
 *
 * <p>주소 체계, 코덱, 그리고 "빈 값 = 부재" 판정을 제공합니다.</p>
 *
 * @param <R> 처리하는 요청 타입
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
abstract class AbstractTransitionRule<R extends ActionRequest> implements TransitionRule<R> {

    protected final AddressScheme addresses;
    protected final CanonicalCodec codec;

    protected AbstractTransitionRule(AddressScheme addresses, CanonicalCodec codec) {
        if (addresses == null) {
            throw new IllegalArgumentException("addresses cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        this.addresses = addresses;
        this.codec = codec;
    }

    /**
     * 주소 목록을 한 번의 get으로 조회.
     *
     * @param state StateStore
     * @param toRead 읽을 주소
     * @return 주소 → 값 (부재 시 빈 배열 또는 null)
     */
    protected Map<String, byte[]> read(StateStore state, String... toRead) {
        return state.get(List.of(toRead));
    }

    /**
     * 값이 존재하는지 확인.
     *
     * @param value 조회된 값 (null 가능)
     * @return null이 아니고 비어있지 않으면 true
     */
    protected static boolean isPresent(byte[] value) {
        return value != null && value.length > 0;
    }
}
