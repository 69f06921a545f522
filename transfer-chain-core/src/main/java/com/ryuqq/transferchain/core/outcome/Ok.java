package com.ryuqq.transferchain.core.outcome;

import com.ryuqq.transferchain.core.state.WriteSet;

/**
 * 성공 결과.
 *
 * <p>요청이 유효하며, 원자적으로 커밋해야 할 write-set을 담고 있습니다.</p>
 *
 * @param writeSet 커밋할 쓰기 집합
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
public record Ok(
    WriteSet writeSet
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException writeSet이 null이거나 비어있는 경우
     */
    public Ok {
        if (writeSet == null) {
            throw new IllegalArgumentException("writeSet cannot be null");
        }
        if (writeSet.isEmpty()) {
            throw new IllegalArgumentException("writeSet cannot be empty");
        }
    }

    /**
     * Ok 생성.
     *
     * @param writeSet 커밋할 쓰기 집합
     * @return Ok 인스턴스
     */
    public static Ok of(WriteSet writeSet) {
        return new Ok(writeSet);
    }
}
