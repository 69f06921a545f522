package com.ryuqq.transferchain.core.outcome;

import com.ryuqq.transferchain.core.state.WriteSet;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outcome (Ok, Fail) 테스트.
 *
 * @author Transfer Chain Team
 * @since 1.0.0
 */
class OutcomeTest {

    private static final WriteSet WRITE_SET = WriteSet.builder().put("a1", new byte[]{1}).build();

    @Test
    void ok_IsOkNotFail() {
        // When
        Outcome outcome = Ok.of(WRITE_SET);

        // Then
        assertTrue(outcome.isOk());
        assertFalse(outcome.isFail());
        assertEquals(WRITE_SET, ((Ok) outcome).writeSet());
    }

    @Test
    void fail_IsFailNotOk() {
        // When
        Outcome outcome = Fail.of(RejectionCode.NOT_OWNER, "Only an Asset's owner may transfer it");

        // Then
        assertTrue(outcome.isFail());
        assertFalse(outcome.isOk());
        assertEquals(RejectionCode.NOT_OWNER, ((Fail) outcome).code());
    }

    @Test
    void ok_EmptyWriteSet_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Ok.of(WriteSet.builder().build())
        );
        assertTrue(exception.getMessage().contains("empty"));
        assertThrows(IllegalArgumentException.class, () -> Ok.of(null));
    }

    @Test
    void fail_MissingCodeOrMessage_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Fail.of(null, "message"));
        assertThrows(IllegalArgumentException.class, () -> Fail.of(RejectionCode.NOT_OWNER, "   "));
    }

    @Test
    void fail_SameValues_AreEqual() {
        assertEquals(
            Fail.of(RejectionCode.NOT_REGULATOR, "You are not a regulator"),
            Fail.of(RejectionCode.NOT_REGULATOR, "You are not a regulator")
        );
    }
}
