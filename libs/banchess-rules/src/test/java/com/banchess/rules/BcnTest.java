package com.banchess.rules;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BcnTest {

    @Test
    void encode_usesPhasePrefix() {
        assertEquals("b:e2e4", Action.ban("e2", "e4").toBcn());
        assertEquals("m:e7e8q", Action.move("e7", "e8", "q").toBcn());
    }

    @Test
    void decode_readsPromotion() {
        Action a = Bcn.decode("m:e7e8n");
        assertTrue(a instanceof MoveAction);
        assertEquals(PieceType.KNIGHT, ((MoveAction) a).promotion());
        assertEquals(Square.parse("e7"), a.from());
    }

    @Test
    void decode_rejectsMalformedTokens() {
        assertThrows(IllegalArgumentException.class, () -> Bcn.decode("b:e7e8q"));
        assertThrows(IllegalArgumentException.class, () -> Bcn.decode("x:e2e4"));
        assertThrows(IllegalArgumentException.class, () -> Bcn.decode("m:e2"));
        assertThrows(IllegalArgumentException.class, () -> Bcn.decode("m:i2e4"));
        assertThrows(IllegalArgumentException.class, () -> Bcn.decode(null));
    }
}
