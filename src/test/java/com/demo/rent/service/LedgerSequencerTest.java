package com.demo.rent.service;

import com.demo.rent.service.error.TransferFailedException;
import com.demo.rent.support.LedgerFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LedgerSequencerTest {

    private static final String A = "0x000000000000000000000000000000000000000a";
    private static final String B = "0x000000000000000000000000000000000000000b";

    private LedgerFixture fx;
    private LedgerSequencer ledger;

    @BeforeEach
    void setUp() {
        fx = new LedgerFixture();
        ledger = fx.ledger;
    }

    @AfterEach
    void tearDown() {
        fx.close();
    }

    @Test
    void signalsArePublishedOnlyAfterTheOutermostCommit() {
        ledger.run("outer", () -> {
            ledger.emit("outer-1");
            ledger.run("inner", () -> ledger.emit("inner-1"));
            assertThat(fx.events).isEmpty();
            ledger.emit("outer-2");
        });

        assertThat(fx.events).containsExactly("outer-1", "inner-1", "outer-2");
    }

    @Test
    void failedNestedOperationUndoesOnlyItsOwnWrites() {
        ledger.run("outer", () -> {
            fx.balances.credit(A, BigInteger.ONE);
            assertThatThrownBy(() -> ledger.run("inner", () -> {
                fx.balances.credit(B, BigInteger.TEN);
                ledger.emit("inner");
                throw new TransferFailedException("recipient rejected");
            })).isInstanceOf(TransferFailedException.class);
            ledger.emit("outer");
        });

        assertThat(fx.balances.balanceOf(A)).isEqualTo(BigInteger.ONE);
        assertThat(fx.balances.balanceOf(B)).isZero();
        assertThat(fx.events).containsExactly("outer");
    }

    @Test
    void failedOperationPersistsAndPublishesNothing() {
        assertThatThrownBy(() -> ledger.run("op", () -> {
            fx.balances.credit(A, BigInteger.ONE);
            ledger.emit("lost");
            throw new TransferFailedException("boom");
        })).isInstanceOf(TransferFailedException.class);

        assertThat(fx.balances.balanceOf(A)).isZero();
        assertThat(fx.events).isEmpty();
    }

    @Test
    void emitOutsideAnOperationFails() {
        assertThatThrownBy(() -> ledger.emit("stray")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void nowReadsTheInjectedClock() {
        assertThat(ledger.now()).isEqualTo(LedgerFixture.T0);
        fx.clock.advance(5);
        assertThat(ledger.now()).isEqualTo(LedgerFixture.T0 + 5);
    }
}
