package com.demo.rent.support;

import com.demo.rent.service.FundsTransfer;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Payout recipient stand-in: runs a hook (a callback into the escrow, or a
 * failure) before crediting, and records every completed payout.
 */
public class ReenteringFundsTransfer implements FundsTransfer {

    public record Payout(String recipient, BigInteger amount) {}

    private final FundsTransfer delegate;
    private final List<Payout> payouts = new ArrayList<>();
    private Runnable onTransfer;
    private boolean inHook;

    public ReenteringFundsTransfer(FundsTransfer delegate) {
        this.delegate = delegate;
    }

    public void onTransfer(Runnable hook) {
        this.onTransfer = hook;
    }

    @Override
    public void transfer(String recipient, BigInteger amount) {
        if (onTransfer != null && !inHook) {
            inHook = true;
            try {
                onTransfer.run();
            } finally {
                inHook = false;
            }
        }
        delegate.transfer(recipient, amount);
        payouts.add(new Payout(recipient, amount));
    }

    @Override
    public BigInteger balanceOf(String address) {
        return delegate.balanceOf(address);
    }

    public List<Payout> payouts() {
        return payouts;
    }
}
