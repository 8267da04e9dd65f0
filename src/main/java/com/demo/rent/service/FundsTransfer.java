package com.demo.rent.service;

import java.math.BigInteger;

/** Outbound payments from escrow custody. */
public interface FundsTransfer {

    /**
     * Pays {@code amount} to {@code recipient}. Runs inside the calling ledger
     * operation; throwing aborts that operation.
     *
     * @throws com.demo.rent.service.error.TransferFailedException if the payment cannot complete
     */
    void transfer(String recipient, BigInteger amount);

    BigInteger balanceOf(String address);
}
