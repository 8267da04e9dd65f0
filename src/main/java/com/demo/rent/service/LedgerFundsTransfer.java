package com.demo.rent.service;

import com.demo.rent.repository.BalanceRepository;
import com.demo.rent.service.error.TransferFailedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/** Credits payouts to account balances held in the same database as the escrow. */
@Slf4j
@Component
@RequiredArgsConstructor
public class LedgerFundsTransfer implements FundsTransfer {

    private final BalanceRepository balanceRepository;

    @Override
    public void transfer(String recipient, BigInteger amount) {
        if (HashUtil.isZeroAddress(recipient)) {
            throw new TransferFailedException("Refusing to pay the zero address");
        }
        if (amount == null || amount.signum() < 0) {
            throw new TransferFailedException("Invalid payout amount: " + amount);
        }
        try {
            balanceRepository.credit(HashUtil.normalizeAddress(recipient), amount);
        } catch (DataAccessException e) {
            throw new TransferFailedException("Payout to " + recipient + " failed", e);
        }
        log.debug("Paid {} to {}", amount, recipient);
    }

    @Override
    public BigInteger balanceOf(String address) {
        return balanceRepository.balanceOf(HashUtil.normalizeAddress(address));
    }
}
