package com.demo.rent.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.math.BigInteger;

/** Account balances credited by escrow payouts. */
@Repository
@RequiredArgsConstructor
public class BalanceRepository {

    private final JdbcTemplate jdbc;

    public void credit(String address, BigInteger amount) {
        int n = jdbc.update("UPDATE account_balances SET balance = balance + ? WHERE address = ?",
                new BigDecimal(amount), address);
        if (n == 0) {
            jdbc.update("INSERT INTO account_balances (address, balance) VALUES (?, ?)",
                    address, new BigDecimal(amount));
        }
    }

    public BigInteger balanceOf(String address) {
        return jdbc.query("SELECT balance FROM account_balances WHERE address = ?",
                        (rs, i) -> rs.getBigDecimal("balance").toBigIntegerExact(), address)
                .stream().findFirst().orElse(BigInteger.ZERO);
    }
}
