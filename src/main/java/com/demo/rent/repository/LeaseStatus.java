package com.demo.rent.repository;

public enum LeaseStatus {
    ACTIVE,
    RELEASED,
    REFUNDED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
