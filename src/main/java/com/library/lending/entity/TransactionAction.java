package com.library.lending.entity;

public enum TransactionAction {
    BORROW,
    RETURN
}
