package com.txscope.core;

public enum TransactionEvent {
    START_TRANSACTION
}
