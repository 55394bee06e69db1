package com.vtb.traffic.errors;

public class TransactionNotFoundException extends TrafficException {

    private final long transactionId;

    public TransactionNotFoundException(long transactionId) {
        super("Транзакция " + transactionId + " не найдена");
        this.transactionId = transactionId;
    }

    public long getTransactionId() {
        return transactionId;
    }
}
