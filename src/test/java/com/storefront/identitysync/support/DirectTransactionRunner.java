package com.storefront.identitysync.support;

import java.util.function.Supplier;

import com.storefront.identitysync.application.port.out.TransactionRunner;

public class DirectTransactionRunner implements TransactionRunner {

    private int transactions;

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        transactions++;
        return work.get();
    }

    public int getTransactions() {
        return transactions;
    }
}
