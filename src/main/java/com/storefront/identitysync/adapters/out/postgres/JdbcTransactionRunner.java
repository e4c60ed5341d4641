package com.storefront.identitysync.adapters.out.postgres;

import java.util.function.Supplier;

import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import com.storefront.identitysync.application.port.out.TransactionRunner;

/**
 * TransactionRunner backed by Spring's {@link TransactionTemplate}.
 */
@Component
public class JdbcTransactionRunner implements TransactionRunner {

    private final TransactionTemplate transactionTemplate;

    public JdbcTransactionRunner(TransactionTemplate transactionTemplate) {
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        return transactionTemplate.execute(status -> work.get());
    }
}
