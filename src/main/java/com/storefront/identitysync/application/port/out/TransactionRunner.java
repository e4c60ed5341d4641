package com.storefront.identitysync.application.port.out;

import java.util.function.Supplier;

/**
 * Secondary (outbound) port: runs work inside one store transaction.
 * <p>
 * Advisory locks taken by {@link IdentityStore#lockEmail} are held until the
 * surrounding transaction ends.
 * </p>
 */
public interface TransactionRunner {

    /**
     * Executes the work atomically; any exception rolls everything back.
     *
     * @param work unit of work
     * @return the work's result
     */
    <T> T inTransaction(Supplier<T> work);
}
