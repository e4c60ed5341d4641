package com.storefront.identitysync.application.port.out;

import java.util.List;

import com.storefront.identitysync.domain.entity.IdentitySignal;

/**
 * Secondary (outbound) port: derived signal rows, one per (identity, type).
 */
public interface SignalStore {

    void upsert(IdentitySignal signal);

    /**
     * Moves signals of {@code fromUserId} to {@code toUserId}. Rows whose type
     * already exists on the target are deleted instead of moved.
     *
     * @return rows moved
     */
    int reassign(String fromUserId, String toUserId);

    List<IdentitySignal> findByUnifiedUserId(String unifiedUserId);
}
