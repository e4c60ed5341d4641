package com.storefront.identitysync.application.port.out;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.storefront.identitysync.domain.entity.ComputedTraits;
import com.storefront.identitysync.domain.entity.UnifiedIdentity;

/**
 * Secondary (outbound) port: unified identity persistence.
 * <p>
 * Writers of the {@code computed} bag use optimistic versioning: every write
 * to it (including flag writes) bumps {@code version}, and
 * {@link #updateComputed} only succeeds against the version it read.
 * </p>
 */
public interface IdentityStore {

    /**
     * Takes the per-(workspace, email) critical section for the current
     * transaction. Must be called inside {@link TransactionRunner#inTransaction}.
     */
    void lockEmail(String workspaceId, String email);

    Optional<UnifiedIdentity> findById(String id);

    Optional<UnifiedIdentity> findByAnonymousId(String workspaceId, String anonymousId);

    /**
     * Matches the primary email or any email in the set.
     */
    Optional<UnifiedIdentity> findByEmail(String workspaceId, String email);

    Optional<UnifiedIdentity> findByCustomerId(String workspaceId, String customerId);

    void insert(UnifiedIdentity identity);

    /**
     * Folds identifier sets, traits and seen/updated timestamps into the stored
     * row. Sets are unioned with what is stored, traits are merged key by key,
     * and primary email and phone are only filled when empty, so a stale
     * snapshot never removes an identifier written by another caller. Leaves
     * {@code computed} and {@code version} untouched.
     */
    void mergeIdentifiers(UnifiedIdentity identity);

    void delete(String id);

    /**
     * Compare-and-set write of the computed bag.
     *
     * @return false if the stored version no longer matches
     */
    boolean updateComputed(String id, long expectedVersion, ComputedTraits computed, Instant now);

    void setSyncFlag(String id, String flag, Instant at);

    void clearSyncFlags(String id, Collection<String> flags);

    /**
     * Stores the profile properties last delivered to the destination.
     */
    void recordSyncSnapshot(String id, Map<String, Object> snapshot, Instant at);

    /** Identities seen since {@code seenSince} whose computed state predates {@code computedBefore}. */
    List<String> findStaleActive(Instant seenSince, Instant computedBefore, int limit);

    /** Identities not seen since {@code lastSeenBefore}, not yet decayed today. */
    List<String> findInactiveSince(Instant lastSeenBefore, Instant decayedBefore, int limit);

    List<String> findCartAbandonmentCandidates(Instant cartIdleBefore, Instant lookbackStart, int limit);

    List<String> findCheckoutAbandonmentCandidates(Instant checkoutIdleBefore, Instant lookbackStart, int limit);

    List<String> findEmailIdentitiesUpdatedSince(Instant since, int limit);

    long countAll();

    long countWithEmail();
}
