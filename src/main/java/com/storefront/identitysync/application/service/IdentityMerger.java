package com.storefront.identitysync.application.service;

import java.time.Instant;
import java.util.logging.Logger;

import com.storefront.identitysync.application.port.out.EventStore;
import com.storefront.identitysync.application.port.out.IdentityLinkStore;
import com.storefront.identitysync.application.port.out.IdentityStore;
import com.storefront.identitysync.application.port.out.SignalStore;
import com.storefront.identitysync.application.port.out.SyncJobStore;
import com.storefront.identitysync.domain.entity.ComputedTraits;
import com.storefront.identitysync.domain.entity.UnifiedIdentity;
import com.storefront.identitysync.domain.valueobject.SyncFlags;

/**
 * Stitches one unified identity into another.
 * <p>
 * Must run inside the caller's transaction: either every child row moves and
 * the loser disappears, or nothing changes.
 * </p>
 *
 * <p>
 * Order of operations:
 * </p>
 * <ol>
 * <li>Move signals (colliding signal types on the loser are dropped)</li>
 * <li>Move events, identity links and sync jobs</li>
 * <li>Delete the loser</li>
 * <li>Persist the unioned identifiers and combined computed state on the keeper</li>
 * </ol>
 */
public class IdentityMerger {

    private static final Logger log = Logger.getLogger(IdentityMerger.class.getName());

    private final IdentityStore identityStore;
    private final IdentityLinkStore identityLinkStore;
    private final EventStore eventStore;
    private final SyncJobStore syncJobStore;
    private final SignalStore signalStore;

    public IdentityMerger(IdentityStore identityStore,
            IdentityLinkStore identityLinkStore,
            EventStore eventStore,
            SyncJobStore syncJobStore,
            SignalStore signalStore) {
        if (identityStore == null)
            throw new IllegalArgumentException("identityStore cannot be null");
        if (identityLinkStore == null)
            throw new IllegalArgumentException("identityLinkStore cannot be null");
        if (eventStore == null)
            throw new IllegalArgumentException("eventStore cannot be null");
        if (syncJobStore == null)
            throw new IllegalArgumentException("syncJobStore cannot be null");
        if (signalStore == null)
            throw new IllegalArgumentException("signalStore cannot be null");

        this.identityStore = identityStore;
        this.identityLinkStore = identityLinkStore;
        this.eventStore = eventStore;
        this.syncJobStore = syncJobStore;
        this.signalStore = signalStore;
    }

    /**
     * Merges {@code loser} into {@code keep}.
     *
     * @return the surviving identity as persisted, and how many events moved
     * @throws IllegalStateException if both arguments are the same record
     */
    public MergeOutcome merge(UnifiedIdentity keep, UnifiedIdentity loser, Instant now) {
        UnifiedIdentity merged = keep.absorb(loser, now);

        int signalsMoved = signalStore.reassign(loser.getId(), keep.getId());
        int eventsMoved = eventStore.reassign(loser.getId(), keep.getId());
        int linksMoved = identityLinkStore.reassign(loser.getId(), keep.getId());
        int jobsMoved = syncJobStore.reassign(loser.getId(), keep.getId());

        identityStore.delete(loser.getId());
        identityStore.mergeIdentifiers(merged);

        ComputedTraits combined = combine(keep.getComputed(), loser.getComputed());
        if (identityStore.updateComputed(keep.getId(), keep.getVersion(), combined, now)) {
            merged = merged.withComputed(combined, now);
        } else {
            log.warning(String.format(
                    "action=merge_computed_conflict keepId=%s loserId=%s reason=version_changed",
                    keep.getId(), loser.getId()));
        }

        log.info(String.format(
                "action=identity_merged workspaceId=%s keepId=%s loserId=%s events=%d links=%d jobs=%d signals=%d",
                keep.getWorkspaceId(), keep.getId(), loser.getId(),
                eventsMoved, linksMoved, jobsMoved, signalsMoved));

        return new MergeOutcome(merged, eventsMoved);
    }

    /**
     * Combines two computed bags. Lifetime counters add up, intent keeps the
     * stronger signal, activity timestamps keep the latest, and funnel
     * timestamps keep whichever side recorded them.
     */
    static ComputedTraits combine(ComputedTraits keep, ComputedTraits loser) {
        SyncFlags flags = keep.getFlags();
        for (var entry : loser.getFlags().asMap().entrySet()) {
            if (!flags.isSet(entry.getKey())) {
                flags = flags.with(entry.getKey(), entry.getValue());
            }
        }
        return keep.toBuilder()
                .intentScore(Math.max(keep.getIntentScore(), loser.getIntentScore()))
                .ordersCount(keep.getOrdersCount() + loser.getOrdersCount())
                .lifetimeValue(keep.getLifetimeValue() + loser.getLifetimeValue())
                .sessionCount30d(keep.getSessionCount30d() + loser.getSessionCount30d())
                .atcCount7d(keep.getAtcCount7d() + loser.getAtcCount7d())
                .productsViewedCount(keep.getProductsViewedCount() + loser.getProductsViewedCount())
                .emailOpens30d(keep.getEmailOpens30d() + loser.getEmailOpens30d())
                .emailClicks30d(keep.getEmailClicks30d() + loser.getEmailClicks30d())
                .dropOffStage(keep.getDropOffStage() != null ? keep.getDropOffStage() : loser.getDropOffStage())
                .lastActionAt(latest(keep.getLastActionAt(), loser.getLastActionAt()))
                .lastAction(isLater(loser.getLastActionAt(), keep.getLastActionAt())
                        ? loser.getLastAction()
                        : keep.getLastAction())
                .lastSessionAt(latest(keep.getLastSessionAt(), loser.getLastSessionAt()))
                .lastProductViewedAt(latest(keep.getLastProductViewedAt(), loser.getLastProductViewedAt()))
                .lastCartAt(latest(keep.getLastCartAt(), loser.getLastCartAt()))
                .checkoutStartedAt(latest(keep.getCheckoutStartedAt(), loser.getCheckoutStartedAt()))
                .orderCompletedAt(latest(keep.getOrderCompletedAt(), loser.getOrderCompletedAt()))
                .cartAbandonedAt(keep.getCartAbandonedAt() != null
                        ? keep.getCartAbandonedAt()
                        : loser.getCartAbandonedAt())
                .checkoutAbandonedAt(keep.getCheckoutAbandonedAt() != null
                        ? keep.getCheckoutAbandonedAt()
                        : loser.getCheckoutAbandonedAt())
                .topCategory30d(keep.getTopCategory30d() != null
                        ? keep.getTopCategory30d()
                        : loser.getTopCategory30d())
                .flags(flags)
                .build();
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isAfter(b) ? a : b;
    }

    private static boolean isLater(Instant candidate, Instant reference) {
        return candidate != null && (reference == null || candidate.isAfter(reference));
    }

    public record MergeOutcome(UnifiedIdentity merged, int eventsMoved) {
    }
}
