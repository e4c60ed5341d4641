package com.storefront.identitysync.application.service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.logging.Logger;

import com.storefront.identitysync.application.port.out.IdentityLinkStore;
import com.storefront.identitysync.application.port.out.IdentityStore;
import com.storefront.identitysync.application.port.out.TransactionRunner;
import com.storefront.identitysync.domain.entity.IdentityLink;
import com.storefront.identitysync.domain.entity.UnifiedIdentity;
import com.storefront.identitysync.domain.valueobject.IdentityEvidence;
import com.storefront.identitysync.domain.valueobject.IdentityType;

/**
 * Maps observed identifiers onto exactly one unified identity.
 * <p>
 * Runs in a single transaction. When an email is present the
 * (workspace, email) critical section is taken first, so two concurrent calls
 * for the same new email serialize and the second one finds the first's row.
 * </p>
 *
 * <p>
 * <b>Resolution priority:</b> email match → customer-id match → anonymous-id
 * match. When the anonymous-id match is a different record than the winning
 * match it is stitched into the winner, provided the winner was found by email
 * or the anonymous record carries no other identity.
 * </p>
 *
 * <p>
 * <b>Conflicts:</b> an email match and a customer-id match that point at two
 * different records are never merged. The email record wins and the customer
 * id is not attached to it ({@code action=identity_conflict}).
 * </p>
 */
public class IdentityResolver {

    private static final Logger log = Logger.getLogger(IdentityResolver.class.getName());

    private final IdentityStore identityStore;
    private final IdentityLinkStore identityLinkStore;
    private final IdentityMerger identityMerger;
    private final TransactionRunner transactionRunner;
    private final Clock clock;

    public IdentityResolver(IdentityStore identityStore,
            IdentityLinkStore identityLinkStore,
            IdentityMerger identityMerger,
            TransactionRunner transactionRunner,
            Clock clock) {
        if (identityStore == null)
            throw new IllegalArgumentException("identityStore cannot be null");
        if (identityLinkStore == null)
            throw new IllegalArgumentException("identityLinkStore cannot be null");
        if (identityMerger == null)
            throw new IllegalArgumentException("identityMerger cannot be null");
        if (transactionRunner == null)
            throw new IllegalArgumentException("transactionRunner cannot be null");
        if (clock == null)
            throw new IllegalArgumentException("clock cannot be null");

        this.identityStore = identityStore;
        this.identityLinkStore = identityLinkStore;
        this.identityMerger = identityMerger;
        this.transactionRunner = transactionRunner;
        this.clock = clock;
    }

    /**
     * Finds or creates the owning identity, merging when the evidence proves
     * two records are the same person.
     *
     * @param workspaceId tenant scope
     * @param evidence    identifiers observed together
     * @return the resolution outcome
     * @throws IllegalArgumentException if the evidence carries no identifier
     */
    public Resolution resolve(String workspaceId, IdentityEvidence evidence) {
        if (workspaceId == null || workspaceId.isBlank()) {
            throw new IllegalArgumentException("workspaceId cannot be null or blank");
        }
        if (evidence == null || !evidence.hasAnyIdentifier()) {
            throw new IllegalArgumentException("at least one identifier is required");
        }
        return transactionRunner.inTransaction(() -> resolveInTransaction(workspaceId, evidence));
    }

    // ─────────────────── Private Steps ───────────────────

    private Resolution resolveInTransaction(String workspaceId, IdentityEvidence evidence) {
        Instant now = clock.instant();

        // ── Step 1: critical section per email ──
        if (evidence.hasEmail()) {
            identityStore.lockEmail(workspaceId, evidence.getEmail());
        }

        // ── Step 2: candidate lookup ──
        UnifiedIdentity anonMatch = lookup(evidence.hasAnonymousId(),
                () -> identityStore.findByAnonymousId(workspaceId, evidence.getAnonymousId()));
        UnifiedIdentity emailMatch = lookup(evidence.hasEmail(),
                () -> identityStore.findByEmail(workspaceId, evidence.getEmail()));
        UnifiedIdentity customerMatch = lookup(evidence.hasCustomerId(),
                () -> identityStore.findByCustomerId(workspaceId, evidence.getCustomerId()));

        IdentityEvidence effective = evidence;

        if (emailMatch != null && customerMatch != null
                && !sameRecord(emailMatch, customerMatch)
                && !sameRecord(anonMatch, customerMatch)) {
            log.warning(String.format(
                    "action=identity_conflict workspaceId=%s emailOwner=%s customerOwner=%s customerId=%s resolution=keep_email",
                    workspaceId, emailMatch.getId(), customerMatch.getId(), evidence.getCustomerId()));
            customerMatch = null;
            effective = effective.withoutCustomerId();
        }

        // ── Step 3: priority ──
        UnifiedIdentity keep = emailMatch != null ? emailMatch
                : customerMatch != null ? customerMatch
                        : anonMatch;

        if (keep == null) {
            return createIdentity(workspaceId, effective, now);
        }

        boolean hadEmail = keep.hasEmail();
        boolean knewEmail = effective.hasEmail() && keep.getEmails().contains(effective.getEmail());
        boolean merged = false;
        String mergedFromId = null;
        int eventsMoved = 0;

        // ── Step 4: stitching ──
        if (anonMatch != null && !sameRecord(anonMatch, keep)) {
            if (keep == emailMatch || anonMatch.isAnonymous()) {
                IdentityMerger.MergeOutcome outcome = identityMerger.merge(keep, anonMatch, now);
                keep = outcome.merged();
                merged = true;
                mergedFromId = anonMatch.getId();
                eventsMoved = outcome.eventsMoved();
            } else {
                // anonymous id stays with its current owner
                log.warning(String.format(
                        "action=anonymous_id_owned_elsewhere workspaceId=%s keepId=%s ownerId=%s",
                        workspaceId, keep.getId(), anonMatch.getId()));
                effective = effective.withAnonymousId(null);
            }
        }

        // ── Steps 5 & 7: promotion / append identifiers ──
        UnifiedIdentity updated = keep.withEvidence(effective, now);
        identityStore.mergeIdentifiers(updated);

        // ── Step 8: links ──
        recordLinks(workspaceId, updated.getId(), effective, now);

        boolean promoted = !merged && !hadEmail && updated.hasEmail();
        boolean emailAttached = effective.hasEmail() && !knewEmail;

        log.info(String.format(
                "action=identity_resolved workspaceId=%s unifiedUserId=%s created=false promoted=%s merged=%s emailAttached=%s",
                workspaceId, updated.getId(), promoted, merged, emailAttached));

        return new Resolution(updated, false, promoted, merged, mergedFromId, emailAttached, eventsMoved);
    }

    private Resolution createIdentity(String workspaceId, IdentityEvidence evidence, Instant now) {
        UnifiedIdentity created = UnifiedIdentity.create(workspaceId, evidence, now);
        identityStore.insert(created);
        recordLinks(workspaceId, created.getId(), evidence, now);

        log.info(String.format("action=identity_created workspaceId=%s unifiedUserId=%s hasEmail=%s",
                workspaceId, created.getId(), created.hasEmail()));

        return new Resolution(created, true, false, false, null, evidence.hasEmail(), 0);
    }

    private void recordLinks(String workspaceId, String unifiedUserId, IdentityEvidence evidence, Instant now) {
        link(workspaceId, unifiedUserId, IdentityType.ANONYMOUS_ID, evidence.getAnonymousId(), evidence, now);
        link(workspaceId, unifiedUserId, IdentityType.EMAIL, evidence.getEmail(), evidence, now);
        link(workspaceId, unifiedUserId, IdentityType.PHONE, evidence.getPhone(), evidence, now);
        link(workspaceId, unifiedUserId, IdentityType.CUSTOMER_ID, evidence.getCustomerId(), evidence, now);
    }

    private void link(String workspaceId, String unifiedUserId, IdentityType type, String value,
            IdentityEvidence evidence, Instant now) {
        if (value != null) {
            identityLinkStore.link(IdentityLink.observed(workspaceId, unifiedUserId, type, value,
                    evidence.getSource(), now));
        }
    }

    private static UnifiedIdentity lookup(boolean present,
            Supplier<Optional<UnifiedIdentity>> finder) {
        return present ? finder.get().orElse(null) : null;
    }

    private static boolean sameRecord(UnifiedIdentity a, UnifiedIdentity b) {
        return a != null && b != null && a.getId().equals(b.getId());
    }

    /**
     * Outcome of one resolve call.
     *
     * @param identity      the owning identity after all writes
     * @param created       a new record was inserted
     * @param promoted      an existing email-less record received its first email
     * @param merged        another record was stitched into this one
     * @param mergedFromId  id of the deleted record, when merged
     * @param emailAttached the supplied email was not known to this record before
     * @param eventsMoved   events reassigned by the merge
     */
    public record Resolution(
            UnifiedIdentity identity,
            boolean created,
            boolean promoted,
            boolean merged,
            String mergedFromId,
            boolean emailAttached,
            int eventsMoved) {

        public String unifiedUserId() {
            return identity.getId();
        }

        /** @return true when earlier anonymous events may now belong to a known person */
        public boolean identityChanged() {
            return promoted || merged || emailAttached;
        }
    }
}
