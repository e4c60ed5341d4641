package com.storefront.identitysync.domain.entity;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

import com.storefront.identitysync.domain.valueobject.IdentityEvidence;

/**
 * Canonical customer (or anonymous visitor) record within one workspace.
 * <p>
 * <b>IMMUTABLE:</b> every change returns a NEW instance. Identifier sets are
 * union-only: no operation here removes an anonymous id, email or customer id.
 * </p>
 *
 * <p>
 * <b>Invariants:</b>
 * </p>
 * <ul>
 * <li>id and workspaceId are non-blank</li>
 * <li>primaryEmail, once set, is never replaced by {@link #withEvidence}</li>
 * <li>phone is first-write-wins</li>
 * <li>primaryEmail, when present, is also contained in emails</li>
 * </ul>
 */
public final class UnifiedIdentity {

    private final String id;
    private final String workspaceId;
    private final Set<String> anonymousIds;
    private final Set<String> emails;
    private final Set<String> customerIds;
    private final String primaryEmail;
    private final String phone;
    private final ComputedTraits computed;
    private final Map<String, Object> traits;
    private final Instant firstSeenAt;
    private final Instant lastSeenAt;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final long version;

    // ─────────────────── Private Constructor ───────────────────

    private UnifiedIdentity(String id, String workspaceId,
            Set<String> anonymousIds, Set<String> emails, Set<String> customerIds,
            String primaryEmail, String phone,
            ComputedTraits computed, Map<String, Object> traits,
            Instant firstSeenAt, Instant lastSeenAt,
            Instant createdAt, Instant updatedAt, long version) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (workspaceId == null || workspaceId.isBlank()) {
            throw new IllegalArgumentException("workspaceId cannot be null or blank");
        }
        if (firstSeenAt == null || lastSeenAt == null) {
            throw new IllegalArgumentException("firstSeenAt and lastSeenAt cannot be null");
        }

        Set<String> emailSet = copy(emails);
        if (primaryEmail != null) {
            emailSet.add(primaryEmail);
        }

        this.id = id;
        this.workspaceId = workspaceId;
        this.anonymousIds = Collections.unmodifiableSet(copy(anonymousIds));
        this.emails = Collections.unmodifiableSet(emailSet);
        this.customerIds = Collections.unmodifiableSet(copy(customerIds));
        this.primaryEmail = primaryEmail;
        this.phone = phone;
        this.computed = computed != null ? computed : ComputedTraits.empty();
        this.traits = traits != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(traits))
                : Collections.emptyMap();
        this.firstSeenAt = firstSeenAt;
        this.lastSeenAt = lastSeenAt;
        this.createdAt = createdAt != null ? createdAt : firstSeenAt;
        this.updatedAt = updatedAt != null ? updatedAt : this.createdAt;
        this.version = version;
    }

    // ─────────────────── Factory Methods ───────────────────

    /**
     * Creates a brand-new identity seeded with every identifier in the evidence.
     */
    public static UnifiedIdentity create(String workspaceId, IdentityEvidence evidence, Instant now) {
        if (evidence == null || !evidence.hasAnyIdentifier()) {
            throw new IllegalArgumentException("at least one identifier is required to create an identity");
        }
        return new UnifiedIdentity(
                UUID.randomUUID().toString(),
                workspaceId,
                singletonOrEmpty(evidence.getAnonymousId()),
                singletonOrEmpty(evidence.getEmail()),
                singletonOrEmpty(evidence.getCustomerId()),
                evidence.getEmail(),
                evidence.getPhone(),
                ComputedTraits.empty(),
                Collections.emptyMap(),
                now, now, now, now, 0L);
    }

    /**
     * Rebuilds an identity from persisted columns.
     */
    public static UnifiedIdentity reconstruct(String id, String workspaceId,
            Set<String> anonymousIds, Set<String> emails, Set<String> customerIds,
            String primaryEmail, String phone,
            ComputedTraits computed, Map<String, Object> traits,
            Instant firstSeenAt, Instant lastSeenAt,
            Instant createdAt, Instant updatedAt, long version) {
        return new UnifiedIdentity(id, workspaceId, anonymousIds, emails, customerIds,
                primaryEmail, phone, computed, traits, firstSeenAt, lastSeenAt,
                createdAt, updatedAt, version);
    }

    // ─────────────────── Behavior Methods ───────────────────

    /**
     * Appends any identifier not yet known. primaryEmail and phone are only
     * filled when currently empty.
     */
    public UnifiedIdentity withEvidence(IdentityEvidence evidence, Instant now) {
        Set<String> anon = copy(anonymousIds);
        Set<String> mails = copy(emails);
        Set<String> customers = copy(customerIds);
        addIfPresent(anon, evidence.getAnonymousId());
        addIfPresent(mails, evidence.getEmail());
        addIfPresent(customers, evidence.getCustomerId());

        return new UnifiedIdentity(id, workspaceId, anon, mails, customers,
                primaryEmail != null ? primaryEmail : evidence.getEmail(),
                phone != null ? phone : evidence.getPhone(),
                computed, traits, firstSeenAt, latest(lastSeenAt, now),
                createdAt, now, version);
    }

    /**
     * Folds another record into this one. This record keeps its id and
     * primary email; sets are unioned and the seen-window widened.
     */
    public UnifiedIdentity absorb(UnifiedIdentity loser, Instant now) {
        if (loser.id.equals(id)) {
            throw new IllegalStateException("cannot absorb an identity into itself: " + id);
        }
        if (!loser.workspaceId.equals(workspaceId)) {
            throw new IllegalStateException("cannot merge identities across workspaces");
        }
        Set<String> anon = copy(anonymousIds);
        anon.addAll(loser.anonymousIds);
        Set<String> mails = copy(emails);
        mails.addAll(loser.emails);
        Set<String> customers = copy(customerIds);
        customers.addAll(loser.customerIds);

        Map<String, Object> mergedTraits = new LinkedHashMap<>(loser.traits);
        mergedTraits.putAll(traits);

        return new UnifiedIdentity(id, workspaceId, anon, mails, customers,
                primaryEmail != null ? primaryEmail : loser.primaryEmail,
                phone != null ? phone : loser.phone,
                computed, mergedTraits,
                firstSeenAt.isBefore(loser.firstSeenAt) ? firstSeenAt : loser.firstSeenAt,
                latest(latest(lastSeenAt, loser.lastSeenAt), now),
                createdAt, now, version);
    }

    /**
     * Merges explicitly supplied attributes; later values win per key.
     */
    public UnifiedIdentity withTraits(Map<String, Object> newTraits, Instant now) {
        if (newTraits == null || newTraits.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(traits);
        merged.putAll(newTraits);
        return new UnifiedIdentity(id, workspaceId, anonymousIds, emails, customerIds,
                primaryEmail, phone, computed, merged, firstSeenAt, latest(lastSeenAt, now),
                createdAt, now, version);
    }

    public UnifiedIdentity withComputed(ComputedTraits newComputed, Instant now) {
        return new UnifiedIdentity(id, workspaceId, anonymousIds, emails, customerIds,
                primaryEmail, phone, newComputed, traits, firstSeenAt, lastSeenAt,
                createdAt, now, version + 1);
    }

    public boolean hasEmail() {
        return primaryEmail != null;
    }

    public boolean isAnonymous() {
        return primaryEmail == null && customerIds.isEmpty();
    }

    public boolean containsAnonymousId(String anonymousId) {
        return anonymousId != null && anonymousIds.contains(anonymousId);
    }

    public boolean wasUpdatedWithin(Duration window, Instant now) {
        return !updatedAt.isBefore(now.minus(window));
    }

    // ─────────────────── Private Helpers ───────────────────

    private static Set<String> copy(Set<String> source) {
        return source != null ? new LinkedHashSet<>(source) : new LinkedHashSet<>();
    }

    private static Set<String> singletonOrEmpty(String value) {
        Set<String> set = new LinkedHashSet<>();
        addIfPresent(set, value);
        return set;
    }

    private static void addIfPresent(Set<String> set, String value) {
        if (value != null && !value.isBlank()) {
            set.add(value);
        }
    }

    private static Instant latest(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }

    // ─────────────────── Getters ───────────────────

    public String getId() {
        return id;
    }

    public String getWorkspaceId() {
        return workspaceId;
    }

    public Set<String> getAnonymousIds() {
        return anonymousIds;
    }

    public Set<String> getEmails() {
        return emails;
    }

    public Set<String> getCustomerIds() {
        return customerIds;
    }

    public String getPrimaryEmail() {
        return primaryEmail;
    }

    public String getPhone() {
        return phone;
    }

    public ComputedTraits getComputed() {
        return computed;
    }

    public Map<String, Object> getTraits() {
        return traits;
    }

    public Instant getFirstSeenAt() {
        return firstSeenAt;
    }

    public Instant getLastSeenAt() {
        return lastSeenAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public long getVersion() {
        return version;
    }

    // ─────────────────── Identity ───────────────────

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        UnifiedIdentity that = (UnifiedIdentity) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "UnifiedIdentity{id='" + id
                + "', workspaceId='" + workspaceId
                + "', anonymousIds=" + anonymousIds.size()
                + ", hasEmail=" + hasEmail()
                + ", customerIds=" + customerIds.size()
                + ", version=" + version + "}";
    }
}
