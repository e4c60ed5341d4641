package com.storefront.identitysync.domain.valueobject;

import java.util.Locale;
import java.util.Objects;

/**
 * Identifiers observed together on one event or identify call.
 * <p>
 * Blank values are normalized to {@code null}; emails are trimmed and
 * lower-cased so that lookups and the per-email lock always agree on the key.
 * </p>
 */
public final class IdentityEvidence {

    private final String anonymousId;
    private final String email;
    private final String phone;
    private final String customerId;
    private final String source;

    public IdentityEvidence(String anonymousId, String email, String phone,
            String customerId, String source) {
        this.anonymousId = blankToNull(anonymousId);
        this.email = normalizeEmail(email);
        this.phone = blankToNull(phone);
        this.customerId = blankToNull(customerId);
        this.source = source != null && !source.isBlank() ? source : "unknown";
    }

    public static IdentityEvidence anonymous(String anonymousId, String source) {
        return new IdentityEvidence(anonymousId, null, null, null, source);
    }

    public static IdentityEvidence email(String email, String source) {
        return new IdentityEvidence(null, email, null, null, source);
    }

    /**
     * Returns a copy carrying the given anonymous id, used when a fingerprint
     * replaces a missing cookie id.
     */
    public IdentityEvidence withAnonymousId(String newAnonymousId) {
        return new IdentityEvidence(newAnonymousId, email, phone, customerId, source);
    }

    /**
     * Returns a copy without a customer id, used when the customer id is known
     * to belong to a different identity.
     */
    public IdentityEvidence withoutCustomerId() {
        return new IdentityEvidence(anonymousId, email, phone, null, source);
    }

    public boolean hasAnyIdentifier() {
        return anonymousId != null || email != null || phone != null || customerId != null;
    }

    public boolean hasEmail() {
        return email != null;
    }

    public boolean hasAnonymousId() {
        return anonymousId != null;
    }

    public boolean hasCustomerId() {
        return customerId != null;
    }

    public static String normalizeEmail(String raw) {
        String value = blankToNull(raw);
        return value != null ? value.toLowerCase(Locale.ROOT) : null;
    }

    private static String blankToNull(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    // ─────────────────── Getters ───────────────────

    public String getAnonymousId() {
        return anonymousId;
    }

    public String getEmail() {
        return email;
    }

    public String getPhone() {
        return phone;
    }

    public String getCustomerId() {
        return customerId;
    }

    public String getSource() {
        return source;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        IdentityEvidence that = (IdentityEvidence) o;
        return Objects.equals(anonymousId, that.anonymousId)
                && Objects.equals(email, that.email)
                && Objects.equals(phone, that.phone)
                && Objects.equals(customerId, that.customerId)
                && Objects.equals(source, that.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(anonymousId, email, phone, customerId, source);
    }

    @Override
    public String toString() {
        return "IdentityEvidence{anonymousId='" + anonymousId
                + "', email=" + (email != null ? "present" : "absent")
                + ", customerId='" + customerId
                + "', source='" + source + "'}";
    }
}
