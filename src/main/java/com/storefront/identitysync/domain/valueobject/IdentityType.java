package com.storefront.identitysync.domain.valueobject;

/**
 * Kind of identifier an {@code IdentityLink} records.
 * <p>
 * The wire value is the string stored in the {@code identities.identity_type}
 * column.
 * </p>
 */
public enum IdentityType {

    ANONYMOUS_ID("anonymous_id"),
    EMAIL("email"),
    PHONE("phone"),
    CUSTOMER_ID("customer_id");

    private final String value;

    IdentityType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static IdentityType fromValue(String value) {
        for (IdentityType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown identity type: " + value);
    }
}
