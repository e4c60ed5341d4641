package com.storefront.identitysync.application.port.out;

import java.util.Optional;
import java.util.Set;

/**
 * Secondary (outbound) port: ingestion API key lookup.
 */
public interface ApiKeyValidator {

    /**
     * @return the grant for a known, unrevoked key
     */
    Optional<ApiKeyGrant> validate(String rawApiKey);

    record ApiKeyGrant(String workspaceId, Set<String> scopes) {

        public boolean allows(String scope) {
            return scopes != null && (scopes.contains(scope) || scopes.contains("*"));
        }
    }
}
