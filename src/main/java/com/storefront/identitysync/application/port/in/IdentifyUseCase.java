package com.storefront.identitysync.application.port.in;

import java.util.Map;

/**
 * Primary (inbound) port: explicit identify calls from the storefront.
 */
public interface IdentifyUseCase {

    /**
     * @throws IllegalArgumentException  if no identifier is present
     * @throws PayloadTooLargeException if traits exceed the size or depth limit
     */
    IdentifyResult identify(IdentifyCommand command);

    record IdentifyCommand(
            String workspaceId,
            String anonymousId,
            String userId,
            String email,
            String phone,
            Map<String, Object> traits) {
    }

    record IdentifyResult(
            String unifiedUserId,
            boolean newUser,
            boolean identityMerged,
            int eventsLinked,
            int syncJobsCreated) {
    }
}
