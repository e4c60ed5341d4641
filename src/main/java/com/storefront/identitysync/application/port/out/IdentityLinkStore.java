package com.storefront.identitysync.application.port.out;

import java.util.List;

import com.storefront.identitysync.domain.entity.IdentityLink;

/**
 * Secondary (outbound) port: evidentiary identifier links.
 */
public interface IdentityLinkStore {

    /**
     * Records a link; an existing (workspace, type, value) row is left as is.
     */
    void link(IdentityLink link);

    /**
     * Repoints every link of {@code fromUserId} to {@code toUserId}.
     *
     * @return rows moved
     */
    int reassign(String fromUserId, String toUserId);

    List<IdentityLink> findByUnifiedUserId(String unifiedUserId);
}
