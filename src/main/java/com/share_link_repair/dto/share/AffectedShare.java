package com.share_link_repair.dto.share;

/**
 * A link share selected for removal, with the two users who must hear about it.
 */
public record AffectedShare(Integer id, String uidOwner, String uidInitiator) {
}
