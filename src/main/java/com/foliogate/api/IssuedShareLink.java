package com.foliogate.api;

import com.foliogate.shared.model.ShareLink;

/**
 * Result of create-or-get: the resource's active link and whether this call minted it.
 */
public record IssuedShareLink(ShareLink link, boolean created) {
}
