package com.example.loankeeper.catalog;

import java.time.Instant;

/**
 * Availability of the media behind a request.
 *
 * @param title          display title used in notifications and summaries
 * @param fullyAvailable true once every requested part (all seasons for tv) is on disk
 * @param availableSince when the catalog first saw the media complete, if it knows
 * @param sizeOnDisk     bytes on disk
 */
public record CatalogMedia(
        String title,
        boolean fullyAvailable,
        Instant availableSince,
        long sizeOnDisk
) {
}
