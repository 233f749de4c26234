package com.example.loankeeper.catalog;

import com.example.loankeeper.models.MediaType;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A request as listed by the media catalog.
 *
 * @param requestId         catalog request id
 * @param mediaType         movie or tv
 * @param mediaId           catalog media id
 * @param externalServiceId id of the media in the download manager that holds the files
 * @param requestedBy       email address of the requesting user
 * @param requestedAt       when the request was made
 * @param seasons           requested seasons, empty for movies
 */
public record CatalogRequest(
        long requestId,
        MediaType mediaType,
        long mediaId,
        Long externalServiceId,
        String requestedBy,
        Instant requestedAt,
        List<Integer> seasons
) {
    public CatalogRequest {
        Objects.requireNonNull(mediaType, "mediaType");
        Objects.requireNonNull(requestedAt, "requestedAt");
        seasons = seasons == null ? List.of() : List.copyOf(seasons);
    }
}
