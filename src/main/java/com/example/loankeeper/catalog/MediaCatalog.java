package com.example.loankeeper.catalog;

import java.util.List;

/**
 * Read side of the external request catalog. Calls may block on network I/O.
 */
public interface MediaCatalog {

    /**
     * Lists every request the catalog currently knows about.
     *
     * @throws RuntimeException when the catalog cannot be reached; the whole run fails
     */
    List<CatalogRequest> listRequests();

    /**
     * Resolves title and availability for one request.
     *
     * @throws RuntimeException when the lookup fails; only this item is skipped
     */
    CatalogMedia describe(CatalogRequest request);

    /**
     * Connectivity probe used by {@code validate}.
     */
    boolean isReachable();
}
