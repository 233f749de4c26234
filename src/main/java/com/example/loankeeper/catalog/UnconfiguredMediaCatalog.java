package com.example.loankeeper.catalog;

import com.example.loankeeper.service.LoanKeeperException;
import java.util.List;

/**
 * Placeholder registered when no catalog client bean is present. Every run fails with
 * {@code COLLABORATOR_UNAVAILABLE} and {@code validate} reports the catalog as unreachable.
 */
public class UnconfiguredMediaCatalog implements MediaCatalog {

    private static final String NAME = "Media catalog (not configured)";

    @Override
    public List<CatalogRequest> listRequests() {
        throw LoanKeeperException.collaboratorUnavailable(NAME, null);
    }

    @Override
    public CatalogMedia describe(CatalogRequest request) {
        throw LoanKeeperException.collaboratorUnavailable(NAME, null);
    }

    @Override
    public boolean isReachable() {
        return false;
    }
}
