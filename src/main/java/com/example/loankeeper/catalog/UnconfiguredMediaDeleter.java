package com.example.loankeeper.catalog;

import com.example.loankeeper.service.LoanKeeperException;

public class UnconfiguredMediaDeleter implements MediaDeleter {

    @Override
    public void delete(CatalogRequest request) {
        throw LoanKeeperException.collaboratorUnavailable("Media deleter (not configured)", null);
    }
}
