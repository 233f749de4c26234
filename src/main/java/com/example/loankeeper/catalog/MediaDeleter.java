package com.example.loankeeper.catalog;

/**
 * Tells downstream systems to remove the files and the catalog entry for a request.
 */
public interface MediaDeleter {

    /**
     * @throws RuntimeException when any downstream removal fails; the loan is kept and the
     *                          deletion is attempted again on the next process run
     */
    void delete(CatalogRequest request);
}
