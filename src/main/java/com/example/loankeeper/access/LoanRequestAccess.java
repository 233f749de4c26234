package com.example.loankeeper.access;

import com.example.loankeeper.models.LoanRequest;
import java.util.List;
import java.util.Optional;

public interface LoanRequestAccess {

    Optional<LoanRequest> findByRequestId(long requestId);

    List<LoanRequest> findAll();

    /**
     * Inserts or replaces a loan.
     */
    void save(LoanRequest loan);

    /**
     * Writes the catalog-derived attributes of a loan, creating it when absent. Extension
     * attributes of the stored loan are never touched, and a stored {@code available_since}
     * wins over the one on the argument.
     *
     * @return the loan as stored after the write
     */
    LoanRequest mergeCatalogFields(LoanRequest loan);

    /**
     * Persists a loan that has just been granted its extension. Implementations must reject the
     * write when the stored loan is already extended or no longer exists.
     *
     * @return false when the conditional write was rejected
     */
    boolean saveExtension(LoanRequest extended);

    void delete(long requestId);
}
