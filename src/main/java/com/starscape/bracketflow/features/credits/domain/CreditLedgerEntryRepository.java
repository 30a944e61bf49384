package com.starscape.bracketflow.features.credits.domain;

import java.util.List;
import java.util.Optional;

public interface CreditLedgerEntryRepository {
    CreditLedgerEntry save(CreditLedgerEntry entry);
    Optional<CreditLedgerEntry> findByIdempotencyKey(String idempotencyKey);
    List<CreditLedgerEntry> findByJobIdOrderByCreatedAtAsc(String jobId);
}
