package com.starscape.bracketflow.features.credits.infra;

import com.starscape.bracketflow.features.credits.domain.CreditLedgerEntry;
import com.starscape.bracketflow.features.credits.domain.CreditLedgerEntryRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaCreditLedgerEntryRepository extends JpaRepository<CreditLedgerEntry, String>, CreditLedgerEntryRepository {
}
