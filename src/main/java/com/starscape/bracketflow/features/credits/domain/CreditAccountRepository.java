package com.starscape.bracketflow.features.credits.domain;

import java.util.Optional;

public interface CreditAccountRepository {
    CreditAccount save(CreditAccount account);
    Optional<CreditAccount> findById(String userId);
    Optional<CreditAccount> findByIdForUpdate(String userId);
}
