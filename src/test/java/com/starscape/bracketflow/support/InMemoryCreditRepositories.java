package com.starscape.bracketflow.support;

import com.starscape.bracketflow.features.credits.domain.CreditAccount;
import com.starscape.bracketflow.features.credits.domain.CreditAccountRepository;
import com.starscape.bracketflow.features.credits.domain.CreditLedgerEntry;
import com.starscape.bracketflow.features.credits.domain.CreditLedgerEntryRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Account and journal stores backing a real {@code CreditLedger} in unit tests.
 */
public final class InMemoryCreditRepositories {

    private InMemoryCreditRepositories() {
    }

    public static class Accounts implements CreditAccountRepository {

        private final Map<String, CreditAccount> accounts = new ConcurrentHashMap<>();

        @Override
        public CreditAccount save(CreditAccount account) {
            accounts.put(account.getUserId(), account);
            return account;
        }

        @Override
        public Optional<CreditAccount> findById(String userId) {
            return Optional.ofNullable(accounts.get(userId));
        }

        @Override
        public Optional<CreditAccount> findByIdForUpdate(String userId) {
            return findById(userId);
        }
    }

    public static class Entries implements CreditLedgerEntryRepository {

        private final List<CreditLedgerEntry> entries = new ArrayList<>();

        @Override
        public synchronized CreditLedgerEntry save(CreditLedgerEntry entry) {
            if (findByIdempotencyKey(entry.getIdempotencyKey()).isPresent()) {
                throw new IllegalStateException("Duplicate idempotency key " + entry.getIdempotencyKey());
            }
            entries.add(entry);
            return entry;
        }

        @Override
        public synchronized Optional<CreditLedgerEntry> findByIdempotencyKey(String idempotencyKey) {
            return entries.stream().filter(entry -> entry.getIdempotencyKey().equals(idempotencyKey)).findFirst();
        }

        @Override
        public synchronized List<CreditLedgerEntry> findByJobIdOrderByCreatedAtAsc(String jobId) {
            return entries.stream().filter(entry -> Objects.equals(entry.getJobId(), jobId)).toList();
        }
    }
}
