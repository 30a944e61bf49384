package com.starscape.bracketflow.features.credits.app;

import com.starscape.bracketflow.features.credits.domain.CreditAccount;
import com.starscape.bracketflow.features.credits.domain.CreditAccountRepository;
import com.starscape.bracketflow.features.credits.domain.CreditBalance;
import com.starscape.bracketflow.features.credits.domain.CreditLedgerEntry;
import com.starscape.bracketflow.features.credits.domain.CreditLedgerEntryRepository;
import com.starscape.bracketflow.features.credits.domain.CreditLedgerGateway;
import com.starscape.bracketflow.features.credits.domain.LedgerEntryType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Database-backed ledger. The account row lock serializes operations per user and the
 * journal's unique key turns a repeated operation into a no-op.
 */
@Service
public class CreditLedger implements CreditLedgerGateway {
    
    private static final Logger log = LoggerFactory.getLogger(CreditLedger.class);
    
    private final CreditAccountRepository accountRepository;
    private final CreditLedgerEntryRepository entryRepository;
    
    public CreditLedger(CreditAccountRepository accountRepository, CreditLedgerEntryRepository entryRepository) {
        this.accountRepository = accountRepository;
        this.entryRepository = entryRepository;
    }
    
    @Override
    @Transactional
    public CreditBalance reserve(String userId, String jobId, long amount, String idempotencyKey) {
        return apply(userId, jobId, amount, idempotencyKey, LedgerEntryType.RESERVE);
    }
    
    @Override
    @Transactional
    public CreditBalance release(String userId, String jobId, long amount, String idempotencyKey) {
        return apply(userId, jobId, amount, idempotencyKey, LedgerEntryType.RELEASE);
    }
    
    @Override
    @Transactional
    public CreditBalance settle(String userId, String jobId, long amount, String idempotencyKey) {
        return apply(userId, jobId, amount, idempotencyKey, LedgerEntryType.SETTLE);
    }
    
    /**
     * Funds an account. Top-ups arrive from the billing side under their own key.
     */
    @Transactional
    public CreditBalance deposit(String userId, long amount, String idempotencyKey) {
        return apply(userId, null, amount, idempotencyKey, LedgerEntryType.DEPOSIT);
    }
    
    @Transactional(readOnly = true)
    public CreditBalance balance(String userId) {
        return accountRepository.findById(userId)
                .map(account -> account.balance(false))
                .orElse(new CreditBalance(0, 0, 0, false));
    }
    
    private CreditBalance apply(String userId, String jobId, long amount, String idempotencyKey, LedgerEntryType type) {
        if (amount < 0) {
            throw new IllegalArgumentException("Ledger amount must not be negative: " + amount);
        }
        Objects.requireNonNull(idempotencyKey, "idempotencyKey");
        
        CreditAccount account = accountRepository.findByIdForUpdate(userId)
                .orElseGet(() -> accountRepository.save(new CreditAccount(userId)));
        
        Optional<CreditLedgerEntry> existing = entryRepository.findByIdempotencyKey(idempotencyKey);
        if (existing.isPresent()) {
            CreditLedgerEntry entry = existing.get();
            if (entry.getType() != type || !Objects.equals(entry.getJobId(), jobId)
                    || !entry.getUserId().equals(userId)) {
                throw new IllegalStateException("Idempotency key " + idempotencyKey + " already used for a different operation");
            }
            log.debug("Ledger key {} already applied, returning current balance", idempotencyKey);
            return account.balance(false);
        }
        if (amount == 0) {
            return account.balance(false);
        }
        
        switch (type) {
            case DEPOSIT -> account.deposit(amount);
            case RESERVE -> account.reserve(amount);
            case RELEASE -> account.release(amount);
            case SETTLE -> account.settle(amount);
        }
        entryRepository.save(new CreditLedgerEntry(
            "cle_" + UUID.randomUUID().toString().replace("-", ""),
            idempotencyKey,
            userId,
            jobId,
            type,
            amount
        ));
        accountRepository.save(account);
        log.info("Ledger {} of {} credits for user {} job {} (key {})", type, amount, userId, jobId, idempotencyKey);
        return account.balance(true);
    }
}
