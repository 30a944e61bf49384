package com.starscape.bracketflow.features.credits.domain;

/**
 * Prepaid credit ledger. Every operation is idempotent on its key: repeating a key returns
 * the current balance and changes nothing, so callers retry with the same key and never
 * with a fresh one.
 */
public interface CreditLedgerGateway {
    
    /**
     * Moves {@code amount} from available to reserved.
     *
     * @throws com.starscape.bracketflow.common.exception.InsufficientCreditsException when available is short
     */
    CreditBalance reserve(String userId, String jobId, long amount, String idempotencyKey);
    
    /**
     * Moves {@code amount} from reserved back to available.
     */
    CreditBalance release(String userId, String jobId, long amount, String idempotencyKey);
    
    /**
     * Moves {@code amount} from reserved to spent.
     */
    CreditBalance settle(String userId, String jobId, long amount, String idempotencyKey);
}
