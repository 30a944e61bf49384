package com.starscape.bracketflow.features.credits.domain;

/**
 * Balance of a credit account after a ledger operation.
 *
 * @param applied false when the idempotency key had already been used and nothing changed
 */
public record CreditBalance(long available, long reserved, long spent, boolean applied) {
}
