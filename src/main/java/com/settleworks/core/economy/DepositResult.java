package com.settleworks.core.economy;

import com.settleworks.core.domain.resources.ResourceType;

/**
 * Outcome of a single deposit. {@code overflow} is the part that does not fit under capacity;
 * it stays in the ledger until {@link StorageLedger#resolveOverflow()} disposes of it.
 */
public record DepositResult(ResourceType type, double deposited, double accepted, double overflow) {

    public boolean overflowed() {
        return overflow > 0;
    }
}
