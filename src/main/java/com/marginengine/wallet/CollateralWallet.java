package com.marginengine.wallet;

import com.marginengine.exception.InsufficientFundsException;
import java.math.BigDecimal;

/**
 * Contract of the external ledger that custodies owner balances.
 *
 * <p>The margin engine only reserves and releases; it never interprets wallet internals.
 * Reservations are owner-scoped holds: releasing against any of an owner's reservation
 * ids credits that owner.
 */
public interface CollateralWallet {

    /**
     * Moves {@code amount} from the owner's free balance into a new hold.
     *
     * @throws InsufficientFundsException if the free balance cannot cover the amount
     */
    ReservationId reserve(String owner, BigDecimal amount);

    /**
     * Returns {@code amount} (zero or more) to the free balance of the reservation's owner.
     * The amount may exceed what was reserved when the position closed in profit.
     */
    void release(ReservationId reservationId, BigDecimal amount);
}
