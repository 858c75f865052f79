package com.marginengine.wallet;

import com.marginengine.exception.InsufficientFundsException;
import com.marginengine.exception.ResourceNotFoundException;
import com.marginengine.exception.ValidationException;
import java.math.BigDecimal;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-process stand-in for the external wallet, used when no real ledger is wired.
 *
 * <p>Tracks a free and a reserved balance per owner. Balances are updated under
 * {@code ConcurrentHashMap.compute} so each reserve/release is atomic per owner.
 * Reserved balances floor at zero: profit paid out on release comes from the house.
 */
@Component
public class InMemoryCollateralWallet implements CollateralWallet {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCollateralWallet.class);

    private final Map<String, Balance> balances = new ConcurrentHashMap<>();
    private final Map<String, String> reservationOwners = new ConcurrentHashMap<>();

    /** Deposits funds into an owner's free balance. */
    public void credit(String owner, BigDecimal amount) {
        requireNonNegative(amount);
        balances.merge(owner, new Balance(amount, BigDecimal.ZERO), (current, added) ->
                new Balance(current.available().add(added.available()), current.reserved()));
        log.info("Credited {} to {}", amount, owner);
    }

    @Override
    public ReservationId reserve(String owner, BigDecimal amount) {
        requireNonNegative(amount);
        balances.compute(owner, (key, current) -> {
            Balance balance = current != null ? current : new Balance(BigDecimal.ZERO, BigDecimal.ZERO);
            if (balance.available().compareTo(amount) < 0) {
                throw new InsufficientFundsException(owner, amount, balance.available());
            }
            return new Balance(balance.available().subtract(amount), balance.reserved().add(amount));
        });

        ReservationId reservationId = new ReservationId(UUID.randomUUID().toString());
        reservationOwners.put(reservationId.value(), owner);
        log.debug("Reserved {} for {} as {}", amount, owner, reservationId);
        return reservationId;
    }

    @Override
    public void release(ReservationId reservationId, BigDecimal amount) {
        requireNonNegative(amount);
        String owner = reservationOwners.get(reservationId.value());
        if (owner == null) {
            throw new ResourceNotFoundException("Reservation", reservationId.value());
        }
        balances.compute(owner, (key, current) -> {
            Balance balance = current != null ? current : new Balance(BigDecimal.ZERO, BigDecimal.ZERO);
            BigDecimal reserved = balance.reserved().subtract(amount).max(BigDecimal.ZERO);
            return new Balance(balance.available().add(amount), reserved);
        });
        log.debug("Released {} to {} from {}", amount, owner, reservationId);
    }

    public BigDecimal getAvailable(String owner) {
        Balance balance = balances.get(owner);
        return balance != null ? balance.available() : BigDecimal.ZERO;
    }

    public BigDecimal getReserved(String owner) {
        Balance balance = balances.get(owner);
        return balance != null ? balance.reserved() : BigDecimal.ZERO;
    }

    private void requireNonNegative(BigDecimal amount) {
        if (amount == null || amount.signum() < 0) {
            throw new ValidationException("Wallet amount must be zero or positive: " + amount);
        }
    }

    private record Balance(BigDecimal available, BigDecimal reserved) {}
}
