package io.stakechain.core.wallet;

import java.security.PublicKey;
import java.util.Optional;

/**
 * Key management for ledger addresses. The ledger signs blocks for whichever producer the
 * stake ledger elects, so implementations must be able to hand out a wallet for any
 * address they manage.
 */
public interface KeyRing {

    /** Wallet for {@code address}, creating its key pair if this ring manages key creation. */
    Wallet walletFor(String address);

    /** Public key of an address already known to the ring. */
    Optional<PublicKey> publicKeyOf(String address);

    boolean contains(String address);
}
