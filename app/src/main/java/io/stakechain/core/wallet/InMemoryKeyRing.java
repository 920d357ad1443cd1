package io.stakechain.core.wallet;

import java.security.PublicKey;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Generates an Ed25519 key pair the first time an address is asked for.
 * Keys live only as long as the process.
 */
public final class InMemoryKeyRing implements KeyRing {
    private static final Logger LOG = Logger.getLogger(InMemoryKeyRing.class.getName());

    private final Map<String, Wallet> wallets = new ConcurrentHashMap<>();

    @Override
    public Wallet walletFor(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("address required");
        }
        return wallets.computeIfAbsent(address, a -> {
            LOG.fine("Generated key pair for " + a);
            return Wallet.generate(a);
        });
    }

    /** Register an externally created wallet; an existing entry for the address is kept. */
    public Wallet register(Wallet wallet) {
        Wallet existing = wallets.putIfAbsent(wallet.getAddress(), wallet);
        return existing != null ? existing : wallet;
    }

    @Override
    public Optional<PublicKey> publicKeyOf(String address) {
        Wallet wallet = address == null ? null : wallets.get(address);
        return wallet == null ? Optional.empty() : Optional.of(wallet.getPublicKey());
    }

    @Override
    public boolean contains(String address) {
        return address != null && wallets.containsKey(address);
    }
}
