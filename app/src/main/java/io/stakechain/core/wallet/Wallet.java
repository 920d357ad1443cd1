package io.stakechain.core.wallet;

import io.stakechain.core.protocol.Block;
import io.stakechain.core.protocol.SignatureUtil;
import io.stakechain.core.protocol.Transaction;

import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.Objects;

/** Ed25519 key pair bound to a ledger address. */
public class Wallet {
    private final KeyPair keyPair;
    private final String address;

    public Wallet(String address, KeyPair keyPair) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("address required");
        }
        this.address = address;
        this.keyPair = Objects.requireNonNull(keyPair, "keyPair");
    }

    public static Wallet generate(String address) {
        return new Wallet(address, SignatureUtil.generateKeyPair());
    }

    public String getAddress() {
        return address;
    }

    public PrivateKey getPrivateKey() {
        return keyPair.getPrivate();
    }

    public PublicKey getPublicKey() {
        return keyPair.getPublic();
    }

    /** Signed copy of {@code tx}; the sender must be this wallet's address. */
    public Transaction sign(Transaction tx) {
        if (!address.equals(tx.from())) {
            throw new IllegalArgumentException("Wallet " + address + " cannot sign for " + tx.from());
        }
        return tx.sign(getPrivateKey());
    }

    public void sign(Block block) {
        block.sign(getPrivateKey());
    }

    public boolean verify(Transaction tx) {
        return tx.verify(getPublicKey());
    }

    public boolean verify(Block block) {
        return block.verify(getPublicKey());
    }
}
