package io.stakechain.core.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Block = header fields + ordered transactions + derived digests.
 * Derived fields (fees, reward, roots, hash) are recomputed on every change until the block
 * is signed; after that the block is frozen and {@link #addTransaction} is refused.
 */
public final class Block {
    public static final double BASE_REWARD = 10.0;
    public static final long HALVING_INTERVAL = 210_000L;
    public static final double TX_BONUS_PER_TX = 0.1;
    public static final double MAX_TX_BONUS = 5.0;
    public static final double AMOUNT_EPSILON = 0.001;
    public static final long MAX_FUTURE_DRIFT_MILLIS = 60_000L;

    private final long index;
    private final long timestamp;
    private final List<Transaction> transactions;
    private final String previousHash;
    private final String producer;
    private final long nonce;

    private String hash;
    private String signature;
    private String merkleRoot;
    private String stateRoot;
    private int transactionCount;
    private double totalFees;
    private double reward;

    private Block(long index, long timestamp, List<Transaction> txs, String previousHash, String producer, long nonce) {
        this.index = index;
        this.timestamp = timestamp;
        this.transactions = new ArrayList<>(txs != null ? txs : List.of());
        this.previousHash = previousHash;
        this.producer = producer;
        this.nonce = nonce;
        this.signature = "";
    }

    public static Block create(long index, List<Transaction> transactions, String previousHash, String producer) {
        return create(index, transactions, previousHash, producer, System.currentTimeMillis());
    }

    public static Block create(long index, List<Transaction> transactions, String previousHash, String producer, long timestamp) {
        Block block = new Block(index, timestamp, transactions, previousHash, producer, 0L);
        block.recomputeDerived();
        return block;
    }

    /** Rebuild a block exactly as it was recorded, without recomputing anything. */
    static Block restore(long index, long timestamp, List<Transaction> transactions, String previousHash,
                         String hash, long nonce, String producer, String signature, String merkleRoot,
                         String stateRoot, int transactionCount, double totalFees, double reward) {
        Block block = new Block(index, timestamp, transactions, previousHash, producer, nonce);
        block.hash = hash;
        block.signature = signature != null ? signature : "";
        block.merkleRoot = merkleRoot;
        block.stateRoot = stateRoot;
        block.transactionCount = transactionCount;
        block.totalFees = totalFees;
        block.reward = reward;
        return block;
    }

    // -------------------- getters --------------------
    public long index() { return index; }
    public long timestamp() { return timestamp; }
    public List<Transaction> transactions() { return Collections.unmodifiableList(transactions); }
    public String previousHash() { return previousHash; }
    public String hash() { return hash; }
    public long nonce() { return nonce; }
    public String producer() { return producer; }
    public String signature() { return signature; }
    public String merkleRoot() { return merkleRoot; }
    public String stateRoot() { return stateRoot; }
    public int transactionCount() { return transactionCount; }
    public double totalFees() { return totalFees; }
    public double reward() { return reward; }
    public boolean isSigned() { return !signature.isEmpty(); }

    // -------------------- reward policy --------------------

    /** Base reward at a height: 10, halved every 210,000 blocks. */
    public static double baseReward(long index) {
        long halvings = Math.max(0L, index) / HALVING_INTERVAL;
        return BASE_REWARD / Math.pow(2, halvings);
    }

    /** Empty blocks earn nothing; otherwise base + min(0.1 per tx, 5) + fees. */
    public static double computeReward(long index, int txCount, double totalFees) {
        if (txCount == 0) {
            return 0.0;
        }
        double transactionBonus = Math.min(txCount * TX_BONUS_PER_TX, MAX_TX_BONUS);
        return baseReward(index) + transactionBonus + totalFees;
    }

    // -------------------- digests --------------------

    public String calculateMerkleRoot() {
        return Hashes.toHex(Merkle.rootOf(leaves()));
    }

    public String calculateStateRoot() {
        byte[] producerBytes = utf8(producer);
        ByteBuffer buf = ByteBuffer.allocate(8 + 8 + 4 + 8 + 4 + producerBytes.length);
        buf.putLong(index);
        buf.putLong(timestamp);
        buf.putInt(transactionCount);
        buf.putDouble(totalFees);
        putBytes(buf, producerBytes);
        return Hashes.sha256Hex(buf.array());
    }

    /** Header hash over every header field, including both roots. */
    public String calculateHash() {
        byte[] prev = utf8(previousHash);
        byte[] merkle = utf8(merkleRoot);
        byte[] state = utf8(stateRoot);
        byte[] prod = utf8(producer);
        ByteBuffer buf = ByteBuffer.allocate(8 + 8 + 4 + prev.length + 4 + merkle.length + 4 + state.length
                + 4 + prod.length + 8 + 4 + 8);
        buf.putLong(index);
        buf.putLong(timestamp);
        putBytes(buf, prev);
        putBytes(buf, merkle);
        putBytes(buf, state);
        putBytes(buf, prod);
        buf.putLong(nonce);
        buf.putInt(transactionCount);
        buf.putDouble(totalFees);
        return Hashes.sha256Hex(buf.array());
    }

    /** Inclusion proof for a transaction of this block, if present. */
    public Optional<List<Merkle.ProofStep>> merkleProof(String txId) {
        for (int i = 0; i < transactions.size(); i++) {
            if (transactions.get(i).id().equals(txId)) {
                return Optional.of(Merkle.proofFor(leaves(), i));
            }
        }
        return Optional.empty();
    }

    // -------------------- mutation (pre-signing only) --------------------

    /** Appends a transaction while the block is still open; returns false once signed. */
    public boolean addTransaction(Transaction tx) {
        if (isSigned()) {
            return false;
        }
        if (tx == null || isBlank(tx.id()) || isBlank(tx.from()) || isBlank(tx.to())) {
            return false;
        }
        transactions.add(tx);
        recomputeDerived();
        return true;
    }

    public void sign(PrivateKey key) {
        Objects.requireNonNull(key, "key");
        if (isSigned()) {
            throw new IllegalStateException("Block " + index + " is already signed");
        }
        this.hash = calculateHash();
        this.signature = SignatureUtil.signDigest(hash, key);
    }

    public boolean verify(PublicKey key) {
        return isSigned() && SignatureUtil.verifyDigest(calculateHash(), signature, key);
    }

    // -------------------- validation --------------------

    public boolean isValid() {
        return isValid(System.currentTimeMillis());
    }

    public boolean isValid(long nowMillis) {
        if (index < 0 || isBlank(previousHash) || isBlank(producer)) {
            return false;
        }
        if (hash == null || !hash.equals(calculateHash())) {
            return false;
        }
        if (merkleRoot == null || !merkleRoot.equals(calculateMerkleRoot())) {
            return false;
        }
        if (transactionCount != transactions.size()) {
            return false;
        }
        if (stateRoot == null || !stateRoot.equals(calculateStateRoot())) {
            return false;
        }
        for (Transaction tx : transactions) {
            if (tx == null || isBlank(tx.id()) || !(tx.amount() >= 0)) {
                return false;
            }
        }
        if (timestamp > nowMillis + MAX_FUTURE_DRIFT_MILLIS) {
            return false;
        }
        double fees = sumFees();
        if (Math.abs(totalFees - fees) > AMOUNT_EPSILON) {
            return false;
        }
        return Math.abs(reward - computeReward(index, transactions.size(), fees)) <= AMOUNT_EPSILON;
    }

    /** Approximate serialized size in bytes. */
    public int size() {
        return BlockCodec.toJson(this).getBytes(StandardCharsets.UTF_8).length;
    }

    // -------------------- helpers --------------------

    private void recomputeDerived() {
        this.transactionCount = transactions.size();
        this.totalFees = sumFees();
        this.reward = computeReward(index, transactionCount, totalFees);
        this.merkleRoot = calculateMerkleRoot();
        this.stateRoot = calculateStateRoot();
        this.hash = calculateHash();
    }

    private double sumFees() {
        double total = 0.0;
        for (Transaction tx : transactions) {
            total += tx.fee();
        }
        return total;
    }

    private List<byte[]> leaves() {
        List<byte[]> leaves = new ArrayList<>(transactions.size());
        for (Transaction tx : transactions) leaves.add(Hashes.fromHex(tx.contentDigest()));
        return leaves;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static byte[] utf8(String s) {
        return s == null ? new byte[0] : s.getBytes(StandardCharsets.UTF_8);
    }

    private static void putBytes(ByteBuffer b, byte[] a){
        b.putInt(a.length);
        b.put(a);
    }

    @Override public String toString() {
        return "Block{index=" + index + ", txs=" + transactionCount + ", producer=" + producer + "}";
    }
}
