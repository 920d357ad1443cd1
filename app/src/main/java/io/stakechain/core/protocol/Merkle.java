package io.stakechain.core.protocol;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Simple Merkle tree helper over byte[] leaves.
 * - If there are no leaves, root = SHA-256 of the empty string.
 * - If odd count at a level, duplicate the last (Bitcoin-style) for simplicity.
 */
public final class Merkle {
    private Merkle(){}

    /** One step of an inclusion proof: the sibling hash and which side it sits on. */
    public static final class ProofStep {
        private final byte[] sibling;
        private final boolean siblingOnLeft;

        public ProofStep(byte[] sibling, boolean siblingOnLeft) {
            this.sibling = sibling.clone();
            this.siblingOnLeft = siblingOnLeft;
        }

        public byte[] sibling() { return sibling.clone(); }
        public boolean siblingOnLeft() { return siblingOnLeft; }
    }

    public static byte[] rootOf(List<byte[]> leaves) {
        if (leaves == null || leaves.isEmpty()) return Hashes.sha256(new byte[0]);
        List<byte[]> level = new ArrayList<>(leaves);
        while (level.size() > 1) {
            level = nextLevel(level);
        }
        return level.get(0);
    }

    public static List<ProofStep> proofFor(List<byte[]> leaves, int index) {
        if (leaves == null || index < 0 || index >= leaves.size()) {
            throw new IndexOutOfBoundsException("No leaf at index " + index);
        }
        List<ProofStep> proof = new ArrayList<>();
        List<byte[]> level = new ArrayList<>(leaves);
        int idx = index;
        while (level.size() > 1) {
            boolean isRight = (idx & 1) == 1;
            int siblingIdx = isRight ? idx - 1 : Math.min(idx + 1, level.size() - 1);
            proof.add(new ProofStep(level.get(siblingIdx), isRight));
            level = nextLevel(level);
            idx /= 2;
        }
        return Collections.unmodifiableList(proof);
    }

    public static boolean verify(byte[] root, byte[] leaf, List<ProofStep> proof) {
        if (root == null || leaf == null || proof == null) return false;
        byte[] cursor = leaf;
        for (ProofStep step : proof) {
            cursor = step.siblingOnLeft()
                    ? Hashes.sha256(concat(step.sibling, cursor))
                    : Hashes.sha256(concat(cursor, step.sibling));
        }
        return Arrays.equals(cursor, root);
    }

    private static List<byte[]> nextLevel(List<byte[]> level) {
        List<byte[]> next = new ArrayList<>((level.size()+1)/2);
        for (int i=0; i<level.size(); i+=2) {
            byte[] left = level.get(i);
            byte[] right = (i+1 < level.size()) ? level.get(i+1) : left;
            next.add(Hashes.sha256(concat(left, right)));
        }
        return next;
    }

    private static byte[] concat(byte[] a, byte[] b) {
        byte[] out = new byte[a.length + b.length];
        System.arraycopy(a, 0, out, 0, a.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }
}
