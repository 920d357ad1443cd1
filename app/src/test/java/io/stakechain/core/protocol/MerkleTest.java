package io.stakechain.core.protocol;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MerkleTest {

    private static List<byte[]> leaves(int n) {
        List<byte[]> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            out.add(Hashes.sha256(("leaf-" + i).getBytes(StandardCharsets.UTF_8)));
        }
        return out;
    }

    @Test
    void singleLeafIsItsOwnRoot() {
        List<byte[]> one = leaves(1);
        assertArrayEquals(one.get(0), Merkle.rootOf(one));
    }

    @Test
    void everyLeafProvesAgainstRootIncludingOddCounts() {
        for (int n = 1; n <= 7; n++) {
            List<byte[]> l = leaves(n);
            byte[] root = Merkle.rootOf(l);
            for (int i = 0; i < n; i++) {
                assertTrue(Merkle.verify(root, l.get(i), Merkle.proofFor(l, i)), "n=" + n + " i=" + i);
            }
        }
    }

    @Test
    void proofDoesNotVerifyForOtherLeaf() {
        List<byte[]> l = leaves(4);
        byte[] root = Merkle.rootOf(l);
        assertFalse(Merkle.verify(root, l.get(1), Merkle.proofFor(l, 0)));
        assertThrows(IndexOutOfBoundsException.class, () -> Merkle.proofFor(l, 4));
    }
}
