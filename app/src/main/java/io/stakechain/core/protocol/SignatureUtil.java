package io.stakechain.core.protocol;

import java.nio.charset.StandardCharsets;
import java.security.*;

/**
 * Ed25519 signatures over hex digests. Signatures travel as lowercase hex.
 */
public final class SignatureUtil {
    public static final String ALGORITHM = "Ed25519";

    private SignatureUtil() {}

    public static KeyPair generateKeyPair() {
        try {
            return KeyPairGenerator.getInstance(ALGORITHM).generateKeyPair();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }

    public static byte[] sign(byte[] data, PrivateKey priv) {
        try {
            Signature sig = Signature.getInstance(ALGORITHM);
            sig.initSign(priv);
            sig.update(data);
            return sig.sign();
        } catch (Exception e) {
            throw new RuntimeException("Signing failed", e);
        }
    }

    public static boolean verify(byte[] data, byte[] signature, PublicKey pub) {
        try {
            Signature sig = Signature.getInstance(ALGORITHM);
            sig.initVerify(pub);
            sig.update(data);
            return sig.verify(signature);
        } catch (Exception e) {
            return false;
        }
    }

    /** Sign the UTF-8 bytes of a hex digest and return the signature as hex. */
    public static String signDigest(String digestHex, PrivateKey priv) {
        return Hashes.toHex(sign(digestHex.getBytes(StandardCharsets.UTF_8), priv));
    }

    public static boolean verifyDigest(String digestHex, String signatureHex, PublicKey pub) {
        if (pub == null || signatureHex == null || signatureHex.isEmpty()) {
            return false;
        }
        byte[] signature;
        try {
            signature = Hashes.fromHex(signatureHex);
        } catch (IllegalArgumentException e) {
            return false;
        }
        return verify(digestHex.getBytes(StandardCharsets.UTF_8), signature, pub);
    }
}
