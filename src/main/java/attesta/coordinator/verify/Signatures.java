package attesta.coordinator.verify;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.Locale;

/**
 * JCA helpers for attestation signatures. Signatures travel as Base64 strings.
 */
public final class Signatures {

    private Signatures() {
    }

    /**
     * Signature algorithm paired with a key algorithm name.
     */
    public static String defaultAlgorithmFor(String keyAlgorithm) {
        String alg = keyAlgorithm == null ? "" : keyAlgorithm.toUpperCase(Locale.ROOT);
        return switch (alg) {
            case "ED25519", "EDDSA" -> "Ed25519";
            case "EC" -> "SHA256withECDSA";
            case "RSA" -> "SHA256withRSA";
            default -> throw new IllegalArgumentException("Unsupported key algorithm: " + keyAlgorithm);
        };
    }

    public static String sign(PrivateKey key, byte[] payload) throws GeneralSecurityException {
        Signature signer = Signature.getInstance(defaultAlgorithmFor(key.getAlgorithm()));
        signer.initSign(key);
        signer.update(payload);
        return Base64.getEncoder().encodeToString(signer.sign());
    }

    /**
     * @return true only when {@code signatureB64} is a well-formed signature over
     *         {@code payload} by {@code key}
     */
    public static boolean verify(SignerKey key, byte[] payload, String signatureB64) {
        if (signatureB64 == null || signatureB64.isBlank()) {
            return false;
        }
        try {
            byte[] sig = Base64.getDecoder().decode(signatureB64);
            Signature verifier = Signature.getInstance(key.signatureAlgorithm());
            verifier.initVerify(key.publicKey());
            verifier.update(payload);
            return verifier.verify(sig);
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            return false;
        }
    }

    /**
     * Decode a Base64 X.509 (SubjectPublicKeyInfo) public key.
     */
    public static PublicKey decodePublicKey(String keyAlgorithm, String base64) throws GeneralSecurityException {
        byte[] der = Base64.getDecoder().decode(base64.trim());
        return KeyFactory.getInstance(keyAlgorithm).generatePublic(new X509EncodedKeySpec(der));
    }

    public static String encodePublicKey(PublicKey key) {
        return Base64.getEncoder().encodeToString(key.getEncoded());
    }
}
