package attesta.coordinator.verify;

import java.security.PublicKey;
import java.util.Objects;

/**
 * Public key of a TEE signer, with the JCA signature algorithm used to check it.
 */
public record SignerKey(String identity, String signatureAlgorithm, PublicKey publicKey) {

    public SignerKey {
        Objects.requireNonNull(identity, "identity is required");
        Objects.requireNonNull(signatureAlgorithm, "signatureAlgorithm is required");
        Objects.requireNonNull(publicKey, "publicKey is required");
    }

    public static SignerKey of(String identity, PublicKey publicKey) {
        return new SignerKey(identity, Signatures.defaultAlgorithmFor(publicKey.getAlgorithm()), publicKey);
    }
}
