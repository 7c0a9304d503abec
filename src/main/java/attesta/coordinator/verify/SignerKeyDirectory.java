package attesta.coordinator.verify;

import java.util.Optional;

/**
 * Looks up the public key a signer identity claims.
 * Knowing a key does not make a signer trusted; trust is the policy's call.
 */
public interface SignerKeyDirectory {

    Optional<SignerKey> find(String signerIdentity);
}
