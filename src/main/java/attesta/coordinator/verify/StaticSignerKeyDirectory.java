package attesta.coordinator.verify;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Key directory backed by keys loaded from configuration or registered at runtime.
 */
public final class StaticSignerKeyDirectory implements SignerKeyDirectory {

    private final Map<String, SignerKey> keys = new ConcurrentHashMap<>();

    public StaticSignerKeyDirectory register(SignerKey key) {
        keys.put(key.identity(), key);
        return this;
    }

    @Override
    public Optional<SignerKey> find(String signerIdentity) {
        if (signerIdentity == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(keys.get(signerIdentity));
    }

    public int size() {
        return keys.size();
    }
}
