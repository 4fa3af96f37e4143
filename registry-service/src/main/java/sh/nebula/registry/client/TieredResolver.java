package sh.nebula.registry.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.nebula.api.discovery.RegistryBackend;
import sh.nebula.registry.store.RegistrationStore;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Runs an operation against the local store first and the remote registry second.
 * Nothing thrown by either tier escapes; failures become the policy's empty value.
 */
public final class TieredResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(TieredResolver.class);

    private final RegistrationStore store;

    /**
     * @param store local store, or null when none is configured
     */
    public TieredResolver(RegistrationStore store) {
        this.store = store;
    }

    public Optional<RegistrationStore> store() {
        return Optional.ofNullable(store);
    }

    public boolean hasLocalStore() {
        return store != null;
    }

    public <T> Resolution<T> resolve(String operation,
                                     StoreCall<T> localCall,
                                     Supplier<T> remoteCall,
                                     FallbackPolicy<T> policy) {
        if (store != null) {
            try {
                T value = localCall.apply(store);
                if (policy.acceptsLocal(value)) {
                    return new Resolution<>(value, RegistryBackend.LOCAL);
                }
                LOGGER.debug("{}: nothing found locally, asking remote registry", operation);
            } catch (RuntimeException ex) {
                LOGGER.warn("{}: local store failed, falling back to remote registry", operation, ex);
            }
        } else {
            LOGGER.debug("{}: no local store, using remote registry", operation);
        }

        if (remoteCall == null) {
            return Resolution.none(policy.empty());
        }
        try {
            T value = remoteCall.get();
            if (policy.isEmptyValue(value)) {
                return Resolution.none(value == null ? policy.empty() : value);
            }
            return new Resolution<>(value, RegistryBackend.REMOTE);
        } catch (RuntimeException ex) {
            LOGGER.warn("{}: remote registry failed", operation, ex);
            return Resolution.none(policy.empty());
        }
    }

    /**
     * Operations with no remote equivalent. Without a store the result is {@code empty}.
     */
    public <T> Resolution<T> localOnly(String operation, StoreCall<T> localCall, T empty) {
        if (store == null) {
            LOGGER.debug("{}: no local store configured", operation);
            return Resolution.none(empty);
        }
        try {
            T value = localCall.apply(store);
            return new Resolution<>(value == null ? empty : value, RegistryBackend.LOCAL);
        } catch (RuntimeException ex) {
            LOGGER.warn("{}: local store failed", operation, ex);
            return Resolution.none(empty);
        }
    }
}
