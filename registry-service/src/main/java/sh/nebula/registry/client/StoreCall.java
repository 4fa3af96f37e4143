package sh.nebula.registry.client;

import sh.nebula.registry.store.RegistrationStore;

/**
 * A blocking operation against the local store.
 */
@FunctionalInterface
public interface StoreCall<T> {

    T apply(RegistrationStore store);
}
