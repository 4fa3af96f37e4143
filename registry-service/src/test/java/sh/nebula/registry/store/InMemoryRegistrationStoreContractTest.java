package sh.nebula.registry.store;

import org.junit.jupiter.api.BeforeEach;

class InMemoryRegistrationStoreContractTest extends RegistrationStoreContract {

    private InMemoryRegistrationStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryRegistrationStore();
    }

    @Override
    protected RegistrationStore store() {
        return store;
    }
}
