package sh.nebula.registry.peer;

import sh.nebula.api.discovery.RegisteredService;

@FunctionalInterface
public interface ServiceChangeListener {

    enum Change {
        ADDED,
        UPDATED,
        REMOVED
    }

    void onChange(RegisteredService service, Change change);
}
