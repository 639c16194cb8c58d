package de.htwsaar.tierstore.engine.adapter;

import de.htwsaar.tierstore.engine.domain.Backend;
import de.htwsaar.tierstore.engine.domain.BackendAdapter;
import de.htwsaar.tierstore.engine.domain.UnknownBackendException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Zuordnung Backend-ID → (Backend, Adapter). Einträge werden bei der Konfiguration
 * registriert und danach nur gelesen.
 */
public class BackendRegistry {

    private final Map<String, Registered> backends = new ConcurrentHashMap<>();
    private final List<String> order = new ArrayList<>();

    /**
     * Registriert ein Backend.
     *
     * @throws IllegalArgumentException wenn die ID bereits vergeben ist
     */
    public synchronized void register(Backend backend, BackendAdapter adapter) {
        Objects.requireNonNull(backend, "backend must not be null");
        Objects.requireNonNull(adapter, "adapter must not be null");
        if (backends.putIfAbsent(backend.id(), new Registered(backend, adapter)) != null) {
            throw new IllegalArgumentException("backend already registered: " + backend.id());
        }
        order.add(backend.id());
    }

    /**
     * @throws UnknownBackendException wenn die ID unbekannt ist
     */
    public Backend backend(String backendId) {
        return lookup(backendId).backend();
    }

    /**
     * @throws UnknownBackendException wenn die ID unbekannt ist
     */
    public BackendAdapter adapter(String backendId) {
        return lookup(backendId).adapter();
    }

    public boolean contains(String backendId) {
        return backendId != null && backends.containsKey(backendId);
    }

    /**
     * @return IDs in Registrierungsreihenfolge
     */
    public synchronized List<String> ids() {
        return List.copyOf(order);
    }

    /**
     * @return alle Backends in Registrierungsreihenfolge
     */
    public List<Backend> all() {
        return ids().stream().map(this::backend).toList();
    }

    private Registered lookup(String backendId) {
        Registered r = backendId == null ? null : backends.get(backendId);
        if (r == null) {
            throw new UnknownBackendException(backendId);
        }
        return r;
    }

    private record Registered(Backend backend, BackendAdapter adapter) {}
}
