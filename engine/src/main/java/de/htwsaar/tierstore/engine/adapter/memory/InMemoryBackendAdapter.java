package de.htwsaar.tierstore.engine.adapter.memory;

import de.htwsaar.tierstore.engine.domain.BackendAdapter;
import de.htwsaar.tierstore.engine.domain.UnknownObjectException;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Flüchtiges Backend im Speicher der laufenden Instanz.
 * Für lokale Entwicklung, Demo-Betrieb und Tests ausreichend.
 */
public class InMemoryBackendAdapter implements BackendAdapter {

    private final Map<String, byte[]> objects = new ConcurrentHashMap<>();

    @Override
    public long put(String objectId, byte[] content) {
        objects.put(objectId, content.clone());
        return content.length;
    }

    @Override
    public byte[] get(String objectId) {
        byte[] body = objects.get(objectId);
        if (body == null) {
            throw new UnknownObjectException(objectId);
        }
        return body.clone();
    }

    @Override
    public void delete(String objectId) {
        objects.remove(objectId);
    }

    @Override
    public OptionalLong stat(String objectId) {
        byte[] body = objects.get(objectId);
        return body == null ? OptionalLong.empty() : OptionalLong.of(body.length);
    }

    /** @return Anzahl gespeicherter Objekte */
    public int size() {
        return objects.size();
    }
}
