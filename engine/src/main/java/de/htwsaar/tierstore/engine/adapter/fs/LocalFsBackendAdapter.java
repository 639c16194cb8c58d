package de.htwsaar.tierstore.engine.adapter.fs;

import de.htwsaar.tierstore.common.util.Sha256Util;
import de.htwsaar.tierstore.engine.domain.AdapterException;
import de.htwsaar.tierstore.engine.domain.BackendAdapter;
import de.htwsaar.tierstore.engine.domain.UnknownObjectException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Lokaler, inhaltsadressierter Datei-Store.
 *
 * <p>Objekte liegen unter {@code root/xx/<sha256(objectId)>}; die Objekt-ID selbst taucht
 * nie im Pfad auf, beliebige IDs sind damit dateisystemsicher. Schreiben erfolgt über eine
 * temporäre Datei mit atomarem Move.</p>
 */
public class LocalFsBackendAdapter implements BackendAdapter {

    private final String backendId;
    private final Path root;

    /**
     * @param backendId Backend-ID für Fehlermeldungen
     * @param root      Wurzelverzeichnis (wird bei Bedarf angelegt)
     */
    public LocalFsBackendAdapter(String backendId, Path root) {
        this.backendId = Objects.requireNonNull(backendId, "backendId must not be null");
        this.root = Objects.requireNonNull(root, "root must not be null");
    }

    @Override
    public long put(String objectId, byte[] content) {
        Path target = pathOf(objectId);
        try {
            Files.createDirectories(target.getParent());
            Path tmp = Files.createTempFile(target.getParent(), "upload-", ".tmp");
            Files.write(tmp, content);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            return content.length;
        } catch (IOException e) {
            throw new AdapterException(backendId, "put " + objectId + " failed", e);
        }
    }

    @Override
    public byte[] get(String objectId) {
        try {
            return Files.readAllBytes(pathOf(objectId));
        } catch (NoSuchFileException e) {
            throw new UnknownObjectException(objectId);
        } catch (IOException e) {
            throw new AdapterException(backendId, "get " + objectId + " failed", e);
        }
    }

    @Override
    public void delete(String objectId) {
        try {
            Files.deleteIfExists(pathOf(objectId));
        } catch (IOException e) {
            throw new AdapterException(backendId, "delete " + objectId + " failed", e);
        }
    }

    @Override
    public OptionalLong stat(String objectId) {
        Path p = pathOf(objectId);
        try {
            return Files.isRegularFile(p) ? OptionalLong.of(Files.size(p)) : OptionalLong.empty();
        } catch (IOException e) {
            throw new AdapterException(backendId, "stat " + objectId + " failed", e);
        }
    }

    private Path pathOf(String objectId) {
        String hash = Sha256Util.sha256Hex(objectId);
        return root.resolve(hash.substring(0, 2)).resolve(hash);
    }
}
