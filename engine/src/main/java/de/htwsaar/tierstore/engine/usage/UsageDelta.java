package de.htwsaar.tierstore.engine.usage;

/**
 * Änderung der Nutzung eines Backends durch eine Operation.
 *
 * @param bytes         Änderung belegter Bytes (negativ beim Löschen)
 * @param files         Änderung der Dateianzahl
 * @param transferBytes übertragene Bytes im Traffic-Fenster
 * @param requests      Requests im Traffic-Fenster
 */
public record UsageDelta(long bytes, long files, long transferBytes, long requests) {

    /** Upload eines neuen Objekts: belegt Speicher und zählt als Transfer. */
    public static UsageDelta store(long size) {
        return new UsageDelta(size, 1, size, 1);
    }

    /** Lesezugriff: nur Traffic. */
    public static UsageDelta read(long size) {
        return new UsageDelta(0, 0, size, 1);
    }

    /** Löschen: gibt Speicher frei, kein Traffic. */
    public static UsageDelta delete(long size) {
        return new UsageDelta(-size, -1, 0, 0);
    }

    public boolean growsStorage() {
        return bytes > 0 || files > 0;
    }

    public boolean hasTraffic() {
        return transferBytes > 0 || requests > 0;
    }
}
