package de.htwsaar.tierstore.engine.usage;

import de.htwsaar.tierstore.engine.domain.QuotaExceededException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Einzige schreibende Stelle für Nutzungszähler.
 *
 * <p>Pro Backend gibt es genau ein Zählerobjekt mit eigenem Lock; Backends sind voneinander
 * unabhängig. Traffic-Fenster sind feste Fenster mit verzögertem Reset: Ist beim nächsten
 * Zugriff {@code now - lastResetTime >= window}, werden Transfer- und Request-Zähler genullt.</p>
 */
public class ResourceTracker {

    /** Fensterlänge für Backends ohne Traffic-Quota. */
    public static final Duration DEFAULT_WINDOW = Duration.ofMinutes(1);

    private final Clock clock;
    private final Function<String, Duration> windowResolver;
    private final Map<String, BackendUsage> usage = new ConcurrentHashMap<>();
    private final AtomicLong reservationIds = new AtomicLong();

    /**
     * @param clock          Zeitquelle
     * @param windowResolver Fensterlänge je Backend; {@code null}-Ergebnis = {@link #DEFAULT_WINDOW}
     */
    public ResourceTracker(Clock clock, Function<String, Duration> windowResolver) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.windowResolver = Objects.requireNonNull(windowResolver, "windowResolver must not be null");
    }

    /**
     * Wendet eine Änderung direkt an (ohne Grenzprüfung).
     */
    public void record(String backendId, UsageDelta delta) {
        Objects.requireNonNull(delta, "delta must not be null");
        usageOf(backendId).apply(delta, now(), window(backendId));
    }

    /**
     * Variante mit Einzelwerten: Bei Transfers zählt {@code deltaBytes} ins Traffic-Fenster
     * und der Request-Zähler steigt um eins, sonst ändert sich der Speicherstand.
     */
    public void record(String backendId, long deltaBytes, long deltaFiles, boolean isTransfer) {
        record(backendId, isTransfer
                ? new UsageDelta(0, deltaFiles, deltaBytes, 1)
                : new UsageDelta(deltaBytes, deltaFiles, 0, 0));
    }

    /**
     * @return konsistente Kopie; unbekannte Backends liefern Nullwerte
     */
    public UsageRecord snapshot(String backendId) {
        return usageOf(backendId).snapshot(backendId, now(), window(backendId));
    }

    /**
     * @return Kopien aller bekannten Backends
     */
    public List<UsageRecord> snapshots() {
        return usage.keySet().stream().sorted().map(this::snapshot).collect(Collectors.toList());
    }

    /**
     * Prüft die projizierte Nutzung (belegt + reserviert + delta) atomar gegen die Grenzen und
     * reserviert bei Erfolg.
     *
     * @throws QuotaExceededException wenn eine Grenze überschritten würde
     */
    public Reservation reserve(String backendId, UsageDelta delta, UsageLimits limits) {
        Objects.requireNonNull(delta, "delta must not be null");
        Objects.requireNonNull(limits, "limits must not be null");
        Reservation r = new Reservation(reservationIds.incrementAndGet(), backendId, delta);
        usageOf(backendId).reserve(r, limits, now(), window(backendId));
        return r;
    }

    /**
     * Übernimmt eine Reservierung in die Nutzung. Mehrfache Aufrufe wirken einmal.
     *
     * @return {@code true} beim ersten wirksamen Aufruf
     */
    public boolean commit(Reservation reservation) {
        Objects.requireNonNull(reservation, "reservation must not be null");
        String backendId = reservation.backendId();
        return usageOf(backendId).commit(reservation.id(), now(), window(backendId));
    }

    /**
     * Verwirft eine Reservierung. Mehrfache Aufrufe wirken einmal.
     *
     * @return {@code true} beim ersten wirksamen Aufruf
     */
    public boolean release(Reservation reservation) {
        Objects.requireNonNull(reservation, "reservation must not be null");
        return usageOf(reservation.backendId()).release(reservation.id());
    }

    /**
     * Setzt Speicherzähler aus persistiertem oder neu aufgebautem Stand.
     */
    public void restore(String backendId, long bytesUsed, long fileCount) {
        usageOf(backendId).restore(bytesUsed, fileCount);
    }

    private BackendUsage usageOf(String backendId) {
        if (backendId == null || backendId.isBlank()) {
            throw new IllegalArgumentException("backendId must not be empty");
        }
        return usage.computeIfAbsent(backendId, id -> new BackendUsage(now()));
    }

    private Duration window(String backendId) {
        Duration d = windowResolver.apply(backendId);
        return d == null ? DEFAULT_WINDOW : d;
    }

    private Instant now() {
        return clock.instant();
    }

    /** Zähler eines Backends; alle Methoden unter dem Objekt-Lock. */
    private static final class BackendUsage {
        private long bytesUsed;
        private long fileCount;
        private long transferBytes;
        private long requests;
        private Instant lastReset;
        private long reservedBytes;
        private long reservedFiles;
        private long reservedTransfer;
        private long reservedRequests;
        private final Map<Long, UsageDelta> open = new HashMap<>();

        BackendUsage(Instant created) {
            this.lastReset = created;
        }

        synchronized void apply(UsageDelta d, Instant now, Duration window) {
            rollWindow(now, window);
            applyUnlocked(d);
        }

        synchronized UsageRecord snapshot(String backendId, Instant now, Duration window) {
            rollWindow(now, window);
            return new UsageRecord(backendId, bytesUsed, fileCount, transferBytes, requests, lastReset,
                    reservedBytes, reservedFiles, reservedTransfer, reservedRequests);
        }

        synchronized void reserve(Reservation r, UsageLimits limits, Instant now, Duration window) {
            rollWindow(now, window);
            UsageDelta d = r.delta();
            String id = r.backendId();
            if (limits.maxBytes() > 0 && d.bytes() > 0 && bytesUsed + reservedBytes + d.bytes() > limits.maxBytes()) {
                throw QuotaExceededException.storage(id, "bytes", bytesUsed + reservedBytes + d.bytes(), limits.maxBytes());
            }
            if (limits.maxFiles() > 0 && d.files() > 0 && fileCount + reservedFiles + d.files() > limits.maxFiles()) {
                throw QuotaExceededException.storage(id, "files", fileCount + reservedFiles + d.files(), limits.maxFiles());
            }
            if (limits.maxTransferBytes() > 0 && d.transferBytes() > 0
                    && transferBytes + reservedTransfer + d.transferBytes() > limits.maxTransferBytes()) {
                throw QuotaExceededException.traffic(id, "transferBytes",
                        transferBytes + reservedTransfer + d.transferBytes(), limits.maxTransferBytes());
            }
            if (limits.maxRequests() > 0 && d.requests() > 0
                    && requests + reservedRequests + d.requests() > limits.maxRequests()) {
                throw QuotaExceededException.traffic(id, "requests",
                        requests + reservedRequests + d.requests(), limits.maxRequests());
            }
            open.put(r.id(), d);
            reservedBytes += Math.max(0, d.bytes());
            reservedFiles += Math.max(0, d.files());
            reservedTransfer += Math.max(0, d.transferBytes());
            reservedRequests += Math.max(0, d.requests());
        }

        synchronized boolean commit(long reservationId, Instant now, Duration window) {
            UsageDelta d = open.remove(reservationId);
            if (d == null) {
                return false;
            }
            rollWindow(now, window);
            unreserve(d);
            applyUnlocked(d);
            return true;
        }

        synchronized boolean release(long reservationId) {
            UsageDelta d = open.remove(reservationId);
            if (d == null) {
                return false;
            }
            unreserve(d);
            return true;
        }

        synchronized void restore(long bytes, long files) {
            bytesUsed = Math.max(0, bytes);
            fileCount = Math.max(0, files);
        }

        private void unreserve(UsageDelta d) {
            reservedBytes -= Math.max(0, d.bytes());
            reservedFiles -= Math.max(0, d.files());
            reservedTransfer -= Math.max(0, d.transferBytes());
            reservedRequests -= Math.max(0, d.requests());
        }

        private void applyUnlocked(UsageDelta d) {
            bytesUsed = Math.max(0, bytesUsed + d.bytes());
            fileCount = Math.max(0, fileCount + d.files());
            transferBytes += Math.max(0, d.transferBytes());
            requests += Math.max(0, d.requests());
        }

        private void rollWindow(Instant now, Duration window) {
            if (Duration.between(lastReset, now).compareTo(window) >= 0) {
                transferBytes = 0;
                requests = 0;
                lastReset = now;
            }
        }
    }
}
