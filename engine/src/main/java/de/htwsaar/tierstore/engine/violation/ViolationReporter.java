package de.htwsaar.tierstore.engine.violation;

import de.htwsaar.tierstore.engine.policy.PolicyKind;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only Log erkannter Policy-Verstöße.
 *
 * <p>Offene Einträge werden über (Backend, Variante, Schwere) dedupliziert: ein erneuter
 * Bericht aktualisiert nur Beobachtungswert und Zeitpunkt. Jede Änderung wird in den
 * {@link ViolationStore} geschrieben.</p>
 */
public class ViolationReporter {

    private static final Logger log = LoggerFactory.getLogger(ViolationReporter.class);

    private final Clock clock;
    private final ViolationStore store;
    private final Map<Long, Violation> byId = new LinkedHashMap<>();
    private long nextId = 1;

    public ViolationReporter(Clock clock, ViolationStore store) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    /**
     * Lädt das persistierte Log, z. B. beim Start.
     */
    public synchronized void load(List<Violation> persisted) {
        for (Violation v : persisted) {
            byId.put(v.id(), v);
            nextId = Math.max(nextId, v.id() + 1);
        }
    }

    /**
     * Meldet einen Verstoß.
     *
     * @param violation Verstoß (ID und Zeitpunkt werden hier vergeben)
     * @return gespeicherter Eintrag
     */
    public Violation report(Violation violation) {
        Objects.requireNonNull(violation, "violation must not be null");
        Instant now = clock.instant();
        Violation saved;
        boolean fresh;
        synchronized (this) {
            Violation existing = findOpen(violation.backendId(), violation.policyKind(), violation.severity());
            fresh = existing == null;
            saved = fresh
                    ? violation.withId(nextId++, now)
                    : existing.withObservation(now, violation.currentValue(), violation.limitValue(), violation.message());
            byId.put(saved.id(), saved);
            store.save(saved);
        }
        if (fresh) {
            log.warn("Violation #{} {} {} on {}: {}", saved.id(), saved.severity(), saved.policyKind(),
                    saved.backendId(), saved.message());
        } else {
            log.debug("Violation #{} updated: current={}", saved.id(), saved.currentValue());
        }
        return saved;
    }

    /**
     * Löst alle offenen Verstöße einer Variante auf einem Backend auf.
     *
     * @return Anzahl aufgelöster Einträge
     */
    public int resolve(String backendId, PolicyKind kind) {
        Instant now = clock.instant();
        int count = 0;
        synchronized (this) {
            for (Violation v : byId.values()) {
                if (!v.resolved() && v.backendId().equals(backendId) && v.policyKind() == kind) {
                    Violation done = v.resolvedAt(now);
                    byId.put(done.id(), done);
                    store.save(done);
                    count++;
                }
            }
        }
        if (count > 0) {
            log.info("Resolved {} {} violation(s) on {}", count, kind, backendId);
        }
        return count;
    }

    /**
     * @return gefilterte Einträge, aufsteigend nach Erkennungszeitpunkt
     */
    public synchronized List<Violation> list(ViolationFilter filter) {
        ViolationFilter f = filter == null ? ViolationFilter.all() : filter;
        List<Violation> out = new ArrayList<>();
        for (Violation v : byId.values()) {
            if (f.matches(v)) {
                out.add(v);
            }
        }
        out.sort(Comparator.comparing(Violation::detectedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
                .thenComparingLong(Violation::id));
        return out;
    }

    /**
     * @return Anzahl offener Einträge
     */
    public synchronized long openCount() {
        return byId.values().stream().filter(v -> !v.resolved()).count();
    }

    private Violation findOpen(String backendId, PolicyKind kind, Severity severity) {
        for (Violation v : byId.values()) {
            if (!v.resolved() && v.backendId().equals(backendId) && v.policyKind() == kind && v.severity() == severity) {
                return v;
            }
        }
        return null;
    }
}
