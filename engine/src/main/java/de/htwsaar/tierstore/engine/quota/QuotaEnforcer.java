package de.htwsaar.tierstore.engine.quota;

import de.htwsaar.tierstore.engine.domain.QuotaExceededException;
import de.htwsaar.tierstore.engine.policy.PolicyKind;
import de.htwsaar.tierstore.engine.policy.PolicyStore;
import de.htwsaar.tierstore.engine.policy.StorageQuotaPolicy;
import de.htwsaar.tierstore.engine.policy.TrafficQuotaPolicy;
import de.htwsaar.tierstore.engine.quota.QuotaDecision.Outcome;
import de.htwsaar.tierstore.engine.usage.Reservation;
import de.htwsaar.tierstore.engine.usage.ResourceTracker;
import de.htwsaar.tierstore.engine.usage.UsageDelta;
import de.htwsaar.tierstore.engine.usage.UsageLimits;
import de.htwsaar.tierstore.engine.usage.UsageRecord;
import de.htwsaar.tierstore.engine.violation.Severity;
import de.htwsaar.tierstore.engine.violation.Violation;
import de.htwsaar.tierstore.engine.violation.ViolationReporter;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entscheidet allow / warn / reject aus Policy und Nutzungs-Snapshot.
 *
 * <p>Projizierte Nutzung = belegt + reserviert + delta. Speicher warnt ab
 * {@code warnThreshold}, Traffic ab {@link #TRAFFIC_WARN_RATIO}. Reduzierende Änderungen
 * werden nie abgelehnt.</p>
 */
public class QuotaEnforcer {

    private static final Logger log = LoggerFactory.getLogger(QuotaEnforcer.class);

    /** Warnschwelle für Traffic-Quotas (Anteil des Fensterlimits). */
    public static final double TRAFFIC_WARN_RATIO = 0.9;

    private final PolicyStore policies;
    private final ResourceTracker tracker;
    private final ViolationReporter violations;

    public QuotaEnforcer(PolicyStore policies, ResourceTracker tracker, ViolationReporter violations) {
        this.policies = Objects.requireNonNull(policies, "policies must not be null");
        this.tracker = Objects.requireNonNull(tracker, "tracker must not be null");
        this.violations = Objects.requireNonNull(violations, "violations must not be null");
    }

    /**
     * Reine Bewertung ohne Seiteneffekte; z. B. für die Zielauswahl der Replikation.
     */
    public QuotaDecision evaluate(String backendId, UsageDelta delta) {
        UsageRecord usage = tracker.snapshot(backendId);
        QuotaDecision result = QuotaDecision.unrestricted();
        Optional<QuotaDecision> storage = evaluateStorage(backendId, usage, delta);
        Optional<QuotaDecision> traffic = evaluateTraffic(backendId, usage, delta);
        if (storage.isPresent()) {
            result = storage.get();
        }
        if (traffic.isPresent()) {
            result = storage.isPresent() ? QuotaDecision.worse(result, traffic.get()) : traffic.get();
        }
        return result;
    }

    /**
     * Prüft eine geplante Operation. WARN erzeugt einen Warn-Verstoß, ALLOW löst offene
     * Verstöße der jeweiligen Variante auf.
     */
    public QuotaDecision check(String backendId, UsageDelta delta) {
        UsageRecord usage = tracker.snapshot(backendId);
        QuotaDecision result = QuotaDecision.unrestricted();
        boolean any = false;
        for (Optional<QuotaDecision> d :
                List.of(evaluateStorage(backendId, usage, delta), evaluateTraffic(backendId, usage, delta))) {
            if (d.isEmpty()) {
                continue;
            }
            QuotaDecision decision = d.get();
            publish(backendId, decision);
            result = any ? QuotaDecision.worse(result, decision) : decision;
            any = true;
        }
        return result;
    }

    /**
     * Wie {@link #check}, wirft aber bei REJECT und meldet einen kritischen Verstoß.
     *
     * @throws QuotaExceededException bei REJECT
     */
    public QuotaDecision enforce(String backendId, UsageDelta delta) {
        QuotaDecision decision = check(backendId, delta);
        if (decision.rejected()) {
            throw reject(backendId, decision);
        }
        return decision;
    }

    /**
     * Verbindlicher Pfad: prüft und reserviert atomar im {@link ResourceTracker}.
     *
     * @return Reservierung, die nach der Adapter-Operation übernommen oder verworfen wird
     * @throws QuotaExceededException wenn eine Grenze überschritten würde
     */
    public Reservation reserve(String backendId, UsageDelta delta) {
        enforce(backendId, delta);
        try {
            return tracker.reserve(backendId, delta, limitsFor(backendId));
        } catch (QuotaExceededException e) {
            // Zwischen Prüfung und Reservierung hat ein paralleler Aufruf die Grenze erreicht.
            PolicyKind kind = e.isTraffic() ? PolicyKind.TRAFFIC_QUOTA : PolicyKind.STORAGE_QUOTA;
            violations.report(Violation.open(backendId, kind, Severity.CRITICAL, e.getProjected(), e.getLimit(),
                    e.getMessage()));
            throw e;
        }
    }

    /**
     * @return harte Grenzen aus den aktiven Quota-Policies
     */
    public UsageLimits limitsFor(String backendId) {
        Optional<StorageQuotaPolicy> storage = policies.storageQuota(backendId);
        Optional<TrafficQuotaPolicy> traffic = policies.trafficQuota(backendId);
        return new UsageLimits(
                storage.map(StorageQuotaPolicy::maxBytes).orElse(0L),
                storage.map(StorageQuotaPolicy::maxFiles).orElse(0L),
                traffic.map(TrafficQuotaPolicy::maxBytesPerWindow).orElse(0L),
                traffic.map(TrafficQuotaPolicy::maxRequestsPerWindow).orElse(0L));
    }

    private Optional<QuotaDecision> evaluateStorage(String backendId, UsageRecord usage, UsageDelta delta) {
        Optional<StorageQuotaPolicy> maybe = policies.storageQuota(backendId);
        if (maybe.isEmpty()) {
            return Optional.empty();
        }
        StorageQuotaPolicy p = maybe.get();
        long bytes = usage.projectedBytes() + delta.bytes();
        long files = usage.projectedFiles() + delta.files();

        if (delta.bytes() > 0 && bytes > p.maxBytes()) {
            return Optional.of(new QuotaDecision(Outcome.REJECT, PolicyKind.STORAGE_QUOTA, "bytes", bytes,
                    p.maxBytes(), "storage would exceed " + p.maxBytes() + " bytes"));
        }
        if (p.limitsFiles() && delta.files() > 0 && files > p.maxFiles()) {
            return Optional.of(new QuotaDecision(Outcome.REJECT, PolicyKind.STORAGE_QUOTA, "files", files,
                    p.maxFiles(), "file count would exceed " + p.maxFiles()));
        }
        if ((double) bytes / p.maxBytes() >= p.warnThreshold()) {
            return Optional.of(new QuotaDecision(Outcome.WARN, PolicyKind.STORAGE_QUOTA, "bytes", bytes,
                    p.maxBytes(), "storage above warn threshold " + p.warnThreshold()));
        }
        if (p.limitsFiles() && (double) files / p.maxFiles() >= p.warnThreshold()) {
            return Optional.of(new QuotaDecision(Outcome.WARN, PolicyKind.STORAGE_QUOTA, "files", files,
                    p.maxFiles(), "file count above warn threshold " + p.warnThreshold()));
        }
        return Optional.of(new QuotaDecision(Outcome.ALLOW, PolicyKind.STORAGE_QUOTA, "bytes", bytes,
                p.maxBytes(), "within storage quota"));
    }

    private Optional<QuotaDecision> evaluateTraffic(String backendId, UsageRecord usage, UsageDelta delta) {
        Optional<TrafficQuotaPolicy> maybe = policies.trafficQuota(backendId);
        if (maybe.isEmpty()) {
            return Optional.empty();
        }
        TrafficQuotaPolicy p = maybe.get();
        long bytes = usage.projectedTransferBytes() + delta.transferBytes();
        long requests = usage.projectedRequests() + delta.requests();

        if (p.maxBytesPerWindow() > 0 && delta.transferBytes() > 0 && bytes > p.maxBytesPerWindow()) {
            return Optional.of(new QuotaDecision(Outcome.REJECT, PolicyKind.TRAFFIC_QUOTA, "transferBytes", bytes,
                    p.maxBytesPerWindow(), "transfer would exceed " + p.maxBytesPerWindow() + " bytes per window"));
        }
        if (p.maxRequestsPerWindow() > 0 && delta.requests() > 0 && requests > p.maxRequestsPerWindow()) {
            return Optional.of(new QuotaDecision(Outcome.REJECT, PolicyKind.TRAFFIC_QUOTA, "requests", requests,
                    p.maxRequestsPerWindow(), "requests would exceed " + p.maxRequestsPerWindow() + " per window"));
        }
        if (p.maxBytesPerWindow() > 0 && (double) bytes / p.maxBytesPerWindow() >= TRAFFIC_WARN_RATIO) {
            return Optional.of(new QuotaDecision(Outcome.WARN, PolicyKind.TRAFFIC_QUOTA, "transferBytes", bytes,
                    p.maxBytesPerWindow(), "transfer above warn ratio"));
        }
        if (p.maxRequestsPerWindow() > 0 && (double) requests / p.maxRequestsPerWindow() >= TRAFFIC_WARN_RATIO) {
            return Optional.of(new QuotaDecision(Outcome.WARN, PolicyKind.TRAFFIC_QUOTA, "requests", requests,
                    p.maxRequestsPerWindow(), "requests above warn ratio"));
        }
        return Optional.of(new QuotaDecision(Outcome.ALLOW, PolicyKind.TRAFFIC_QUOTA, "requests", requests,
                p.maxRequestsPerWindow(), "within traffic quota"));
    }

    private void publish(String backendId, QuotaDecision decision) {
        switch (decision.outcome()) {
            case WARN -> violations.report(Violation.open(backendId, decision.kind(), Severity.WARN,
                    decision.current(), decision.limit(), decision.reason()));
            case ALLOW -> violations.resolve(backendId, decision.kind());
            case REJECT -> log.debug("Quota check rejected on {}: {}", backendId, decision.reason());
        }
    }

    private QuotaExceededException reject(String backendId, QuotaDecision decision) {
        violations.report(Violation.open(backendId, decision.kind(), Severity.CRITICAL, decision.current(),
                decision.limit(), decision.reason()));
        log.info("Quota rejected on {}: {}", backendId, decision.reason());
        return decision.kind() == PolicyKind.TRAFFIC_QUOTA
                ? QuotaExceededException.traffic(backendId, decision.dimension(), decision.current(), decision.limit())
                : QuotaExceededException.storage(backendId, decision.dimension(), decision.current(), decision.limit());
    }
}
