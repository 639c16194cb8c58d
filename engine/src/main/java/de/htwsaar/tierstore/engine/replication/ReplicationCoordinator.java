package de.htwsaar.tierstore.engine.replication;

import de.htwsaar.tierstore.engine.adapter.AdapterInvoker;
import de.htwsaar.tierstore.engine.adapter.BackendRegistry;
import de.htwsaar.tierstore.engine.adapter.Deadline;
import de.htwsaar.tierstore.engine.domain.AdapterException;
import de.htwsaar.tierstore.engine.domain.AdapterTimeoutException;
import de.htwsaar.tierstore.engine.domain.Backend;
import de.htwsaar.tierstore.engine.domain.BackendAdapter;
import de.htwsaar.tierstore.engine.domain.QuotaExceededException;
import de.htwsaar.tierstore.engine.domain.TierStoreException;
import de.htwsaar.tierstore.engine.domain.UnknownObjectException;
import de.htwsaar.tierstore.engine.policy.PolicyKind;
import de.htwsaar.tierstore.engine.policy.PolicyStore;
import de.htwsaar.tierstore.engine.policy.ReplicationPolicy;
import de.htwsaar.tierstore.engine.policy.ReplicationStrategy;
import de.htwsaar.tierstore.engine.quota.QuotaDecision;
import de.htwsaar.tierstore.engine.quota.QuotaEnforcer;
import de.htwsaar.tierstore.engine.usage.Reservation;
import de.htwsaar.tierstore.engine.usage.ResourceTracker;
import de.htwsaar.tierstore.engine.usage.UsageDelta;
import de.htwsaar.tierstore.engine.violation.Severity;
import de.htwsaar.tierstore.engine.violation.Violation;
import de.htwsaar.tierstore.engine.violation.ViolationReporter;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hält die Anzahl verifizierter Kopien eines Objekts innerhalb der Replikations-Policy.
 *
 * <p>Ablauf je Ziel: reserve → put → stat (gleiche Größe) → commit. Kopien auf verschiedene
 * Ziele laufen parallel auf dem {@code copyExecutor}; jeder Adapter-Aufruf ist durch die
 * Restzeit des Aufrufers begrenzt. Gleichzeitige {@link #ensure}/{@link #repair}-Aufrufe
 * für dasselbe Objekt werden auf das laufende Ergebnis zusammengelegt; {@link #remove} und
 * {@link #invalidate} warten laufende Aufrufe ab und laufen exklusiv.</p>
 *
 * <p>Nutzung wird genau für VERIFIED-Kopien gezählt. Das Backend of Record zählt als Kopie,
 * wenn es selbst unter den Kandidaten steht.</p>
 */
public class ReplicationCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ReplicationCoordinator.class);

    /** Zusätzliche Wartezeit auf Kopier-Tasks, die ihre Deadline selbst einhalten. */
    private static final long AWAIT_GRACE_MS = 100;

    private final BackendRegistry registry;
    private final PolicyStore policies;
    private final QuotaEnforcer quota;
    private final ResourceTracker tracker;
    private final ViolationReporter violations;
    private final AdapterInvoker invoker;
    private final RetryPolicy retry;
    private final ExecutorService copyExecutor;
    private final Clock clock;

    private final Map<String, ReplicaSet> sets = new ConcurrentHashMap<>();
    private final Map<String, Flight> inFlight = new ConcurrentHashMap<>();

    public ReplicationCoordinator(
            BackendRegistry registry,
            PolicyStore policies,
            QuotaEnforcer quota,
            ResourceTracker tracker,
            ViolationReporter violations,
            AdapterInvoker invoker,
            RetryPolicy retry,
            ExecutorService copyExecutor,
            Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.policies = Objects.requireNonNull(policies, "policies must not be null");
        this.quota = Objects.requireNonNull(quota, "quota must not be null");
        this.tracker = Objects.requireNonNull(tracker, "tracker must not be null");
        this.violations = Objects.requireNonNull(violations, "violations must not be null");
        this.invoker = Objects.requireNonNull(invoker, "invoker must not be null");
        this.retry = Objects.requireNonNull(retry, "retry must not be null");
        this.copyExecutor = Objects.requireNonNull(copyExecutor, "copyExecutor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Stellt die Mindestredundanz für ein Objekt her.
     *
     * @param objectId     Objekt-ID
     * @param content      Inhalt
     * @param ownerBackend Backend of Record
     * @param policy       Replikations-Policy
     * @param timeout      Zeitschranke für die gesamte Operation
     * @return resultierender ReplicaSet
     * @throws InsufficientRedundancyException wenn bei der ersten Auswahl weniger geeignete
     *                                         Ziele als {@code minRedundancy} existieren
     */
    public ReplicaSet ensure(
            String objectId, byte[] content, String ownerBackend, ReplicationPolicy policy, Duration timeout) {
        Objects.requireNonNull(objectId, "objectId must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(ownerBackend, "ownerBackend must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
        Deadline deadline = Deadline.in(timeout);

        return coalesced(objectId, deadline, () -> {
            ReplicaSet existing = sets.get(objectId);
            Map<String, ReplicaTarget> state = stateOf(existing);
            List<String> retryTargets = failedTargets(state);
            return converge(objectId, content, ownerBackend, policy, state, retryTargets, deadline, existing == null);
        });
    }

    /**
     * Prüft vorhandene Kopien, kopiert FAILED-Ziele von einer verifizierten Kopie neu und ergänzt
     * weitere Kandidaten, solange die Mindestredundanz fehlt. Ohne Fehler und bei erfüllter
     * Redundanz ändert sich nichts.
     *
     * @throws UnknownObjectException wenn für das Objekt kein ReplicaSet existiert
     */
    public ReplicaSet repair(String objectId, Duration timeout) {
        replicaSet(objectId).orElseThrow(() -> new UnknownObjectException(objectId));
        Deadline deadline = Deadline.in(timeout);

        return coalesced(objectId, deadline, () -> {
            ReplicaSet current = sets.get(objectId);
            if (current == null) {
                // zwischenzeitlich gelöscht
                throw new UnknownObjectException(objectId);
            }
            Map<String, ReplicaTarget> state = stateOf(current);
            audit(objectId, current.sizeBytes(), state, deadline);

            Optional<ReplicationPolicy> policy = policies.replication(current.ownerBackend());
            List<String> retryTargets = failedTargets(state);
            long verified = state.values().stream().filter(ReplicaTarget::isVerified).count();
            int min = policy.map(ReplicationPolicy::minRedundancy).orElse(0);
            if (retryTargets.isEmpty() && verified >= min) {
                return store(current, state);
            }

            Optional<byte[]> content = readSource(objectId, current.ownerBackend(), state, deadline);
            if (content.isEmpty()) {
                violations.report(Violation.open(current.ownerBackend(), PolicyKind.REPLICATION, Severity.CRITICAL,
                        verified, min, "no readable copy of " + objectId));
                return store(current, state);
            }
            if (policy.isEmpty()) {
                runRound(objectId, content.get(), retryTargets, state, deadline);
                return store(current, state);
            }
            return converge(objectId, content.get(), current.ownerBackend(), policy.get(), state, retryTargets,
                    deadline, false);
        });
    }

    /**
     * Löscht alle Kopien und gibt deren Nutzung frei. Fehler einzelner Backends werden
     * protokolliert, die Kopie gilt trotzdem als entfernt.
     *
     * @return entfernter ReplicaSet oder leer
     */
    public Optional<ReplicaSet> remove(String objectId, Duration timeout) {
        Deadline deadline = Deadline.in(timeout);
        return exclusive(objectId, deadline, () -> removeNow(objectId, deadline));
    }

    /**
     * Nach dem Überschreiben auf dem Backend of Record: alle übrigen Kopien halten alten Inhalt.
     * Sie werden FAILED, ihre Nutzung wird freigegeben und der Satz trägt die neue Größe. Die
     * nächste Replikation oder Reparatur kopiert den neuen Inhalt.
     *
     * @return angepasster ReplicaSet oder leer, wenn das Objekt keinen hat
     */
    public Optional<ReplicaSet> invalidate(String objectId, long newSize, Duration timeout) {
        Deadline deadline = Deadline.in(timeout);
        return exclusive(objectId, deadline, () -> {
            ReplicaSet current = sets.get(objectId);
            if (current == null) {
                return Optional.empty();
            }
            Map<String, ReplicaTarget> state = stateOf(current);
            int stale = 0;
            for (ReplicaTarget t : List.copyOf(state.values())) {
                if (t.backendId().equals(current.ownerBackend())) {
                    continue;
                }
                if (t.isVerified()) {
                    tracker.record(t.backendId(), UsageDelta.delete(current.sizeBytes()));
                    stale++;
                }
                state.put(t.backendId(),
                        ReplicaTarget.failed(t.backendId(), t.attempts(), "stale after overwrite", clock.instant()));
            }
            if (stale > 0) {
                log.info("{} replicas of {} are stale after overwrite", stale, objectId);
            }
            return Optional.of(store(new ReplicaSet(objectId, newSize, current.ownerBackend(), List.of()), state));
        });
    }

    private Optional<ReplicaSet> removeNow(String objectId, Deadline deadline) {
        ReplicaSet removed = sets.remove(objectId);
        if (removed == null) {
            return Optional.empty();
        }
        for (ReplicaTarget t : removed.targets()) {
            if (t.backendId().equals(removed.ownerBackend()) || !registry.contains(t.backendId())) {
                continue;
            }
            BackendAdapter adapter = registry.adapter(t.backendId());
            try {
                invoker.call(t.backendId(), "delete", () -> {
                    adapter.delete(objectId);
                    return null;
                }, deadline);
            } catch (AdapterException e) {
                log.warn("Deleting replica of {} on {} failed: {}", objectId, t.backendId(), e.getMessage());
            }
            if (t.isVerified()) {
                tracker.record(t.backendId(), UsageDelta.delete(removed.sizeBytes()));
            }
        }
        log.info("Removed {} replicas of {}", removed.targets().size(), objectId);
        return Optional.of(removed);
    }

    public Optional<ReplicaSet> replicaSet(String objectId) {
        return Optional.ofNullable(sets.get(objectId));
    }

    /**
     * @return alle ReplicaSets, nach Objekt-ID sortiert
     */
    public List<ReplicaSet> all() {
        List<ReplicaSet> out = new ArrayList<>(sets.values());
        out.sort((a, b) -> a.objectId().compareTo(b.objectId()));
        return out;
    }

    /**
     * @return Objekte, die auf dem Backend verifiziert liegen
     */
    public List<String> exportReplicas(String backendId) {
        return all().stream().filter(s -> s.isVerifiedOn(backendId)).map(ReplicaSet::objectId).toList();
    }

    /**
     * Übernimmt einen persistierten ReplicaSet beim Start. Offene Kopien gelten als fehlgeschlagen.
     */
    public void restore(ReplicaSet set) {
        Map<String, ReplicaTarget> state = stateOf(set);
        state.replaceAll((id, t) -> t.status() == ReplicaStatus.PENDING
                ? ReplicaTarget.failed(id, t.attempts(), "interrupted by restart", clock.instant())
                : t);
        store(set, state);
    }

    // ---- intern ----

    private ReplicaSet coalesced(String objectId, Deadline deadline, Supplier<ReplicaSet> work) {
        while (true) {
            Flight mine = new Flight(new CompletableFuture<>(), true);
            Flight running = inFlight.putIfAbsent(objectId, mine);
            if (running == null) {
                try {
                    ReplicaSet result = work.get();
                    mine.result().complete(result);
                    return result;
                } catch (RuntimeException e) {
                    mine.result().completeExceptionally(e);
                    throw e;
                } finally {
                    inFlight.remove(objectId, mine);
                }
            }
            if (running.joinable()) {
                log.debug("Joining in-flight replication of {}", objectId);
                return await(objectId, running.result(), deadline);
            }
            waitOut(objectId, running, deadline);
        }
    }

    /**
     * Führt {@code work} aus, sobald kein anderer Aufruf für das Objekt läuft. Solange es läuft,
     * schließt sich niemand an; spätere Aufrufe warten und sehen das Ergebnis.
     */
    private <T> T exclusive(String objectId, Deadline deadline, Supplier<T> work) {
        while (true) {
            Flight mine = new Flight(new CompletableFuture<>(), false);
            Flight running = inFlight.putIfAbsent(objectId, mine);
            if (running == null) {
                try {
                    return work.get();
                } finally {
                    inFlight.remove(objectId, mine);
                    mine.result().complete(null);
                }
            }
            waitOut(objectId, running, deadline);
        }
    }

    private void waitOut(String objectId, Flight running, Deadline deadline) {
        try {
            running.result().get(deadline.remainingMillis() + AWAIT_GRACE_MS, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            // gehört dem anderen Aufrufer, der ihn selbst meldet
            log.debug("In-flight operation on {} failed: {}", objectId, String.valueOf(e.getCause()));
        } catch (TimeoutException e) {
            throw new AdapterTimeoutException("replication", "operation on " + objectId + " still in flight");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AdapterTimeoutException("replication", "waiting for " + objectId + " cancelled");
        }
    }

    private ReplicaSet await(String objectId, CompletableFuture<ReplicaSet> running, Deadline deadline) {
        try {
            return running.get(deadline.remainingMillis() + AWAIT_GRACE_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new AdapterTimeoutException("replication", "replication of " + objectId + " still in flight");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AdapterTimeoutException("replication", "waiting for replication of " + objectId + " cancelled");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof TierStoreException tse) {
                throw tse;
            }
            throw new IllegalStateException("replication of " + objectId + " failed", e.getCause());
        }
    }

    private ReplicaSet converge(
            String objectId,
            byte[] content,
            String owner,
            ReplicationPolicy policy,
            Map<String, ReplicaTarget> state,
            List<String> retryTargets,
            Deadline deadline,
            boolean strict) {
        long size = content.length;
        UsageDelta delta = UsageDelta.store(size);
        List<String> candidates = candidates(policy, state);

        if (candidates.contains(owner) && !state.containsKey(owner)) {
            state.put(owner, ReplicaTarget.verified(owner, 0, clock.instant()));
        }
        Set<String> tried = new HashSet<>(state.keySet());

        int verified = countVerified(state);
        int needed = Math.max(0, policy.minRedundancy() - verified);
        List<String> fresh = new ArrayList<>();
        for (String c : candidates) {
            if (!tried.contains(c) && quota.evaluate(c, delta).allowed()) {
                fresh.add(c);
            }
        }

        if (strict && retryTargets.size() + fresh.size() < needed) {
            int eligible = verified + retryTargets.size() + fresh.size();
            violations.report(Violation.open(owner, PolicyKind.REPLICATION, Severity.CRITICAL, eligible,
                    policy.minRedundancy(), "only " + eligible + " eligible replica targets for " + objectId));
            throw new InsufficientRedundancyException(objectId, eligible, policy.minRedundancy());
        }

        List<String> round = new ArrayList<>(retryTargets);
        int freshSlots = Math.max(0, needed - retryTargets.size());
        List<String> remaining = new ArrayList<>(fresh);
        while (freshSlots > 0 && !remaining.isEmpty()) {
            round.add(remaining.remove(0));
            freshSlots--;
        }
        // Zusätzliche Kopien bis maxRedundancy nur auf Backends unterhalb der Warnschwelle.
        int extraRoom = policy.maxRedundancy() - verified - round.size();
        for (String c : List.copyOf(remaining)) {
            if (extraRoom <= 0) {
                break;
            }
            if (quota.evaluate(c, delta).outcome() == QuotaDecision.Outcome.ALLOW) {
                round.add(c);
                remaining.remove(c);
                extraRoom--;
            }
        }

        runRound(objectId, content, round, state, deadline);

        while (countVerified(state) < policy.minRedundancy() && !deadline.isExpired()) {
            int missing = policy.minRedundancy() - countVerified(state);
            List<String> next = new ArrayList<>();
            for (String c : List.copyOf(remaining)) {
                if (next.size() >= missing) {
                    break;
                }
                remaining.remove(c);
                if (quota.evaluate(c, delta).allowed()) {
                    next.add(c);
                }
            }
            if (next.isEmpty()) {
                break;
            }
            log.debug("Falling back to {} for {}", next, objectId);
            runRound(objectId, content, next, state, deadline);
        }

        int finalVerified = countVerified(state);
        if (finalVerified < policy.minRedundancy()) {
            violations.report(Violation.open(owner, PolicyKind.REPLICATION, Severity.CRITICAL, finalVerified,
                    policy.minRedundancy(), objectId + " has " + finalVerified + " of " + policy.minRedundancy()
                            + " required replicas"));
        } else {
            violations.resolve(owner, PolicyKind.REPLICATION);
        }
        ReplicaSet result = store(new ReplicaSet(objectId, size, owner, List.of()), state);
        log.info("Replication of {}: {} verified of min {} ({})", objectId, finalVerified,
                policy.minRedundancy(), result.verifiedBackends());
        return result;
    }

    /**
     * Kandidaten in Auswahlreihenfolge: bevorzugte Backends oder alle replikationsfähigen.
     * Unter GEO_AWARE zuerst je Region ein Backend.
     */
    private List<String> candidates(ReplicationPolicy policy, Map<String, ReplicaTarget> state) {
        List<String> base = new ArrayList<>();
        Collection<String> source = policy.preferredBackends().isEmpty()
                ? registry.ids()
                : policy.preferredBackends();
        for (String id : source) {
            if (registry.contains(id) && registry.backend(id).supportsReplication()) {
                base.add(id);
            }
        }
        if (policy.strategy() != ReplicationStrategy.GEO_AWARE) {
            return base;
        }

        Set<String> usedRegions = new HashSet<>();
        for (ReplicaTarget t : state.values()) {
            if (t.isVerified() && registry.contains(t.backendId())) {
                usedRegions.add(registry.backend(t.backendId()).region());
            }
        }
        List<String> firstPerRegion = new ArrayList<>();
        List<String> rest = new ArrayList<>();
        for (String id : base) {
            Backend b = registry.backend(id);
            if (usedRegions.add(b.region())) {
                firstPerRegion.add(id);
            } else {
                rest.add(id);
            }
        }
        firstPerRegion.addAll(rest);
        return firstPerRegion;
    }

    private void runRound(
            String objectId, byte[] content, List<String> targets, Map<String, ReplicaTarget> state, Deadline deadline) {
        if (targets.isEmpty()) {
            return;
        }
        Map<String, Future<ReplicaTarget>> futures = new LinkedHashMap<>();
        for (String backendId : targets) {
            int previous = state.containsKey(backendId) ? state.get(backendId).attempts() : 0;
            state.put(backendId, ReplicaTarget.pending(backendId, previous, clock.instant()));
            try {
                futures.put(backendId, copyExecutor.submit(() -> copy(objectId, content, backendId, previous, deadline)));
            } catch (RejectedExecutionException e) {
                state.put(backendId, ReplicaTarget.failed(backendId, previous, "copy rejected: executor saturated",
                        clock.instant()));
            }
        }
        for (Map.Entry<String, Future<ReplicaTarget>> e : futures.entrySet()) {
            String backendId = e.getKey();
            int previous = state.get(backendId).attempts();
            try {
                state.put(backendId, e.getValue().get(deadline.remainingMillis() + AWAIT_GRACE_MS, TimeUnit.MILLISECONDS));
            } catch (TimeoutException ex) {
                e.getValue().cancel(true);
                state.put(backendId, ReplicaTarget.failed(backendId, previous + 1, "timeout", clock.instant()));
            } catch (InterruptedException ex) {
                e.getValue().cancel(true);
                Thread.currentThread().interrupt();
                state.put(backendId, ReplicaTarget.failed(backendId, previous + 1, "cancelled", clock.instant()));
            } catch (ExecutionException ex) {
                state.put(backendId, ReplicaTarget.failed(backendId, previous + 1, String.valueOf(ex.getCause()),
                        clock.instant()));
            }
        }
    }

    /**
     * Ein Ziel: reserve → put → stat → commit, mit Wiederholung bis zur Deadline.
     */
    private ReplicaTarget copy(String objectId, byte[] content, String backendId, int previousAttempts,
            Deadline deadline) {
        BackendAdapter adapter = registry.adapter(backendId);
        UsageDelta delta = UsageDelta.store(content.length);
        int attempts = previousAttempts;
        String lastError = null;

        for (int i = 1; i <= retry.maxAttempts(); i++) {
            if (deadline.isExpired()) {
                lastError = "timeout";
                break;
            }
            attempts++;
            Reservation reservation;
            try {
                reservation = quota.reserve(backendId, delta);
            } catch (QuotaExceededException e) {
                return ReplicaTarget.failed(backendId, attempts, e.getMessage(), clock.instant());
            }
            try {
                invoker.call(backendId, "put", () -> adapter.put(objectId, content), deadline);
                OptionalLong stored = invoker.call(backendId, "stat", () -> adapter.stat(objectId), deadline);
                if (stored.isPresent() && stored.getAsLong() == content.length) {
                    tracker.commit(reservation);
                    log.debug("Replica of {} verified on {} after {} attempt(s)", objectId, backendId, attempts);
                    return ReplicaTarget.verified(backendId, attempts, clock.instant());
                }
                tracker.release(reservation);
                lastError = "size mismatch: expected " + content.length + ", found "
                        + (stored.isPresent() ? stored.getAsLong() : "nothing");
                discard(objectId, backendId, adapter, deadline);
            } catch (AdapterException e) {
                tracker.release(reservation);
                lastError = e.getMessage();
                log.warn("Copy of {} to {} failed (attempt {}): {}", objectId, backendId, attempts, e.getMessage());
            }
            if (i < retry.maxAttempts() && !backoff(i, deadline)) {
                lastError = lastError + "; retry aborted";
                break;
            }
        }
        return ReplicaTarget.failed(backendId, attempts, lastError, clock.instant());
    }

    private boolean backoff(int failedAttempts, Deadline deadline) {
        long delayMs = retry.delayFor(failedAttempts).toMillis();
        if (delayMs <= 0) {
            return true;
        }
        if (delayMs >= deadline.remainingMillis()) {
            return false;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void discard(String objectId, String backendId, BackendAdapter adapter, Deadline deadline) {
        try {
            invoker.call(backendId, "delete", () -> {
                adapter.delete(objectId);
                return null;
            }, deadline);
        } catch (AdapterException e) {
            log.warn("Discarding mismatched copy of {} on {} failed: {}", objectId, backendId, e.getMessage());
        }
    }

    /**
     * Prüft verifizierte Kopien per stat; fehlende oder abweichende werden FAILED und ihre
     * Nutzung freigegeben.
     */
    private void audit(String objectId, long size, Map<String, ReplicaTarget> state, Deadline deadline) {
        for (ReplicaTarget t : List.copyOf(state.values())) {
            if (!t.isVerified()) {
                continue;
            }
            String reason;
            try {
                BackendAdapter adapter = registry.adapter(t.backendId());
                OptionalLong stored = invoker.call(t.backendId(), "stat", () -> adapter.stat(objectId), deadline);
                if (stored.isPresent() && stored.getAsLong() == size) {
                    continue;
                }
                reason = stored.isPresent() ? "size mismatch" : "replica missing";
            } catch (TierStoreException e) {
                reason = e.getMessage();
            }
            log.warn("Replica of {} on {} lost: {}", objectId, t.backendId(), reason);
            state.put(t.backendId(), ReplicaTarget.failed(t.backendId(), t.attempts(), reason, clock.instant()));
            tracker.record(t.backendId(), UsageDelta.delete(size));
        }
    }

    /**
     * Liest den Inhalt für Reparaturen: zuerst von verifizierten Kopien, zuletzt vom Backend of Record.
     */
    private Optional<byte[]> readSource(
            String objectId, String owner, Map<String, ReplicaTarget> state, Deadline deadline) {
        List<String> sources = new ArrayList<>();
        for (ReplicaTarget t : state.values()) {
            if (t.isVerified()) {
                sources.add(t.backendId());
            }
        }
        if (!sources.contains(owner) && registry.contains(owner)) {
            sources.add(owner);
        }
        for (String backendId : sources) {
            try {
                BackendAdapter adapter = registry.adapter(backendId);
                return Optional.of(invoker.call(backendId, "get", () -> adapter.get(objectId), deadline));
            } catch (TierStoreException e) {
                log.warn("Reading {} from {} for repair failed: {}", objectId, backendId, e.getMessage());
            }
        }
        return Optional.empty();
    }

    private ReplicaSet store(ReplicaSet template, Map<String, ReplicaTarget> state) {
        ReplicaSet next = new ReplicaSet(
                template.objectId(), template.sizeBytes(), template.ownerBackend(), new ArrayList<>(state.values()));
        sets.put(next.objectId(), next);
        return next;
    }

    private static Map<String, ReplicaTarget> stateOf(ReplicaSet set) {
        Map<String, ReplicaTarget> state = new LinkedHashMap<>();
        if (set != null) {
            for (ReplicaTarget t : set.targets()) {
                state.put(t.backendId(), t);
            }
        }
        return state;
    }

    private static List<String> failedTargets(Map<String, ReplicaTarget> state) {
        List<String> out = new ArrayList<>();
        for (ReplicaTarget t : state.values()) {
            if (t.status() == ReplicaStatus.FAILED) {
                out.add(t.backendId());
            }
        }
        return out;
    }

    private static int countVerified(Map<String, ReplicaTarget> state) {
        int n = 0;
        for (ReplicaTarget t : state.values()) {
            if (t.isVerified()) {
                n++;
            }
        }
        return n;
    }

    /** Laufender Aufruf je Objekt; nur ensure/repair dürfen sich anschließen. */
    private record Flight(CompletableFuture<ReplicaSet> result, boolean joinable) {}
}
