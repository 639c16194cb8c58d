package de.htwsaar.tierstore.engine.persistence;

import static org.jooq.impl.DSL.field;
import static org.jooq.impl.DSL.name;
import static org.jooq.impl.DSL.table;

import de.htwsaar.tierstore.common.serialization.JacksonCodec;
import de.htwsaar.tierstore.engine.domain.ObjectRecord;
import de.htwsaar.tierstore.engine.policy.Policy;
import de.htwsaar.tierstore.engine.policy.PolicyKind;
import de.htwsaar.tierstore.engine.replication.ReplicaSet;
import de.htwsaar.tierstore.engine.usage.UsageRecord;
import de.htwsaar.tierstore.engine.violation.Severity;
import de.htwsaar.tierstore.engine.violation.Violation;
import de.htwsaar.tierstore.engine.violation.ViolationStore;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.SQLDialect;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.sqlite.SQLiteDataSource;

/**
 * Dauerhafter Engine-Zustand in SQLite.
 *
 * <p>Policies und Verstoß-Log sind die maßgebliche Quelle. Nutzungszähler und Objektkatalog
 * sind Warmstart-Zustand mit {@code state_version}; bei abweichender Version wird neu
 * aufgebaut statt den Zählern zu vertrauen. Jeder Katalog-Schreibvorgang erhöht die
 * Katalog-Generation in {@code state_meta}; ein Zähler-Checkpoint gilt nur, solange seine
 * Generation noch die aktuelle ist.</p>
 */
public class EngineStateRepository implements ViolationStore {

    /** Version des Formats von {@code usage_state} und {@code object_catalog}. */
    public static final int STATE_VERSION = 1;

    private static final Table<Record> POLICIES = table(name("policies"));
    private static final Field<String> P_BACKEND = field(name("backend_id"), String.class);
    private static final Field<String> P_KIND = field(name("kind"), String.class);
    private static final Field<String> P_DOCUMENT = field(name("document"), String.class);
    private static final Field<String> P_UPDATED = field(name("updated_at"), String.class);

    private static final Table<Record> VIOLATIONS = table(name("violations"));
    private static final Field<Long> V_ID = field(name("id"), Long.class);
    private static final Field<String> V_BACKEND = field(name("backend_id"), String.class);
    private static final Field<String> V_KIND = field(name("policy_kind"), String.class);
    private static final Field<String> V_SEVERITY = field(name("severity"), String.class);
    private static final Field<String> V_DETECTED = field(name("detected_at"), String.class);
    private static final Field<Long> V_CURRENT = field(name("current_value"), Long.class);
    private static final Field<Long> V_LIMIT = field(name("limit_value"), Long.class);
    private static final Field<String> V_MESSAGE = field(name("message"), String.class);
    private static final Field<Integer> V_RESOLVED = field(name("resolved"), Integer.class);
    private static final Field<String> V_RESOLVED_AT = field(name("resolved_at"), String.class);

    private static final Table<Record> USAGE = table(name("usage_state"));
    private static final Field<String> U_BACKEND = field(name("backend_id"), String.class);
    private static final Field<Long> U_BYTES = field(name("bytes_used"), Long.class);
    private static final Field<Long> U_FILES = field(name("file_count"), Long.class);
    private static final Field<Integer> U_VERSION = field(name("state_version"), Integer.class);
    private static final Field<String> U_SAVED = field(name("saved_at"), String.class);

    private static final Table<Record> CATALOG = table(name("object_catalog"));
    private static final Field<String> C_OBJECT = field(name("object_id"), String.class);
    private static final Field<Long> C_SIZE = field(name("size_bytes"), Long.class);
    private static final Field<String> C_PRIMARY = field(name("primary_backend"), String.class);
    private static final Field<String> C_STORED = field(name("stored_at"), String.class);
    private static final Field<String> C_REPLICAS = field(name("replicas"), String.class);
    private static final Field<Integer> C_VERSION = field(name("state_version"), Integer.class);

    private static final Table<Record> META = table(name("state_meta"));
    private static final Field<String> M_KEY = field(name("meta_key"), String.class);
    private static final Field<Long> M_VALUE = field(name("meta_value"), Long.class);

    static final String CATALOG_GENERATION = "catalog_generation";
    static final String USAGE_GENERATION = "usage_generation";

    private final DSLContext dsl;
    private final Clock clock;

    public EngineStateRepository(DSLContext dsl, Clock clock) {
        this.dsl = Objects.requireNonNull(dsl, "dsl must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Öffnet (oder erzeugt) die Datenbank unter der JDBC-URL und legt das Schema an.
     *
     * @param jdbcUrl z. B. {@code jdbc:sqlite:data/tierstore.db}
     */
    public static EngineStateRepository open(String jdbcUrl, Clock clock) {
        SQLiteDataSource ds = new SQLiteDataSource();
        ds.setUrl(jdbcUrl);
        EngineStateRepository repo = new EngineStateRepository(DSL.using(ds, SQLDialect.SQLITE), clock);
        repo.initSchema();
        return repo;
    }

    public synchronized void initSchema() {
        dsl.execute("CREATE TABLE IF NOT EXISTS policies ("
                + "backend_id TEXT NOT NULL, kind TEXT NOT NULL, document TEXT NOT NULL, updated_at TEXT NOT NULL, "
                + "PRIMARY KEY (backend_id, kind))");
        dsl.execute("CREATE TABLE IF NOT EXISTS violations ("
                + "id INTEGER PRIMARY KEY, backend_id TEXT NOT NULL, policy_kind TEXT NOT NULL, "
                + "severity TEXT NOT NULL, detected_at TEXT, current_value INTEGER NOT NULL, "
                + "limit_value INTEGER NOT NULL, message TEXT, resolved INTEGER NOT NULL, resolved_at TEXT)");
        dsl.execute("CREATE TABLE IF NOT EXISTS usage_state ("
                + "backend_id TEXT PRIMARY KEY, bytes_used INTEGER NOT NULL, file_count INTEGER NOT NULL, "
                + "state_version INTEGER NOT NULL, saved_at TEXT NOT NULL)");
        dsl.execute("CREATE TABLE IF NOT EXISTS object_catalog ("
                + "object_id TEXT PRIMARY KEY, size_bytes INTEGER NOT NULL, primary_backend TEXT NOT NULL, "
                + "stored_at TEXT NOT NULL, replicas TEXT, state_version INTEGER NOT NULL)");
        dsl.execute("CREATE TABLE IF NOT EXISTS state_meta ("
                + "meta_key TEXT PRIMARY KEY, meta_value INTEGER NOT NULL)");
    }

    // ---- policies ----

    public synchronized void savePolicy(String backendId, Policy policy) {
        String json = JacksonCodec.toJson(policy);
        String now = clock.instant().toString();
        dsl.insertInto(POLICIES)
                .set(P_BACKEND, backendId)
                .set(P_KIND, policy.kind().name())
                .set(P_DOCUMENT, json)
                .set(P_UPDATED, now)
                .onConflict(P_BACKEND, P_KIND)
                .doUpdate()
                .set(P_DOCUMENT, json)
                .set(P_UPDATED, now)
                .execute();
    }

    public synchronized boolean deletePolicy(String backendId, PolicyKind kind) {
        return dsl.deleteFrom(POLICIES)
                .where(P_BACKEND.eq(backendId))
                .and(P_KIND.eq(kind.name()))
                .execute() > 0;
    }

    /**
     * @return Policies je Backend
     */
    public synchronized Map<String, List<Policy>> loadPolicies() {
        Map<String, List<Policy>> out = new LinkedHashMap<>();
        for (Record r : dsl.select(P_BACKEND, P_DOCUMENT).from(POLICIES).orderBy(P_BACKEND, P_KIND).fetch()) {
            Policy p = JacksonCodec.fromJson(r.get(P_DOCUMENT), Policy.class);
            out.computeIfAbsent(r.get(P_BACKEND), k -> new ArrayList<>()).add(p);
        }
        return out;
    }

    // ---- violations ----

    @Override
    public synchronized void save(Violation v) {
        dsl.insertInto(VIOLATIONS)
                .set(V_ID, v.id())
                .set(V_BACKEND, v.backendId())
                .set(V_KIND, v.policyKind().name())
                .set(V_SEVERITY, v.severity().name())
                .set(V_DETECTED, text(v.detectedAt()))
                .set(V_CURRENT, v.currentValue())
                .set(V_LIMIT, v.limitValue())
                .set(V_MESSAGE, v.message())
                .set(V_RESOLVED, v.resolved() ? 1 : 0)
                .set(V_RESOLVED_AT, text(v.resolvedAt()))
                .onConflict(V_ID)
                .doUpdate()
                .set(V_DETECTED, text(v.detectedAt()))
                .set(V_CURRENT, v.currentValue())
                .set(V_LIMIT, v.limitValue())
                .set(V_MESSAGE, v.message())
                .set(V_RESOLVED, v.resolved() ? 1 : 0)
                .set(V_RESOLVED_AT, text(v.resolvedAt()))
                .execute();
    }

    @Override
    public synchronized List<Violation> loadAll() {
        List<Violation> out = new ArrayList<>();
        for (Record r : dsl.select(V_ID, V_BACKEND, V_KIND, V_SEVERITY, V_DETECTED, V_CURRENT, V_LIMIT,
                        V_MESSAGE, V_RESOLVED, V_RESOLVED_AT)
                .from(VIOLATIONS).orderBy(V_ID).fetch()) {
            out.add(new Violation(
                    r.get(V_ID),
                    r.get(V_BACKEND),
                    PolicyKind.valueOf(r.get(V_KIND)),
                    Severity.valueOf(r.get(V_SEVERITY)),
                    instant(r.get(V_DETECTED)),
                    r.get(V_CURRENT),
                    r.get(V_LIMIT),
                    r.get(V_MESSAGE),
                    r.get(V_RESOLVED) != 0,
                    instant(r.get(V_RESOLVED_AT))));
        }
        return out;
    }

    // ---- usage ----

    /**
     * Schreibt die Speicherzähler aller Backends mit aktueller {@link #STATE_VERSION}.
     *
     * @param usage      Zähler je Backend
     * @param generation Katalog-Generation, gelesen <em>bevor</em> die Zähler abgegriffen wurden
     */
    public synchronized void saveUsage(List<UsageRecord> usage, long generation) {
        String now = clock.instant().toString();
        dsl.transaction(cfg -> {
            DSLContext tx = DSL.using(cfg);
            putMeta(tx, USAGE_GENERATION, generation);
            for (UsageRecord u : usage) {
                tx.insertInto(USAGE)
                        .set(U_BACKEND, u.backendId())
                        .set(U_BYTES, u.bytesUsed())
                        .set(U_FILES, u.fileCount())
                        .set(U_VERSION, STATE_VERSION)
                        .set(U_SAVED, now)
                        .onConflict(U_BACKEND)
                        .doUpdate()
                        .set(U_BYTES, u.bytesUsed())
                        .set(U_FILES, u.fileCount())
                        .set(U_VERSION, STATE_VERSION)
                        .set(U_SAVED, now)
                        .execute();
            }
        });
    }

    /**
     * @return gespeicherte Zähler, oder leer wenn nichts gespeichert ist oder eine Zeile eine
     *         andere Version trägt
     */
    public synchronized Optional<Map<String, StoredUsage>> loadUsage() {
        Map<String, StoredUsage> out = new LinkedHashMap<>();
        for (Record r : dsl.select(U_BACKEND, U_BYTES, U_FILES, U_VERSION).from(USAGE).fetch()) {
            if (r.get(U_VERSION) != STATE_VERSION) {
                return Optional.empty();
            }
            out.put(r.get(U_BACKEND), new StoredUsage(r.get(U_BYTES), r.get(U_FILES)));
        }
        return out.isEmpty() ? Optional.empty() : Optional.of(out);
    }

    /**
     * @return Anzahl der bisherigen Katalog-Schreibvorgänge
     */
    public synchronized long catalogGeneration() {
        return meta(dsl, CATALOG_GENERATION).orElse(0L);
    }

    /**
     * @return {@code true}, wenn seit dem letzten Zähler-Checkpoint kein Katalogeintrag
     *         geschrieben oder gelöscht wurde
     */
    public synchronized boolean usageCheckpointCurrent() {
        Optional<Long> saved = meta(dsl, USAGE_GENERATION);
        return saved.isPresent() && saved.get() == catalogGeneration();
    }

    // ---- catalog ----

    public synchronized void saveObject(ObjectRecord record, ReplicaSet replicas) {
        String json = replicas == null ? null : JacksonCodec.toJson(replicas);
        dsl.transaction(cfg -> {
            DSLContext tx = DSL.using(cfg);
            tx.insertInto(CATALOG)
                    .set(C_OBJECT, record.objectId())
                    .set(C_SIZE, record.sizeBytes())
                    .set(C_PRIMARY, record.primaryBackend())
                    .set(C_STORED, record.storedAt().toString())
                    .set(C_REPLICAS, json)
                    .set(C_VERSION, STATE_VERSION)
                    .onConflict(C_OBJECT)
                    .doUpdate()
                    .set(C_SIZE, record.sizeBytes())
                    .set(C_PRIMARY, record.primaryBackend())
                    .set(C_STORED, record.storedAt().toString())
                    .set(C_REPLICAS, json)
                    .set(C_VERSION, STATE_VERSION)
                    .execute();
            bumpGeneration(tx);
        });
    }

    public synchronized boolean deleteObject(String objectId) {
        return dsl.transactionResult(cfg -> {
            DSLContext tx = DSL.using(cfg);
            boolean deleted = tx.deleteFrom(CATALOG).where(C_OBJECT.eq(objectId)).execute() > 0;
            if (deleted) {
                bumpGeneration(tx);
            }
            return deleted;
        });
    }

    /**
     * @return alle Katalogeinträge; {@code current} ist {@code false} bei abweichender Version
     */
    public synchronized List<CatalogEntry> loadCatalog() {
        List<CatalogEntry> out = new ArrayList<>();
        for (Record r : dsl.select(C_OBJECT, C_SIZE, C_PRIMARY, C_STORED, C_REPLICAS, C_VERSION)
                .from(CATALOG).orderBy(C_OBJECT).fetch()) {
            ObjectRecord record = new ObjectRecord(
                    r.get(C_OBJECT), r.get(C_SIZE), r.get(C_PRIMARY), Instant.parse(r.get(C_STORED)));
            boolean current = r.get(C_VERSION) == STATE_VERSION;
            String json = r.get(C_REPLICAS);
            ReplicaSet replicas = current && json != null ? JacksonCodec.fromJson(json, ReplicaSet.class) : null;
            out.add(new CatalogEntry(record, replicas, current));
        }
        return out;
    }

    // ---- meta ----

    private static void bumpGeneration(DSLContext tx) {
        tx.insertInto(META)
                .set(M_KEY, CATALOG_GENERATION)
                .set(M_VALUE, 1L)
                .onConflict(M_KEY)
                .doUpdate()
                .set(M_VALUE, M_VALUE.plus(1L))
                .execute();
    }

    private static void putMeta(DSLContext tx, String key, long value) {
        tx.insertInto(META)
                .set(M_KEY, key)
                .set(M_VALUE, value)
                .onConflict(M_KEY)
                .doUpdate()
                .set(M_VALUE, value)
                .execute();
    }

    private static Optional<Long> meta(DSLContext ctx, String key) {
        return ctx.select(M_VALUE).from(META).where(M_KEY.eq(key)).fetchOptional(M_VALUE);
    }

    private static String text(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    private static Instant instant(String text) {
        return text == null ? null : Instant.parse(text);
    }

    /**
     * Gespeicherte Speicherzähler eines Backends.
     */
    public record StoredUsage(long bytesUsed, long fileCount) {}

    /**
     * Katalogeintrag samt Replikationsstand.
     *
     * @param record   Objekt
     * @param replicas ReplicaSet oder {@code null}
     * @param current  Version passt zu {@link #STATE_VERSION}
     */
    public record CatalogEntry(ObjectRecord record, ReplicaSet replicas, boolean current) {}
}
