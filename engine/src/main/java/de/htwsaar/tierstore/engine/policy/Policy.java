package de.htwsaar.tierstore.engine.policy;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Policy-Dokument eines Backends als geschlossene Typ-Hierarchie.
 *
 * <p>JSON-Form: das Feld {@code kind} trägt die Variante, z. B.
 * {@code {"kind":"STORAGE_QUOTA","maxBytes":1000,"maxFiles":0,"warnThreshold":0.8}}.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = StorageQuotaPolicy.class, name = "STORAGE_QUOTA"),
    @JsonSubTypes.Type(value = TrafficQuotaPolicy.class, name = "TRAFFIC_QUOTA"),
    @JsonSubTypes.Type(value = ReplicationPolicy.class, name = "REPLICATION"),
    @JsonSubTypes.Type(value = RetentionPolicy.class, name = "RETENTION"),
    @JsonSubTypes.Type(value = CachePolicy.class, name = "CACHE")
})
public sealed interface Policy
        permits StorageQuotaPolicy, TrafficQuotaPolicy, ReplicationPolicy, RetentionPolicy, CachePolicy {

    /** @return Variante dieser Policy */
    @JsonIgnore
    PolicyKind kind();

    /**
     * Prüft Wertebereiche und variantenspezifische Invarianten.
     *
     * @throws InvalidPolicyException bei Verletzung
     */
    void validate();
}
