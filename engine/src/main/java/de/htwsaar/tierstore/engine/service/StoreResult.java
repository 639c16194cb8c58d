package de.htwsaar.tierstore.engine.service;

import de.htwsaar.tierstore.engine.cache.CacheEntry;
import de.htwsaar.tierstore.engine.domain.ObjectRecord;
import de.htwsaar.tierstore.engine.replication.ReplicaSet;

/**
 * Ergebnis eines Speichervorgangs.
 *
 * @param record   Katalogeintrag
 * @param cached   Cache-Eintrag oder {@code null}, wenn keine Tier Platz hatte
 * @param replicas ReplicaSet oder {@code null}, wenn keine Replikation gilt oder sie scheiterte
 */
public record StoreResult(ObjectRecord record, CacheEntry cached, ReplicaSet replicas) {}
