package de.htwsaar.tierstore.engine.domain;

import java.util.Objects;

/**
 * Unabhängig adressierbares Speicherziel (lokaler Store, Object Storage, Archiv-Netz).
 * Wird bei der Konfiguration registriert und danach nicht mehr verändert.
 *
 * @param id                  eindeutige Backend-ID
 * @param region              Standort-Label für geo-verteilte Replikation (optional)
 * @param supportsReplication darf als Replikationsziel gewählt werden
 * @param supportsStreaming   unterstützt Streaming-Zugriffe
 * @param costTier            Kostenklasse
 */
public record Backend(
        String id, String region, boolean supportsReplication, boolean supportsStreaming, CostTier costTier) {

    public Backend {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(costTier, "costTier must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        region = region == null || region.isBlank() ? "default" : region.trim();
    }
}
