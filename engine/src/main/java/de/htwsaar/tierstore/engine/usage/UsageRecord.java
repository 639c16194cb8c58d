package de.htwsaar.tierstore.engine.usage;

import java.time.Instant;

/**
 * Konsistente Kopie der Nutzungszähler eines Backends.
 */
public record UsageRecord(
        String backendId,
        long bytesUsed,
        long fileCount,
        long bytesTransferredInWindow,
        long requestCountInWindow,
        Instant lastResetTime,
        long reservedBytes,
        long reservedFiles,
        long reservedTransferBytes,
        long reservedRequests) {

    /** @return belegte plus reservierte Bytes */
    public long projectedBytes() {
        return bytesUsed + reservedBytes;
    }

    public long projectedFiles() {
        return fileCount + reservedFiles;
    }

    public long projectedTransferBytes() {
        return bytesTransferredInWindow + reservedTransferBytes;
    }

    public long projectedRequests() {
        return requestCountInWindow + reservedRequests;
    }
}
