package de.htwsaar.tierstore.engine.domain;

/**
 * Eine Reservierung oder Prüfung würde eine harte Quota überschreiten.
 * Speicher-Quotas antworten mit 507, Traffic-Quotas mit 429.
 */
public class QuotaExceededException extends TierStoreException {

    private final String backendId;
    private final String dimension;
    private final long projected;
    private final long limit;

    private QuotaExceededException(String backendId, String dimension, long projected, long limit, int statusCode) {
        super("quota exceeded on " + backendId + ": " + dimension + " " + projected + " > " + limit, statusCode);
        this.backendId = backendId;
        this.dimension = dimension;
        this.projected = projected;
        this.limit = limit;
    }

    /**
     * @param dimension "bytes" oder "files"
     */
    public static QuotaExceededException storage(String backendId, String dimension, long projected, long limit) {
        return new QuotaExceededException(backendId, dimension, projected, limit, 507);
    }

    /**
     * @param dimension "transferBytes" oder "requests"
     */
    public static QuotaExceededException traffic(String backendId, String dimension, long projected, long limit) {
        return new QuotaExceededException(backendId, dimension, projected, limit, 429);
    }

    public String getBackendId() {
        return backendId;
    }

    public String getDimension() {
        return dimension;
    }

    public long getProjected() {
        return projected;
    }

    public long getLimit() {
        return limit;
    }

    public boolean isTraffic() {
        return getStatusCode() == 429;
    }
}
