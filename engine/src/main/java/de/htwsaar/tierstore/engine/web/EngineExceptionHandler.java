package de.htwsaar.tierstore.engine.web;

import de.htwsaar.tierstore.engine.domain.TierStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Übersetzt Engine-Fehler in HTTP-Antworten. Der Statuscode kommt aus der Exception selbst.
 */
@RestControllerAdvice
@Profile("engine")
public class EngineExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(EngineExceptionHandler.class);

    @ExceptionHandler(TierStoreException.class)
    public ResponseEntity<ApiError> engineFailure(TierStoreException e) {
        if (e.getStatusCode() >= 500) {
            log.warn("Engine operation failed: {}", e.getMessage());
        }
        return ResponseEntity.status(e.getStatusCode()).body(new ApiError(codeOf(e), e.getMessage()));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ApiError> badRequest(Exception e) {
        return ResponseEntity.badRequest().body(new ApiError("bad_request", e.getMessage()));
    }

    private static String codeOf(TierStoreException e) {
        // QuotaExceededException -> quota_exceeded
        String simple = e.getClass().getSimpleName().replace("Exception", "");
        return simple.replaceAll("([a-z])([A-Z])", "$1_$2").toLowerCase();
    }

    /**
     * Fehlerkörper aller Engine-Endpunkte.
     *
     * @param code    maschinenlesbarer Fehlercode
     * @param message Beschreibung
     */
    public record ApiError(String code, String message) {}
}
