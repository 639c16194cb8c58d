package de.htwsaar.tierstore.engine.adapter;

import de.htwsaar.tierstore.engine.domain.AdapterException;
import de.htwsaar.tierstore.engine.domain.AdapterTimeoutException;
import de.htwsaar.tierstore.engine.domain.TierStoreException;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Führt Adapter-Aufrufe mit harter Zeitschranke aus.
 *
 * <p>Der Aufruf läuft auf einem eigenen Pool; der Aufrufer wartet höchstens bis zur
 * {@link Deadline}. Bei Überschreitung wird der Aufruf abgebrochen ({@code cancel(true)})
 * und eine {@link AdapterTimeoutException} geworfen. Fachliche Engine-Fehler des Adapters
 * (z. B. {@code UnknownObjectException}) werden unverändert weitergereicht.</p>
 */
public class AdapterInvoker {

    private final ExecutorService executor;

    /**
     * @param executor Pool für Adapter-Aufrufe (darf nicht {@code null} sein)
     */
    public AdapterInvoker(ExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    /**
     * Führt einen Adapter-Aufruf begrenzt aus.
     *
     * @param backendId Backend für Fehlermeldungen
     * @param operation Name der Operation (put/get/delete/stat)
     * @param call      eigentlicher Aufruf
     * @param deadline  Zeitschranke
     * @param <T>       Ergebnistyp
     * @return Ergebnis des Aufrufs
     */
    public <T> T call(String backendId, String operation, Callable<T> call, Deadline deadline) {
        if (deadline.isExpired()) {
            throw new AdapterTimeoutException(backendId, operation + " on " + backendId + " skipped: deadline expired");
        }

        Future<T> future;
        try {
            future = executor.submit(call);
        } catch (RejectedExecutionException e) {
            throw new AdapterException(backendId, operation + " on " + backendId + " rejected by executor", e);
        }

        try {
            return future.get(deadline.remainingMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new AdapterTimeoutException(backendId, operation + " on " + backendId + " timed out");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AdapterTimeoutException(backendId, operation + " on " + backendId + " cancelled");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TierStoreException tse) {
                throw tse;
            }
            throw new AdapterException(backendId, operation + " on " + backendId + " failed: " + cause, cause);
        }
    }
}
