package it.aw.hybridsearch.exception;

import java.util.concurrent.CancellationException;

/**
 * Punto di controllo della cancellazione prima di ogni chiamata esterna
 * (embedding, store, rerank): sono gli unici punti in cui la pipeline si sospende.
 * Il chiamante cancella un'operazione interrompendo il thread che la esegue.
 */
public final class Cancellation {

    private Cancellation() {}

    public static void checkpoint(String nextCall) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Operazione cancellata prima di: " + nextCall);
        }
    }
}
