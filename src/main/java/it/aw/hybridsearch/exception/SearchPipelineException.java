package it.aw.hybridsearch.exception;

/**
 * Radice delle eccezioni della pipeline di ingestione e ricerca.
 * Ogni sottoclasse identifica il collaboratore che ha fallito.
 */
public abstract class SearchPipelineException extends RuntimeException {

    protected SearchPipelineException(String message) {
        super(message);
    }

    protected SearchPipelineException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Codice breve esposto nelle risposte di errore dell'API. */
    public abstract String kind();
}
