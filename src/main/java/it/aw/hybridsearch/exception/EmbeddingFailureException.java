package it.aw.hybridsearch.exception;

/**
 * Fallimento della chiamata all'embedding model (rete, quota, timeout).
 */
public class EmbeddingFailureException extends SearchPipelineException {

    public EmbeddingFailureException(String message) {
        super(message);
    }

    public EmbeddingFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String kind() {
        return "EMBEDDING_FAILURE";
    }
}
