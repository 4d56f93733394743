package it.aw.hybridsearch.exception;

/**
 * Fallimento di lettura o scrittura sull'embedding store.
 */
public class VectorStoreFailureException extends SearchPipelineException {

    public VectorStoreFailureException(String message) {
        super(message);
    }

    public VectorStoreFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String kind() {
        return "STORE_FAILURE";
    }
}
