package it.aw.hybridsearch.exception;

/**
 * Fallimento del reranker, oppure backend di rerank richiesto ma non configurato.
 */
public class RerankFailureException extends SearchPipelineException {

    public RerankFailureException(String message) {
        super(message);
    }

    public RerankFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String kind() {
        return "RERANK_FAILURE";
    }
}
