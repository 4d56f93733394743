package it.aw.hybridsearch.exception;

/**
 * La dimensione di un vettore non coincide con quella dello store: l'embedding
 * provider in uso non è compatibile con i vettori già indicizzati.
 */
public class IncompatibleEmbeddingException extends SearchPipelineException {

    private final int expected;
    private final int actual;

    public IncompatibleEmbeddingException(int expected, int actual) {
        super("Embedding provider incompatibile: lo store contiene vettori di dimensione "
                + expected + ", ricevuto un vettore di dimensione " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }

    @Override
    public String kind() {
        return "INCOMPATIBLE_EMBEDDING";
    }
}
