package it.aw.hybridsearch.model;

/**
 * Esito di un'ingestione.
 */
public enum IngestStatus {
    /** Almeno un chunk scritto nello store. */
    INDEXED,
    /** Documento vuoto o senza contenuto utile dopo normalizzazione e filtro TOC: nessun chunk scritto. */
    NO_CONTENT
}
