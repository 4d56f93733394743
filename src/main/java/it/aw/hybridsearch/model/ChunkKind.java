package it.aw.hybridsearch.model;

/**
 * Classificazione strutturale di un chunk. Ogni chunk ricade in esattamente una categoria.
 */
public enum ChunkKind {
    /** Testo generico. */
    REGULAR,
    /** Definizione completa di un registro: tabella dei bit field + address offset. */
    REGISTER_DEFINITION,
    /** Elenco/panoramica di molti registri senza definizione. */
    OVERVIEW
}
