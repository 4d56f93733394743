package it.aw.hybridsearch.model;

/**
 * Metadati e anteprima di un singolo chunk indicizzato.
 * <p>
 * {@code page} è valorizzato solo per documenti PDF; {@code section} e
 * {@code sectionPath} solo per documenti strutturati a heading.
 */
public record ChunkInfo(
        int       index,         // posizione 0-based del chunk nel documento
        int       ordinal,       // posizione 0-based del chunk nella sua sezione
        String    section,
        String    sectionPath,
        Integer   page,
        ChunkKind kind,
        int       units,         // token del corpo, overlap escluso
        String    text           // anteprima testo (max 150 caratteri)
) {}
