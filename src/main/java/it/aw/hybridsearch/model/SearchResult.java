package it.aw.hybridsearch.model;

/**
 * Risultato di una ricerca ibrida.
 * Contiene il testo del chunk, il documento di origine, il punteggio finale
 * (eventualmente riscritto dal reranker e incrementato dal keyword boost)
 * e i metadati di posizione (pagina o sezione) per contestualizzare il risultato.
 */
public record SearchResult(
        double    score,
        double    baseScore,     // similarità coseno restituita dallo store
        double    boost,         // somma dei boost keyword applicati (0 se disattivato)
        String    text,          // finestra di testo del chunk (troncata per la visualizzazione)
        String    source,
        String    documentId,
        Integer   page,          // pagina del chunk (null per non-PDF)
        String    section,       // heading della sezione ("" per PDF e preambolo)
        String    sectionPath,
        ChunkKind kind
) {}
