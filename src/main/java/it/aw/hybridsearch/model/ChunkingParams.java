package it.aw.hybridsearch.model;

/**
 * Parametri di chunking per una singola operazione di ingestione.
 * <p>
 * Tutte le dimensioni sono espresse in token (encoding cl100k_base), tranne
 * {@code tocMinChars} che è una soglia in caratteri sul testo ripulito.
 * L'overlap viene distribuito simmetricamente: ogni chunk riceve
 * {@code overlap / 2} token dal precedente e altrettanti dal successivo.
 */
public record ChunkingParams(int chunkSize, int overlap, int tocMinChars, int overviewMinRegisters) {

    public static final int DEFAULT_CHUNK_SIZE             = 500;
    public static final int DEFAULT_OVERLAP                = 50;
    public static final int DEFAULT_TOC_MIN_CHARS          = 50;
    public static final int DEFAULT_OVERVIEW_MIN_REGISTERS = 4;

    /** Costruttore compatto con validazione. */
    public ChunkingParams {
        if (chunkSize < 50) {
            throw new IllegalArgumentException("chunkSize deve essere >= 50 (ricevuto: " + chunkSize + ")");
        }
        if (overlap < 0) {
            throw new IllegalArgumentException("overlap deve essere >= 0 (ricevuto: " + overlap + ")");
        }
        if (overlap >= chunkSize) {
            throw new IllegalArgumentException(
                    "overlap (" + overlap + ") deve essere < chunkSize (" + chunkSize + ")");
        }
        if (tocMinChars < 0) {
            throw new IllegalArgumentException("tocMinChars deve essere >= 0 (ricevuto: " + tocMinChars + ")");
        }
        if (overviewMinRegisters < 1) {
            throw new IllegalArgumentException(
                    "overviewMinRegisters deve essere >= 1 (ricevuto: " + overviewMinRegisters + ")");
        }
    }

    public ChunkingParams(int chunkSize, int overlap) {
        this(chunkSize, overlap, DEFAULT_TOC_MIN_CHARS, DEFAULT_OVERVIEW_MIN_REGISTERS);
    }

    public static ChunkingParams defaults() {
        return new ChunkingParams(DEFAULT_CHUNK_SIZE, DEFAULT_OVERLAP);
    }

    /** Token presi da ciascun vicino durante lo stitching. */
    public int halfOverlap() {
        return overlap / 2;
    }

    /** Stessi limiti di chunk/overlap, soglie euristiche di questa istanza. */
    public ChunkingParams withSizes(int newChunkSize, int newOverlap) {
        return new ChunkingParams(newChunkSize, newOverlap, tocMinChars, overviewMinRegisters);
    }
}
