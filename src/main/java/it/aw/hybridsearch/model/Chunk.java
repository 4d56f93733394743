package it.aw.hybridsearch.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Chunk di una sezione, dalla creazione nel RecursiveChunker fino all'embedding.
 * <p>
 * Il corpo ({@code body}) è immutabile; titolo e key term vengono aggiunti
 * dall'annotatore, le regioni di overlap dall'OverlapStitcher. Dopo {@link #freeze()}
 * nessuna modifica è più ammessa: il testo restituito da {@link #text()} è quello
 * che viene inviato all'embedding model e salvato nello store.
 */
public final class Chunk {

    private final Section section;
    private final int ordinal;
    private final String body;
    private final int units;
    private final Map<String, String> userMetadata;

    private int index;
    private ChunkKind kind = ChunkKind.REGULAR;
    private String title;
    private String keyTerms;
    private String leadingOverlap;
    private String trailingOverlap;
    private boolean frozen;

    public Chunk(Section section, int ordinal, String body, int units, Map<String, String> userMetadata) {
        this.section = Objects.requireNonNull(section, "section");
        this.ordinal = ordinal;
        this.body = Objects.requireNonNull(body, "body");
        this.units = units;
        this.userMetadata = userMetadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(userMetadata));
    }

    public Section section()                  { return section; }
    public String documentId()                { return section.documentId(); }
    public int ordinal()                      { return ordinal; }
    public String body()                      { return body; }
    public int units()                        { return units; }
    public Map<String, String> userMetadata() { return userMetadata; }
    public int index()                        { return index; }
    public ChunkKind kind()                   { return kind; }
    public String title()                     { return title; }
    public String keyTerms()                  { return keyTerms; }
    public String leadingOverlap()            { return leadingOverlap; }
    public String trailingOverlap()           { return trailingOverlap; }
    public boolean isFrozen()                 { return frozen; }

    /** Posizione 0-based del chunk nell'intero documento. */
    public void setIndex(int index) {
        checkMutable();
        this.index = index;
    }

    public void annotate(ChunkKind kind, String title, String keyTerms) {
        checkMutable();
        this.kind = Objects.requireNonNull(kind, "kind");
        this.title = title;
        this.keyTerms = keyTerms;
    }

    public void stitch(String leadingOverlap, String trailingOverlap) {
        checkMutable();
        this.leadingOverlap = leadingOverlap;
        this.trailingOverlap = trailingOverlap;
    }

    public Chunk freeze() {
        this.frozen = true;
        return this;
    }

    /** Testo annotato senza overlap: titolo, key term, corpo. */
    public String annotatedText() {
        StringBuilder header = new StringBuilder();
        if (title != null) header.append(title).append('\n');
        if (keyTerms != null) header.append(keyTerms).append('\n');
        if (header.length() == 0) return body;
        return header.append('\n').append(body).toString();
    }

    /** Testo completo da indicizzare, overlap incluso. */
    public String text() {
        List<String> parts = new ArrayList<>(3);
        if (leadingOverlap != null) parts.add(AnnotationFormat.leadingOverlap(leadingOverlap));
        parts.add(annotatedText());
        if (trailingOverlap != null) parts.add(AnnotationFormat.trailingOverlap(trailingOverlap));
        return String.join(AnnotationFormat.PART_SEPARATOR, parts);
    }

    /** Caratteri iniziali di {@link #text()} occupati dall'overlap del chunk precedente, separatore incluso. */
    public int leadingOverlapLength() {
        if (leadingOverlap == null) return 0;
        return AnnotationFormat.leadingOverlap(leadingOverlap).length() + AnnotationFormat.PART_SEPARATOR.length();
    }

    /** Caratteri finali di {@link #text()} occupati dall'overlap del chunk successivo, separatore incluso. */
    public int trailingOverlapLength() {
        if (trailingOverlap == null) return 0;
        return AnnotationFormat.trailingOverlap(trailingOverlap).length() + AnnotationFormat.PART_SEPARATOR.length();
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("chunk " + index + " di " + documentId() + " già congelato");
        }
    }

    @Override
    public String toString() {
        return "Chunk{" + documentId() + "#" + index + ", kind=" + kind + ", units=" + units + "}";
    }
}
