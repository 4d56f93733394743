package it.aw.hybridsearch.chunking;

import it.aw.hybridsearch.model.Chunk;
import it.aw.hybridsearch.model.ChunkingParams;
import it.aw.hybridsearch.model.Section;
import it.aw.hybridsearch.reader.ExtractedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Pipeline di ingestione di un documento, dal testo grezzo ai chunk pronti per l'embedding.
 * <p>
 * Stadi:
 * <ol>
 *   <li>Normalizzazione: TextNormalizer rimuove header/footer ricorrenti</li>
 *   <li>Sezioni: per heading (Markdown/testo) o per pagina (PDF)</li>
 *   <li>Filtro TOC</li>
 *   <li>Chunking ricorsivo per sezione</li>
 *   <li>Classificazione e annotazione</li>
 *   <li>Overlap stitching sull'intero documento</li>
 * </ol>
 * Pura e sincrona: nessuno stato condiviso tra invocazioni, documenti diversi possono
 * essere processati in parallelo.
 */
public class ChunkingPipeline {

    private static final Logger log = LoggerFactory.getLogger(ChunkingPipeline.class);

    /** Chunk congelati e sezioni che li hanno prodotti. */
    public record Result(List<Section> sections, List<Chunk> chunks) {
        public boolean isEmpty() {
            return chunks.isEmpty();
        }
    }

    private final TextNormalizer normalizer;
    private final SectionSplitter splitter;
    private final RecursiveChunker chunker;
    private final OverlapStitcher stitcher;

    public ChunkingPipeline(TokenCounter tokens) {
        this(new TextNormalizer(), new SectionSplitter(), new RecursiveChunker(tokens), new OverlapStitcher(tokens));
    }

    public ChunkingPipeline(TextNormalizer normalizer, SectionSplitter splitter,
                            RecursiveChunker chunker, OverlapStitcher stitcher) {
        this.normalizer = normalizer;
        this.splitter = splitter;
        this.chunker = chunker;
        this.stitcher = stitcher;
    }

    public Result process(ExtractedDocument document, ChunkingParams params, Map<String, String> userMetadata) {
        String documentId = document.source();

        List<Section> sections;
        if (document.paged()) {
            sections = splitter.perPage(documentId, normalizer.normalizePages(document.parts()));
        } else {
            sections = splitter.split(documentId, normalizer.normalize(String.join("\n", document.parts())));
        }
        int detected = sections.size();
        sections = new TocFilter(params.tocMinChars()).filter(sections);
        log.debug("{}: {} sezioni rilevate, {} dopo il filtro TOC", documentId, detected, sections.size());

        ChunkAnnotator annotator = new ChunkAnnotator(params.overviewMinRegisters());
        List<Chunk> chunks = new ArrayList<>();
        for (Section section : sections) {
            for (Chunk chunk : chunker.chunk(section, params.chunkSize(), userMetadata)) {
                chunk.setIndex(chunks.size());
                annotator.annotate(chunk);
                chunks.add(chunk);
            }
        }
        stitcher.stitch(chunks, params.halfOverlap());
        chunks.forEach(Chunk::freeze);

        log.debug("{}: {} chunk prodotti (chunkSize={}, overlap={})",
                documentId, chunks.size(), params.chunkSize(), params.overlap());
        return new Result(List.copyOf(sections), List.copyOf(chunks));
    }
}
