package it.aw.hybridsearch.chunking;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Ripulisce il testo estratto dagli artefatti di impaginazione.
 * <p>
 * Rimuove le intestazioni e i piè di pagina ricorrenti (righe brevi che corrispondono
 * a un pattern di sigla documento e la cui "forma", con le cifre normalizzate, si ripete
 * nel documento), elimina gli spazi finali di ogni riga e comprime le sequenze di tre o
 * più righe vuote in una sola riga vuota.
 * <p>
 * Un numero isolato ("12", "Page 3 of 10") è trattato come numero di pagina solo in un
 * documento a pagine e solo se è la prima o l'ultima riga non vuota della pagina: nel
 * corpo del testo e nei documenti a heading i numeri sono contenuto.
 * Deterministico, senza stato; non fallisce mai.
 */
public class TextNormalizer {

    public static final int DEFAULT_MIN_REPEATS = 2;

    private static final int MAX_HEADER_LENGTH = 100;

    private static final List<Pattern> HEADER_PATTERNS = List.of(
            // "612/709 RM0041 Rev 6"
            Pattern.compile("^\\d+/\\d+\\s+[A-Z]{2,}\\d+\\s+Rev\\s+\\d+$"),
            // "RM0041 Rev 6 612/709"
            Pattern.compile("^[A-Z]{2,}\\d+\\s+Rev\\s+\\d+\\s+\\d+/\\d+$"),
            // "RM0041 Universal synchronous asynchronous receiver transmitter (USART)"
            Pattern.compile("^[A-Z]{2,}\\d{3,}\\s+[A-Za-z].*$")
    );

    // "12", "Page 12", "12/709", "Page 3 of 10"
    private static final Pattern PAGE_NUMBER =
            Pattern.compile("^(?:Page\\s+)?\\d+(?:\\s*(?:/|of)\\s*\\d+)?$", Pattern.CASE_INSENSITIVE);

    private static final Pattern DIGITS          = Pattern.compile("\\d+");
    private static final Pattern TRAILING_SPACES = Pattern.compile("[ \\t]+$", Pattern.MULTILINE);
    private static final Pattern BLANK_RUNS      = Pattern.compile("\\n{3,}");

    private final int minRepeats;

    public TextNormalizer() {
        this(DEFAULT_MIN_REPEATS);
    }

    public TextNormalizer(int minRepeats) {
        this.minRepeats = minRepeats;
    }

    public String normalize(String text) {
        if (text == null || text.isEmpty()) return "";
        return clean(List.of(text), false).get(0);
    }

    /**
     * Normalizza le pagine di uno stesso documento: la ricorrenza di intestazioni e
     * piè di pagina viene contata sull'intero documento.
     */
    public List<String> normalizePages(List<String> pages) {
        return clean(pages, true);
    }

    private List<String> clean(List<String> parts, boolean paged) {
        Map<String, Integer> shapes = new HashMap<>();
        for (String part : parts) {
            String[] lines = lines(part);
            for (int i = 0; i < lines.length; i++) {
                String shape = headerShape(lines[i], paged && isPageEdge(lines, i));
                if (shape != null) shapes.merge(shape, 1, Integer::sum);
            }
        }

        List<String> out = new ArrayList<>(parts.size());
        for (String part : parts) {
            String[] lines = lines(part);
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < lines.length; i++) {
                String shape = headerShape(lines[i], paged && isPageEdge(lines, i));
                if (shape != null && shapes.getOrDefault(shape, 0) >= minRepeats) {
                    sb.append('\n');
                    continue;
                }
                sb.append(lines[i]).append('\n');
            }
            out.add(cleanWhitespace(sb.toString()));
        }
        return out;
    }

    /**
     * Forma della riga con le cifre normalizzate, oppure null se non è un candidato header/footer.
     * Il pattern del numero di pagina vale solo per le righe di bordo pagina.
     */
    private static String headerShape(String line, boolean pageEdge) {
        String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.length() > MAX_HEADER_LENGTH) return null;
        if (pageEdge && PAGE_NUMBER.matcher(trimmed).matches()) {
            return DIGITS.matcher(trimmed).replaceAll("#");
        }
        for (Pattern p : HEADER_PATTERNS) {
            if (p.matcher(trimmed).matches()) {
                return DIGITS.matcher(trimmed).replaceAll("#");
            }
        }
        return null;
    }

    /** Vero se la riga {@code index} è la prima o l'ultima riga non vuota della pagina. */
    private static boolean isPageEdge(String[] lines, int index) {
        int first = 0;
        while (first < lines.length && lines[first].isBlank()) first++;
        int last = lines.length - 1;
        while (last >= 0 && lines[last].isBlank()) last--;
        return index == first || index == last;
    }

    private static String cleanWhitespace(String text) {
        String s = text.replace("\r\n", "\n").replace('\r', '\n');
        s = TRAILING_SPACES.matcher(s).replaceAll("");
        s = BLANK_RUNS.matcher(s).replaceAll("\n\n");
        return s.strip();
    }

    private static String[] lines(String text) {
        return text == null ? new String[0] : text.split("\\r?\\n", -1);
    }
}
