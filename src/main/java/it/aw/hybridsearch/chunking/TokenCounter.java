package it.aw.hybridsearch.chunking;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingType;
import com.knuddels.jtokkit.api.IntArrayList;

/**
 * Misura le lunghezze in token con l'encoding BPE {@code cl100k_base}.
 * <p>
 * Tutte le dimensioni della pipeline (chunk size, overlap) sono espresse in queste unità.
 * L'istanza è thread-safe e va condivisa.
 */
public class TokenCounter {

    private final Encoding encoding;

    public TokenCounter() {
        this(Encodings.newLazyEncodingRegistry().getEncoding(EncodingType.CL100K_BASE));
    }

    public TokenCounter(Encoding encoding) {
        this.encoding = encoding;
    }

    public int count(String text) {
        if (text == null || text.isEmpty()) return 0;
        return encoding.countTokens(text);
    }

    /** Primi {@code n} token del testo, decodificati. */
    public String head(String text, int n) {
        IntArrayList tokens = encoding.encode(text);
        if (n >= tokens.size()) return text;
        return encoding.decode(slice(tokens, 0, Math.max(n, 0)));
    }

    /** Ultimi {@code n} token del testo, decodificati. */
    public String tail(String text, int n) {
        IntArrayList tokens = encoding.encode(text);
        if (n >= tokens.size()) return text;
        return encoding.decode(slice(tokens, tokens.size() - Math.max(n, 0), tokens.size()));
    }

    private static IntArrayList slice(IntArrayList tokens, int from, int to) {
        IntArrayList out = new IntArrayList(Math.max(to - from, 0));
        for (int i = from; i < to; i++) {
            out.add(tokens.get(i));
        }
        return out;
    }
}
