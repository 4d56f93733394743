package it.aw.hybridsearch.model;

/**
 * Parametri della pipeline di raffinamento della ricerca.
 * <p>
 * I valori di boost sono euristiche calibrate su manuali di riferimento di
 * microcontrollori: vanno ricalibrati per corpus diversi.
 *
 * @param expansionFactor moltiplicatore dei candidati richiesti allo store quando
 *                        rerank o keyword boost sono attivi
 * @param titleBoost      boost per match nella riga di titolo sintetizzata
 * @param keyTermBoost    boost per match nella riga {@code [KEY: ...]}
 * @param bodyBoost       boost per match nel solo corpo del chunk
 */
public record RefinementParams(int expansionFactor, double titleBoost, double keyTermBoost, double bodyBoost) {

    public static final int    DEFAULT_EXPANSION_FACTOR = 5;
    public static final double DEFAULT_TITLE_BOOST      = 0.20;
    public static final double DEFAULT_KEY_TERM_BOOST   = 0.10;
    public static final double DEFAULT_BODY_BOOST       = 0.05;

    public RefinementParams {
        if (expansionFactor < 1) {
            throw new IllegalArgumentException("expansionFactor deve essere >= 1 (ricevuto: " + expansionFactor + ")");
        }
        if (titleBoost < 0 || keyTermBoost < 0 || bodyBoost < 0) {
            throw new IllegalArgumentException("i valori di boost non possono essere negativi");
        }
    }

    public static RefinementParams defaults() {
        return new RefinementParams(DEFAULT_EXPANSION_FACTOR,
                DEFAULT_TITLE_BOOST, DEFAULT_KEY_TERM_BOOST, DEFAULT_BODY_BOOST);
    }
}
