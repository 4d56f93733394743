package it.aw.hybridsearch.search;

import it.aw.hybridsearch.model.Candidate;

import java.util.List;
import java.util.Map;

/**
 * Sorgente dei candidati di una query: embedding della query e ricerca vettoriale.
 */
public interface CandidateSource {

    /**
     * Restituisce al massimo {@code maxResults} candidati in ordine di similarità
     * decrescente, con {@code originalRank} pari alla posizione nella lista.
     */
    List<Candidate> retrieve(String query, int maxResults, Map<String, String> filter);
}
