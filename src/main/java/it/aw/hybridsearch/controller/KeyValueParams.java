package it.aw.hybridsearch.controller;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsing dei parametri ripetuti {@code chiave=valore} ({@code meta}, {@code filter}).
 */
final class KeyValueParams {

    private KeyValueParams() {}

    static Map<String, String> parse(String paramName, List<String> values) {
        Map<String, String> result = new LinkedHashMap<>();
        if (values == null) return result;
        for (String value : values) {
            int eq = value.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException(
                        "Parametro '" + paramName + "' non valido: atteso chiave=valore, ricevuto '" + value + "'");
            }
            result.put(value.substring(0, eq).trim(), value.substring(eq + 1).trim());
        }
        return result;
    }
}
