package com.consular.network.model;

import java.text.Normalizer;
import java.util.Locale;

/**
 * Normalizes locale-specific labels stored on source records ("Élevé", "critique", "HIGH")
 * into a lowercase, accent-free form that the tier enums can match against.
 */
final class SourceLabels {

    private SourceLabels() {}

    static String normalize(String label) {
        if (label == null) return "";
        String decomposed = Normalizer.normalize(label.trim(), Normalizer.Form.NFD);
        return decomposed.replaceAll("\\p{M}", "").toLowerCase(Locale.ROOT);
    }
}
