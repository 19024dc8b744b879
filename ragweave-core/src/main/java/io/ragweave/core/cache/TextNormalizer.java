package io.ragweave.core.cache;

import java.text.Normalizer;
import java.util.regex.Pattern;

/// Canonical text form used in cache fingerprints.
///
/// Applies Unicode NFC, trims and collapses every whitespace run to a single
/// space. Case is preserved.
public final class TextNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextNormalizer() {}

    /// Normalizes text for fingerprinting.
    ///
    /// @param text raw text, not null
    /// @return normalized text, never null
    public static String normalize(String text) {
        String nfc = Normalizer.normalize(text, Normalizer.Form.NFC);
        return WHITESPACE.matcher(nfc.strip()).replaceAll(" ");
    }
}
