package io.ragweave.core.token;

/// Counts whitespace-separated words. Default estimator.
public final class WhitespaceTokenEstimator implements TokenEstimator {

    public static final WhitespaceTokenEstimator INSTANCE = new WhitespaceTokenEstimator();

    @Override
    public int estimate(String text) {
        int count = 0;
        boolean inWord = false;
        for (int i = 0; i < text.length(); i++) {
            if (Character.isWhitespace(text.charAt(i))) {
                inWord = false;
            } else if (!inWord) {
                inWord = true;
                count++;
            }
        }
        return count;
    }
}
