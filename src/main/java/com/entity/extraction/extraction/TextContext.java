package com.entity.extraction.extraction;

/**
 * Context windows around a mention, as recorded in observations.
 */
public final class TextContext {

    public static final int DEFAULT_WINDOW = 50;

    private TextContext() {
    }

    /**
     * Up to {@code window} characters immediately before {@code start}.
     */
    public static String before(String text, int start, int window) {
        int from = Math.max(0, start - window);
        return text.substring(from, Math.max(from, Math.min(start, text.length())));
    }

    /**
     * Up to {@code window} characters immediately after {@code end}.
     */
    public static String after(String text, int end, int window) {
        int from = Math.min(Math.max(0, end), text.length());
        return text.substring(from, Math.min(text.length(), from + window));
    }
}
