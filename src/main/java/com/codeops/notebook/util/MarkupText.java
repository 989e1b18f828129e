package com.codeops.notebook.util;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Plain-text helpers for the serialized rich-text documents stored as note content.
 */
public final class MarkupText {

    private static final Pattern BLOCK_TAG = Pattern.compile(
            "<\\s*(br|/p|/div|/li|/h[1-6]|/blockquote|/pre)\\b[^>]*>", Pattern.CASE_INSENSITIVE);
    private static final Pattern TAG = Pattern.compile("<[^>]*>");
    private static final Pattern ENTITY = Pattern.compile("&(?:#([xX][0-9a-fA-F]+|[0-9]+)|([a-zA-Z]+));");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Map<String, String> ENTITIES = Map.of(
            "amp", "&",
            "lt", "<",
            "gt", ">",
            "quot", "\"",
            "apos", "'",
            "nbsp", " "
    );

    private MarkupText() {
    }

    /**
     * Strips tags, decodes common entities and collapses whitespace.
     *
     * @param markup serialized document, may be null
     * @return the visible text, never null
     */
    public static String toPlainText(String markup) {
        if (markup == null || markup.isBlank()) {
            return "";
        }
        String text = BLOCK_TAG.matcher(markup).replaceAll(" ");
        text = TAG.matcher(text).replaceAll("");
        text = decodeEntities(text);
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /**
     * Case-insensitive containment against the plain text of a document.
     */
    public static boolean containsIgnoreCase(String markup, String query) {
        return toPlainText(markup).toLowerCase(Locale.ROOT).contains(query.toLowerCase(Locale.ROOT));
    }

    /**
     * Decodes numeric and named entities in one pass; decoded text is never decoded again.
     */
    private static String decodeEntities(String text) {
        Matcher matcher = ENTITY.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String replacement = matcher.group(1) != null
                    ? decodeNumeric(matcher.group(1), matcher.group())
                    : ENTITIES.getOrDefault(matcher.group(2).toLowerCase(Locale.ROOT), matcher.group());
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static String decodeNumeric(String code, String original) {
        try {
            int codePoint = code.startsWith("x") || code.startsWith("X")
                    ? Integer.parseInt(code.substring(1), 16)
                    : Integer.parseInt(code);
            return Character.isValidCodePoint(codePoint) ? new String(Character.toChars(codePoint)) : original;
        } catch (NumberFormatException e) {
            return original;
        }
    }
}
