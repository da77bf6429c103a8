package de.upb.sse.str2i18n.id;

import de.upb.sse.str2i18n.configuration.Str2I18nConfiguration;
import de.upb.sse.str2i18n.script.HanScript;
import de.upb.sse.str2i18n.script.TargetScript;

import java.util.PrimitiveIterator;

/**
 * Derives the short message id used as lookup key and fallback message id of a localized literal.
 * <p>
 * Text containing target-script characters yields the first letters of their phonetic readings,
 * anything else yields its lower-cased ASCII letters and digits. Both stop after {@code maxLength}
 * characters, so different messages sharing a prefix get the same id. Such collisions are not detected.
 */
public class MessageIdGenerator {
    private final TargetScript script;
    private final int maxLength;
    private final String fallbackId;

    public MessageIdGenerator() {
        this(HanScript.INSTANCE, 5, "msg");
    }

    public MessageIdGenerator(Str2I18nConfiguration config) {
        this(HanScript.INSTANCE, config.getMaxIdLength(), config.getFallbackId());
    }

    public MessageIdGenerator(TargetScript script, int maxLength, String fallbackId) {
        this.script = script;
        this.maxLength = maxLength;
        this.fallbackId = fallbackId;
    }

    /**
     * @param text literal text, quotes included or not
     * @return the id, never empty; the fallback id when nothing usable is left
     */
    public String generate(String text) {
        String message = stripQuotes(text);
        if (message.isEmpty()) return fallbackId;

        String id = script.containsAny(message) ? transliterate(message) : asciiPrefix(message);
        if (id.isEmpty() || !isAsciiLetter(id.charAt(0))) return fallbackId;
        return id;
    }

    private String transliterate(String message) {
        StringBuilder id = new StringBuilder();
        PrimitiveIterator.OfInt codePoints = message.codePoints().iterator();
        while (codePoints.hasNext() && id.length() < maxLength) {
            int codePoint = codePoints.nextInt();
            if (!script.contains(codePoint)) continue;
            script.firstLetter(codePoint).ifPresent(id::append);
        }
        return id.toString();
    }

    private String asciiPrefix(String message) {
        StringBuilder id = new StringBuilder();
        for (int i = 0; i < message.length() && id.length() < maxLength; i++) {
            char c = message.charAt(i);
            if (isAsciiLetter(c) || (c >= '0' && c <= '9')) {
                id.append(Character.toLowerCase(c));
            }
        }
        return id.toString();
    }

    /**
     * Removes every leading and trailing double quote, which also unwraps text blocks.
     */
    public static String stripQuotes(String text) {
        if (text == null) return "";
        int begin = 0;
        int end = text.length();
        while (begin < end && text.charAt(begin) == '"') begin++;
        while (end > begin && text.charAt(end - 1) == '"') end--;
        return text.substring(begin, end);
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
