package de.upb.sse.str2i18n.script;

import java.util.Optional;

/**
 * Character class whose presence in a string literal makes it a localization candidate,
 * together with the phonetic table used to derive message ids from it.
 */
public interface TargetScript {

    /**
     * @param codePoint Unicode code point
     * @return true if the code point belongs to the script
     */
    boolean contains(int codePoint);

    /**
     * First letter of the code point's phonetic reading, lower-case.
     *
     * @param codePoint Unicode code point of the script
     * @return the letter, empty if the table has no reading for it
     */
    Optional<Character> firstLetter(int codePoint);

    default boolean containsAny(String text) {
        return text.codePoints().anyMatch(this::contains);
    }
}
