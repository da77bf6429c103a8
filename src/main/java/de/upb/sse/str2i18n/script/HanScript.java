package de.upb.sse.str2i18n.script;

import net.sourceforge.pinyin4j.PinyinHelper;

import java.util.Optional;

/**
 * Han ideographs, read through pinyin4j's Hanyu Pinyin table.
 * <p>
 * The table only covers the Basic Multilingual Plane. Han characters from the supplementary planes
 * (CJK Extension B and later) count as Han but contribute no letter, so ids for text containing them
 * can differ from those of tools whose tables read part of Extension B.
 */
public final class HanScript implements TargetScript {
    public static final HanScript INSTANCE = new HanScript();

    private HanScript() {
    }

    @Override
    public boolean contains(int codePoint) {
        return Character.UnicodeScript.of(codePoint) == Character.UnicodeScript.HAN;
    }

    @Override
    public Optional<Character> firstLetter(int codePoint) {
        // pinyin4j only covers the BMP
        if (!contains(codePoint) || !Character.isBmpCodePoint(codePoint)) return Optional.empty();

        String[] readings = PinyinHelper.toHanyuPinyinStringArray((char) codePoint);
        if (readings == null || readings.length == 0) return Optional.empty();

        // polyphonic characters: the table lists the common reading first
        String reading = readings[0];
        if (reading == null || reading.isEmpty()) return Optional.empty();

        char letter = Character.toLowerCase(reading.charAt(0));
        return isAsciiLetter(letter) ? Optional.of(letter) : Optional.empty();
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
