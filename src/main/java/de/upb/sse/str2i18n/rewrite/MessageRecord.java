package de.upb.sse.str2i18n.rewrite;

import lombok.Value;

/**
 * A literal that was replaced: its generated id and its default text without quotes.
 */
@Value
public class MessageRecord {
    String id;
    String defaultText;
    int line;
    int column;

    @Override
    public String toString() {
        return id + " <- \"" + defaultText + "\" (" + line + ":" + column + ")";
    }
}
