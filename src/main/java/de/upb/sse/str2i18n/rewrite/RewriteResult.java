package de.upb.sse.str2i18n.rewrite;

import java.util.List;

public class RewriteResult {
    private final List<MessageRecord> messages;

    public RewriteResult(List<MessageRecord> messages) {
        this.messages = List.copyOf(messages);
    }

    public List<MessageRecord> getMessages() {
        return messages;
    }

    public int rewrittenCount() {
        return messages.size();
    }

    /** Whether the unit now needs the localization import. */
    public boolean anyRewriteOccurred() {
        return !messages.isEmpty();
    }
}
