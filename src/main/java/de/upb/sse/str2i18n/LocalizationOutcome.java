package de.upb.sse.str2i18n;

import de.upb.sse.str2i18n.rewrite.MessageRecord;
import de.upb.sse.str2i18n.rewrite.RewriteResult;
import lombok.Value;

import java.util.List;

@Value
public class LocalizationOutcome {
    RewriteResult rewriteResult;
    boolean importAdded;
    String output;

    public boolean isChanged() {
        return rewriteResult.anyRewriteOccurred();
    }

    public List<MessageRecord> getMessages() {
        return rewriteResult.getMessages();
    }
}
