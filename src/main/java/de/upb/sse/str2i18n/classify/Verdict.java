package de.upb.sse.str2i18n.classify;

public enum Verdict {
    ELIGIBLE,
    TAG_SLOT,
    CONSTANT_SLOT,
    ALREADY_WRAPPED,
    NO_TARGET_SCRIPT,
    IN_COMMENT;

    public boolean isEligible() {
        return this == ELIGIBLE;
    }
}
