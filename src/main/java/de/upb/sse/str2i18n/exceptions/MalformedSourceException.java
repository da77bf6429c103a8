package de.upb.sse.str2i18n.exceptions;

import java.util.Collections;
import java.util.List;

/**
 * The parser could not build a compilation unit from the source text.
 */
public class MalformedSourceException extends Str2I18nException {
    private final List<String> problems;

    public MalformedSourceException(String message, List<String> problems) {
        super(message + (problems.isEmpty() ? "" : ": " + String.join("; ", problems)));
        this.problems = List.copyOf(problems);
    }

    public MalformedSourceException(String message, Throwable cause) {
        super(message, cause);
        this.problems = Collections.emptyList();
    }

    public List<String> getProblems() {
        return problems;
    }
}
