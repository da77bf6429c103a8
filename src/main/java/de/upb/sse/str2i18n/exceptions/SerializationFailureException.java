package de.upb.sse.str2i18n.exceptions;

/**
 * The rewritten unit could not be printed or committed to its destination.
 */
public class SerializationFailureException extends Str2I18nException {
    public SerializationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
