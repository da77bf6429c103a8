package de.upb.sse.str2i18n.exceptions;

/**
 * Fatal failure of a localization run. Nothing is written when one is raised.
 */
public class Str2I18nException extends Exception {
    public Str2I18nException(String message) {
        super(message);
    }

    public Str2I18nException(String message, Throwable cause) {
        super(message, cause);
    }
}
