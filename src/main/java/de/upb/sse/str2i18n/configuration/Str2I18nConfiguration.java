package de.upb.sse.str2i18n.configuration;

import com.github.javaparser.ParserConfiguration;
import lombok.*;

@Getter
@Setter
@ToString
@NoArgsConstructor
public class Str2I18nConfiguration {
    public static final String PROPERTY_PREFIX = "str2i18n.";

    // Localization dependency, imported once a literal was rewritten
    private String importPath = "com.github.i18n.I18n";

    private int maxIdLength = 5;
    private String fallbackId = "msg";

    private boolean preserveFormatting = true;
    private ParserConfiguration.LanguageLevel languageLevel = ParserConfiguration.LanguageLevel.JAVA_17;

    // Names making up the structured localization call
    private String localizerMethod = "localizer";
    private String localizeMethod = "mustLocalize";
    private String configType = "LocalizeConfig";
    private String messageType = "Message";
    private String messageIdKey = "messageId";
    private String defaultMessageKey = "defaultMessage";
    private String idKey = "id";
    private String fallbackKey = "other";

    /**
     * Simple name of the localization dependency, used to qualify the generated call.
     */
    public String getQualifier() {
        int lastDot = importPath.lastIndexOf('.');
        return lastDot == -1 ? importPath : importPath.substring(lastDot + 1);
    }

    /**
     * Defaults overridden by {@code str2i18n.*} system properties where present.
     */
    public static Str2I18nConfiguration fromSystemProperties() {
        Str2I18nConfiguration config = new Str2I18nConfiguration();

        String importPath = System.getProperty(PROPERTY_PREFIX + "importPath", "");
        if (!importPath.isBlank()) config.setImportPath(importPath.trim());

        String preserve = System.getProperty(PROPERTY_PREFIX + "preserveFormatting", "");
        if (!preserve.isBlank()) config.setPreserveFormatting(Boolean.parseBoolean(preserve.trim()));

        String level = System.getProperty(PROPERTY_PREFIX + "languageLevel", "");
        if (!level.isBlank()) {
            config.setLanguageLevel(ParserConfiguration.LanguageLevel.valueOf(level.trim().toUpperCase()));
        }

        String maxIdLength = System.getProperty(PROPERTY_PREFIX + "maxIdLength", "");
        if (!maxIdLength.isBlank()) config.setMaxIdLength(Integer.parseInt(maxIdLength.trim()));

        return config;
    }
}
