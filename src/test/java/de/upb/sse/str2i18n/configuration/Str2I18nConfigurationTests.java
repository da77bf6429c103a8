package de.upb.sse.str2i18n.configuration;

import com.github.javaparser.ParserConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class Str2I18nConfigurationTests {

    @AfterEach
    void clearProperties() {
        System.clearProperty(Str2I18nConfiguration.PROPERTY_PREFIX + "importPath");
        System.clearProperty(Str2I18nConfiguration.PROPERTY_PREFIX + "preserveFormatting");
        System.clearProperty(Str2I18nConfiguration.PROPERTY_PREFIX + "languageLevel");
        System.clearProperty(Str2I18nConfiguration.PROPERTY_PREFIX + "maxIdLength");
    }

    @Test
    @DisplayName("Defaults without system properties")
    void defaults() {
        Str2I18nConfiguration config = Str2I18nConfiguration.fromSystemProperties();

        assertEquals("com.github.i18n.I18n", config.getImportPath());
        assertEquals("I18n", config.getQualifier());
        assertEquals(5, config.getMaxIdLength());
        assertEquals("msg", config.getFallbackId());
        assertTrue(config.isPreserveFormatting());
        assertEquals(ParserConfiguration.LanguageLevel.JAVA_17, config.getLanguageLevel());
    }

    @Test
    @DisplayName("System properties override the defaults")
    void overrides() {
        System.setProperty("str2i18n.importPath", "org.example.Texts");
        System.setProperty("str2i18n.preserveFormatting", "false");
        System.setProperty("str2i18n.languageLevel", "java_11");
        System.setProperty("str2i18n.maxIdLength", "8");

        Str2I18nConfiguration config = Str2I18nConfiguration.fromSystemProperties();

        assertEquals("org.example.Texts", config.getImportPath());
        assertEquals("Texts", config.getQualifier());
        assertFalse(config.isPreserveFormatting());
        assertEquals(ParserConfiguration.LanguageLevel.JAVA_11, config.getLanguageLevel());
        assertEquals(8, config.getMaxIdLength());
    }

    @Test
    @DisplayName("Import path without package is its own qualifier")
    void unqualified_import_path() {
        Str2I18nConfiguration config = new Str2I18nConfiguration();
        config.setImportPath("Texts");
        assertEquals("Texts", config.getQualifier());
    }
}
