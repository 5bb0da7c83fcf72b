package org.logsim.compiler.internal.i18n;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.ResourceBundle;

/**
 * Internal facade for the user-facing texts of the compiler, kept in the
 * {@code compiler_messages} bundle.
 * <p>
 * Lookups never fall back to the JVM default locale: a locale without its own bundle gets
 * the base texts. Patterns with arguments go through {@link MessageFormat}, so apostrophes
 * in them must be doubled in the bundle.
 */
public final class Messages {

    private static final String BUNDLE_BASE_NAME = "compiler_messages";
    private static final ResourceBundle.Control NO_DEFAULT_LOCALE =
            ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES);

    private static volatile ResourceBundle texts = bundleFor(Locale.ROOT);

    private Messages() {}

    /**
     * Switches the texts to another locale.
     * @param locale The locale; {@link Locale#ROOT} selects the base texts.
     */
    public static void setLocale(Locale locale) {
        texts = bundleFor(locale);
    }

    /**
     * @return The locale of the texts in use; {@link Locale#ROOT} for the base texts.
     */
    public static Locale getLocale() {
        return texts.getLocale();
    }

    /**
     * @param key The key of the text.
     * @return The text, or {@code "!key!"} for an unknown key.
     */
    public static String get(String key) {
        return texts.containsKey(key) ? texts.getString(key) : missing(key);
    }

    /**
     * @param key The key of the pattern.
     * @param args The pattern arguments.
     * @return The formatted text, or {@code "!key!"} for an unknown key.
     */
    public static String get(String key, Object... args) {
        ResourceBundle current = texts;
        if (!current.containsKey(key)) {
            return missing(key);
        }
        return new MessageFormat(current.getString(key), current.getLocale()).format(args);
    }

    private static String missing(String key) {
        return "!" + key + "!";
    }

    private static ResourceBundle bundleFor(Locale locale) {
        return ResourceBundle.getBundle(BUNDLE_BASE_NAME, locale, NO_DEFAULT_LOCALE);
    }
}
