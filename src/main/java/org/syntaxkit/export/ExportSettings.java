package org.syntaxkit.export;

import com.typesafe.config.Config;

/**
 * Options for {@link StructJsonExporter}.
 *
 * @param prettyPrint Whether to indent the JSON output over multiple lines.
 * @param escapeHtml  Whether characters such as {@code <} and {@code =} are written as unicode escapes.
 */
public record ExportSettings(boolean prettyPrint, boolean escapeHtml) {

    /** Path of the export block inside the library configuration. */
    public static final String CONFIG_PATH = "syntaxkit.export";

    /**
     * Reads the settings from the {@code syntaxkit.export} block.
     *
     * @param config The resolved configuration, usually from {@link org.syntaxkit.config.ConfigLoader}.
     * @return The settings.
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type.
     */
    public static ExportSettings fromConfig(Config config) {
        Config export = config.getConfig(CONFIG_PATH);
        return new ExportSettings(
                export.getBoolean("pretty-print"),
                export.getBoolean("escape-html"));
    }
}
