package org.pyp.config;

import com.typesafe.config.Config;

import java.nio.charset.Charset;

/**
 * Typed view of the {@code pyp} block of the configuration.
 *
 * <pre>
 * pyp {
 *   debug = false          # print generated code and the mapped traceback on failures
 *   temp-suffix = ".tmp"   # suffix of the temporary output file, renamed on success
 *   encoding = "UTF-8"     # encoding of templates, output and generated scripts
 * }
 * </pre>
 *
 * @param debug Whether debug output is enabled.
 * @param tempSuffix The suffix of the temporary output file.
 * @param encoding The file encoding.
 */
public record PypSettings(boolean debug, String tempSuffix, Charset encoding) {

    private static final String ROOT = "pyp";

    /**
     * Reads the settings from a resolved configuration that includes {@code reference.conf}.
     * @param config The configuration.
     * @return The settings.
     * @throws com.typesafe.config.ConfigException if a value is missing or has the wrong type.
     */
    public static PypSettings fromConfig(Config config) {
        Config pyp = config.getConfig(ROOT);
        return new PypSettings(
                pyp.getBoolean("debug"),
                pyp.getString("temp-suffix"),
                Charset.forName(pyp.getString("encoding")));
    }

    /**
     * Returns a copy with the debug flag set, used when the command line overrides the configuration.
     * @param enabled The new debug flag.
     * @return The adjusted settings.
     */
    public PypSettings withDebug(boolean enabled) {
        return new PypSettings(enabled, tempSuffix, encoding);
    }
}
