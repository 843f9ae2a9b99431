package org.seanet.cli.config;

import com.typesafe.config.Config;
import org.seanet.compiler.api.OutputKind;

/**
 * The {@code seanet.compiler} section of the configuration.
 *
 * @param outputKind The artifact kind produced when {@code --library} is not given.
 * @param dumpAst Whether to print the AST to standard output.
 * @param launcherSettingsFile The file name of the launcher settings written next to executables.
 */
public record CompilerSettings(OutputKind outputKind, boolean dumpAst, String launcherSettingsFile) {

    private static final String PATH = "seanet.compiler";

    /**
     * Reads the settings from a resolved configuration.
     * @param config The configuration; reference.conf supplies every key.
     * @return The settings.
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type.
     */
    public static CompilerSettings fromConfig(Config config) {
        Config compiler = config.getConfig(PATH);
        return new CompilerSettings(
                compiler.getEnum(OutputKind.class, "output-kind"),
                compiler.getBoolean("dump-ast"),
                compiler.getString("launcher-settings-file"));
    }
}
