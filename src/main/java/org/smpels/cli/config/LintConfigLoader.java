package org.smpels.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smpels.mcs.diagnostics.DiagnosticCode;
import org.smpels.mcs.diagnostics.DiagnosticsConfig;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Loads the linter configuration.
 * Config load order: System Props > Env Vars > --config file > ./.smpe-lint.conf > ~/.smpe-lint.conf > Classpath defaults.
 */
public class LintConfigLoader {

    /** The file name looked up in the working and home directories. */
    public static final String CONFIG_FILE_NAME = ".smpe-lint.conf";

    static final String WARNINGS_AS_ERRORS = "smpe.lint.warnings-as-errors";
    static final String SCHEMA = "smpe.lint.schema";

    private static final Logger log = LoggerFactory.getLogger(LintConfigLoader.class);

    private final Path workingDirectory;
    private final Path homeDirectory;

    /**
     * Creates a loader that searches the process working directory and the user's home directory.
     */
    public LintConfigLoader() {
        this(Path.of("").toAbsolutePath(), Path.of(System.getProperty("user.home")));
    }

    /**
     * @param workingDirectory The directory searched first for {@value #CONFIG_FILE_NAME}.
     * @param homeDirectory    The directory searched next.
     */
    public LintConfigLoader(Path workingDirectory, Path homeDirectory) {
        this.workingDirectory = workingDirectory;
        this.homeDirectory = homeDirectory;
    }

    /**
     * Merges all configuration layers.
     * @param explicitFile A file given on the command line, or {@code null}.
     * @return The resolved configuration.
     * @throws com.typesafe.config.ConfigException if a file is missing, unreadable or malformed.
     */
    public Config load(File explicitFile) {
        Config files = ConfigFactory.empty();
        if (explicitFile != null) {
            log.info("Using configuration file specified via --config: {}", explicitFile.getAbsolutePath());
            files = ConfigFactory.parseFile(explicitFile, ConfigParseOptions.defaults().setAllowMissing(false));
        }
        File cwdConfigFile = workingDirectory.resolve(CONFIG_FILE_NAME).toFile();
        if (cwdConfigFile.exists()) {
            log.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
            files = files.withFallback(ConfigFactory.parseFile(cwdConfigFile));
        }
        File homeConfigFile = homeDirectory.resolve(CONFIG_FILE_NAME).toFile();
        if (homeConfigFile.exists()) {
            log.info("Using configuration file found in home directory: {}", homeConfigFile.getAbsolutePath());
            files = files.withFallback(ConfigFactory.parseFile(homeConfigFile));
        }
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(files)
                .withFallback(ConfigFactory.load())
                .resolve();
    }

    /**
     * Extracts the linter settings from a merged configuration.
     * @param config The configuration returned by {@link #load(File)}.
     * @return The settings.
     */
    public LintSettings settings(Config config) {
        boolean warningsAsErrors = config.hasPath(WARNINGS_AS_ERRORS) && config.getBoolean(WARNINGS_AS_ERRORS);
        Path schema = null;
        if (config.hasPath(SCHEMA) && !config.getString(SCHEMA).isBlank()) {
            schema = Path.of(config.getString(SCHEMA));
        }
        return new LintSettings(DiagnosticsConfig.fromConfig(config), warningsAsErrors, schema);
    }

    /**
     * Writes a configuration file listing every rule switch with its default.
     * @param target The file to create; an existing file is never overwritten.
     * @throws IOException if the file exists or cannot be written.
     */
    public static void writeSample(Path target) throws IOException {
        StringBuilder sample = new StringBuilder()
                .append("# smpe-lint configuration (HOCON)\n")
                .append("# Place it in the working directory or your home directory as ")
                .append(CONFIG_FILE_NAME).append(", or pass it with --config.\n")
                .append("smpe.lint {\n")
                .append("  # Treat warnings as errors (exit code 1)\n")
                .append("  warnings-as-errors = false\n\n")
                .append("  # Alternative statement catalog in smpe.json format\n")
                .append("  # schema = \"/path/to/smpe.json\"\n\n")
                .append("  # Set a rule to false to switch it off\n")
                .append("  diagnostics {\n");
        for (DiagnosticCode code : DiagnosticCode.values()) {
            sample.append("    ").append(code.key()).append(" = true\n");
        }
        sample.append("  }\n}\n");
        Files.writeString(target, sample, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
    }
}
