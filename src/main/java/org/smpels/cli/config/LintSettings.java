package org.smpels.cli.config;

import org.smpels.mcs.diagnostics.DiagnosticsConfig;

import java.nio.file.Path;
import java.util.Optional;

/**
 * The linter settings after all configuration layers have been merged.
 *
 * @param diagnostics      The rule switches.
 * @param warningsAsErrors Whether warnings fail the run.
 * @param schema           An alternative catalog file, {@code null} for the bundled one.
 */
public record LintSettings(DiagnosticsConfig diagnostics, boolean warningsAsErrors, Path schema) {

    /**
     * @return The alternative catalog file, if one is configured.
     */
    public Optional<Path> schemaFile() {
        return Optional.ofNullable(schema);
    }
}
