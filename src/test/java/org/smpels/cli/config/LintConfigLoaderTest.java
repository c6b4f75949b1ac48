package org.smpels.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.smpels.mcs.diagnostics.DiagnosticCode;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the layered configuration lookup of the linter.
 */
public class LintConfigLoaderTest {

    @TempDir
    Path workDir;

    @TempDir
    Path homeDir;

    @Test
    @Tag("unit")
    void classpathDefaultsApplyWithoutFiles() {
        LintConfigLoader loader = new LintConfigLoader(workDir, homeDir);

        LintSettings settings = loader.settings(loader.load(null));

        assertThat(settings.warningsAsErrors()).isFalse();
        assertThat(settings.schemaFile()).isEmpty();
        assertThat(settings.diagnostics().disabledCodes()).isEmpty();
    }

    /**
     * Verifies the precedence of the file layers: explicit file over working directory over home directory.
     */
    @Test
    @Tag("unit")
    void fileLayersOverrideInOrder() throws IOException {
        // Arrange
        Files.writeString(homeDir.resolve(LintConfigLoader.CONFIG_FILE_NAME), """
                smpe.lint.warnings-as-errors = true
                smpe.lint.diagnostics.unknown_operand = false
                smpe.lint.schema = "/home/catalog.json"
                """);
        Files.writeString(workDir.resolve(LintConfigLoader.CONFIG_FILE_NAME), """
                smpe.lint.diagnostics.missing_terminator = false
                smpe.lint.schema = "/work/catalog.json"
                """);
        Path explicit = workDir.resolve("explicit.conf");
        Files.writeString(explicit, "smpe.lint.warnings-as-errors = false\n");
        LintConfigLoader loader = new LintConfigLoader(workDir, homeDir);

        // Act
        LintSettings settings = loader.settings(loader.load(explicit.toFile()));

        // Assert
        assertThat(settings.warningsAsErrors()).isFalse();
        assertThat(settings.schemaFile()).contains(Path.of("/work/catalog.json"));
        assertThat(settings.diagnostics().disabledCodes())
                .containsExactlyInAnyOrder(DiagnosticCode.UNKNOWN_OPERAND, DiagnosticCode.MISSING_TERMINATOR);
    }

    @Test
    @Tag("unit")
    void missingExplicitFileFails() {
        LintConfigLoader loader = new LintConfigLoader(workDir, homeDir);

        assertThatThrownBy(() -> loader.load(workDir.resolve("absent.conf").toFile()))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    @Tag("unit")
    void malformedFileFails() throws IOException {
        Files.writeString(workDir.resolve(LintConfigLoader.CONFIG_FILE_NAME), "smpe.lint { = broken");
        LintConfigLoader loader = new LintConfigLoader(workDir, homeDir);

        assertThatThrownBy(() -> loader.load(null)).isInstanceOf(ConfigException.class);
    }

    @Test
    @Tag("unit")
    void sampleListsEveryRuleAndLoadsBack() throws IOException {
        // Arrange
        Path sample = workDir.resolve("sample.conf");

        // Act
        LintConfigLoader.writeSample(sample);
        Config config = new LintConfigLoader(workDir, homeDir).load(sample.toFile());

        // Assert
        String text = Files.readString(sample);
        for (DiagnosticCode code : DiagnosticCode.values()) {
            assertThat(text).contains(code.key() + " = true");
        }
        assertThat(config.getBoolean("smpe.lint.warnings-as-errors")).isFalse();
        assertThatThrownBy(() -> LintConfigLoader.writeSample(sample)).isInstanceOf(FileAlreadyExistsException.class);
    }
}
