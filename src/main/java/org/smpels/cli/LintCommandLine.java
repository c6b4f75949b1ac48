package org.smpels.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smpels.cli.config.LintConfigLoader;
import org.smpels.cli.config.LintSettings;
import org.smpels.cli.config.LoggingConfigurator;
import org.smpels.cli.report.LintReport;
import org.smpels.mcs.McsAnalyzer;
import org.smpels.mcs.api.AnalysisResult;
import org.smpels.mcs.api.SchemaLoadException;
import org.smpels.mcs.diagnostics.DiagnosticCode;
import org.smpels.mcs.diagnostics.DiagnosticsConfig;
import org.smpels.mcs.schema.CatalogSchemaStore;
import org.smpels.mcs.schema.SchemaStore;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
    name = "smpe-lint",
    mixinStandardHelpOptions = true,
    version = "smpe-lint 0.9.0",
    description = "Validates SMP/E MCS source files and prints a Markdown or JSON report.",
    exitCodeListHeading = "%nExit codes:%n",
    exitCodeList = {
        "0:No errors (and no warnings with --warnings-as-errors).",
        "1:Errors were found.",
        "2:Invalid usage, unreadable input, configuration or catalog failure."
    }
)
public class LintCommandLine implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_LINT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final Logger log = LoggerFactory.getLogger(LintCommandLine.class);

    @Parameters(paramLabel = "FILE", arity = "0..*", description = "MCS files or quoted glob patterns.")
    private List<String> patterns = new ArrayList<>();

    @Option(names = "--json", description = "Print the report as JSON instead of Markdown.")
    private boolean json;

    @Option(names = {"-c", "--config"}, paramLabel = "FILE", description = "Configuration file (HOCON).")
    private File configFile;

    @Option(names = "--disable", paramLabel = "CODE", description = "Switch off a rule, e.g. unknown_operand. Repeatable.")
    private List<String> disabled = new ArrayList<>();

    @Option(names = "--warnings-as-errors", description = "Fail the run on warnings too.")
    private boolean warningsAsErrors;

    @Option(names = "--schema", paramLabel = "FILE", description = "Statement catalog in smpe.json format.")
    private Path schemaFile;

    @Option(names = "--init", paramLabel = "FILE", description = "Write a sample configuration file and exit.")
    private Path initFile;

    @Option(names = {"-v", "--verbose"}, description = "Increase logging on stderr. Repeatable.")
    private boolean[] verbose = new boolean[0];

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final LintConfigLoader configLoader;

    /**
     * Creates the command with the default configuration lookup.
     */
    public LintCommandLine() {
        this(new LintConfigLoader());
    }

    LintCommandLine(LintConfigLoader configLoader) {
        this.configLoader = configLoader;
    }

    @Override
    public Integer call() throws Exception {
        LoggingConfigurator.applyVerbosity(verbose.length);
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (initFile != null) {
            LintConfigLoader.writeSample(initFile);
            out.println("Created " + initFile);
            return EXIT_OK;
        }
        if (patterns.isEmpty()) {
            err.println("No input files given.");
            spec.commandLine().usage(err);
            return EXIT_USAGE;
        }

        Config config = configLoader.load(configFile);
        LoggingConfigurator.configure(config);
        LintSettings settings = configLoader.settings(config);

        DiagnosticsConfig diagnosticsConfig = settings.diagnostics();
        for (String key : disabled) {
            Optional<DiagnosticCode> code = DiagnosticCode.fromKey(key);
            if (code.isEmpty()) {
                err.println("Unknown diagnostic code: " + key);
                return EXIT_USAGE;
            }
            diagnosticsConfig = diagnosticsConfig.withDisabled(code.get());
        }

        McsAnalyzer analyzer = new McsAnalyzer(loadSchema(settings), diagnosticsConfig);
        LintReport.Builder report = new LintReport.Builder(warningsAsErrors || settings.warningsAsErrors());
        boolean unreadable = false;
        for (String file : FilePatterns.expand(patterns)) {
            try {
                AnalysisResult result = analyzer.analyze(Path.of(file));
                report.addFile(file, result.diagnostics());
            } catch (IOException e) {
                err.println("Error reading file " + file + ": " + e.getMessage());
                report.addUnreadable(file);
                unreadable = true;
            }
        }

        LintReport lintReport = report.build();
        if (json) {
            out.println(lintReport.toJson());
            out.flush();
        } else {
            lintReport.printMarkdown(out);
        }
        if (unreadable) {
            return EXIT_USAGE;
        }
        return lintReport.summary().success() ? EXIT_OK : EXIT_LINT_FAILURE;
    }

    private SchemaStore loadSchema(LintSettings settings) throws SchemaLoadException {
        Path schema = schemaFile != null ? schemaFile : settings.schemaFile().orElse(null);
        if (schema == null) {
            return CatalogSchemaStore.bundled();
        }
        log.info("Using statement catalog {}", schema.toAbsolutePath());
        return CatalogSchemaStore.fromFile(schema);
    }

    /**
     * Creates the command line with the linter's exit code conventions.
     * @param command The command instance.
     * @return The configured command line.
     */
    static CommandLine createCommandLine(LintCommandLine command) {
        CommandLine commandLine = new CommandLine(command);
        commandLine.setCommandName("smpe-lint");
        commandLine.setExecutionExceptionHandler((ex, cl, parseResult) -> {
            if (ex instanceof ConfigException) {
                cl.getErr().println("Failed to load or parse configuration: " + ex.getMessage());
            } else if (ex instanceof SchemaLoadException) {
                cl.getErr().println("Failed to load statement catalog: " + ex.getMessage());
            } else {
                cl.getErr().println("Error: " + ex.getMessage());
            }
            log.debug("Command failed", ex);
            return EXIT_USAGE;
        });
        return commandLine;
    }

    public static void main(final String[] args) {
        final int exitCode = createCommandLine(new LintCommandLine()).execute(args);
        System.exit(exitCode);
    }
}
