package org.smpels.mcs.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public interface for parsing and validating SMP/E MCS source.
 */
public interface IMcsAnalyzer {

    /**
     * Parses and validates the given document text.
     * Malformed input never raises an exception; every problem is reported as a finding.
     *
     * @param text The full document text.
     * @return The document tree and its findings.
     */
    AnalysisResult analyze(String text);

    /**
     * Parses and validates a document given as individual lines.
     *
     * @param lines The lines of the document, without line terminators.
     * @return The document tree and its findings.
     */
    default AnalysisResult analyze(List<String> lines) {
        return analyze(String.join("\n", lines));
    }

    /**
     * Reads a UTF-8 file and analyzes its content.
     *
     * @param path The path to the MCS source file.
     * @return The document tree and its findings.
     * @throws IOException if the file cannot be read.
     */
    default AnalysisResult analyze(Path path) throws IOException {
        return analyze(Files.readString(path, StandardCharsets.UTF_8));
    }
}
