package org.smpels.cli;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Expands the file arguments of the linter. Quoted glob patterns are matched against the file names
 * of their directory; plain names and patterns without matches are kept as given, so that reading
 * them reports the problem.
 */
final class FilePatterns {

    private FilePatterns() {}

    /**
     * @param arguments The command line arguments.
     * @return The files to check, without duplicates, in argument order (matches of one pattern sorted).
     * @throws IOException if a directory cannot be listed.
     */
    static List<String> expand(List<String> arguments) throws IOException {
        Set<String> files = new LinkedHashSet<>();
        for (String argument : arguments) {
            if (!isPattern(argument)) {
                files.add(argument);
                continue;
            }
            List<String> matches = match(argument);
            if (matches.isEmpty()) {
                files.add(argument);
            } else {
                files.addAll(matches);
            }
        }
        return new ArrayList<>(files);
    }

    private static List<String> match(String pattern) throws IOException {
        Path path = Path.of(pattern);
        Path directory = path.getParent() == null ? Path.of(".") : path.getParent();
        String namePattern = path.getFileName().toString();
        List<String> matches = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return matches;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, namePattern)) {
            for (Path match : stream) {
                if (Files.isRegularFile(match)) {
                    matches.add(path.getParent() == null ? match.getFileName().toString() : match.toString());
                }
            }
        }
        matches.sort(null);
        return matches;
    }

    private static boolean isPattern(String argument) {
        return argument.indexOf('*') >= 0 || argument.indexOf('?') >= 0 || argument.indexOf('[') >= 0;
    }
}
