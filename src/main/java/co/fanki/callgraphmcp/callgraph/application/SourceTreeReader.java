package co.fanki.callgraphmcp.callgraph.application;

import co.fanki.callgraphmcp.shared.DomainException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Reads a server-side C/C++ source tree into one source text.
 *
 * <p>Files whose extension is configured are read in path order and
 * joined with a newline after each one. The character limit is enforced
 * while reading: a file is not loaded when its size alone proves the
 * limit would be exceeded (a UTF-8 byte sequence decodes to at least one
 * char per three bytes), and reading stops at the first file that takes
 * the running total over the limit.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class SourceTreeReader {

    private static final Logger LOG = LoggerFactory.getLogger(
            SourceTreeReader.class);

    /** Upper bound of UTF-8 bytes per decoded char. */
    private static final int MAX_BYTES_PER_CHAR = 3;

    private final List<String> sourceExtensions;

    /**
     * Creates a new SourceTreeReader.
     *
     * @param theSourceExtensions comma-separated file extensions to read
     */
    public SourceTreeReader(
            @Value("${callgraph.analysis.source-extensions:"
                    + ".cpp,.cc,.cxx,.c,.h,.hpp,.hh}")
            final String theSourceExtensions) {
        this.sourceExtensions = Arrays.stream(theSourceExtensions.split(","))
                .map(String::strip)
                .filter(ext -> !ext.isEmpty())
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .toList();
    }

    /**
     * Reads every source file under a directory.
     *
     * @param directory the directory to scan recursively
     * @param maxChars the largest source text accepted, in chars
     * @return the concatenated source text, empty if no file matched
     * @throws DomainException with {@code INVALID_ARGUMENT} if the path is
     *         blank, malformed or not a directory, or the sources exceed
     *         {@code maxChars}; {@code SOURCE_UNREADABLE} if the tree
     *         cannot be read
     */
    public String read(final String directory, final int maxChars) {
        final Path root = toDirectory(directory);
        final List<Path> files = discoverFiles(root);

        LOG.info("Discovered {} source files in {}", files.size(), root);

        final StringBuilder source = new StringBuilder();
        for (final Path file : files) {
            final long remaining = (long) maxChars - source.length();
            if (size(file) > remaining * MAX_BYTES_PER_CHAR) {
                throw tooLarge(root, maxChars);
            }
            source.append(readFile(file)).append('\n');
            if (source.length() > maxChars) {
                throw tooLarge(root, maxChars);
            }
        }
        return source.toString();
    }

    private Path toDirectory(final String directory) {
        if (directory == null || directory.isBlank()) {
            throw DomainException.invalidArgument("Directory is required");
        }
        final Path root;
        try {
            root = Path.of(directory.strip());
        } catch (final InvalidPathException e) {
            throw DomainException.invalidArgument("Invalid directory: "
                    + e.getMessage());
        }
        if (!Files.isDirectory(root)) {
            throw DomainException.invalidArgument("Not a directory: "
                    + directory);
        }
        return root;
    }

    private List<Path> discoverFiles(final Path root) {
        try (Stream<Path> paths = Files.walk(root)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(this::isSourceFile)
                    .sorted()
                    .toList();
        } catch (final IOException | UncheckedIOException e) {
            throw unreadable("Cannot scan " + root, e);
        }
    }

    private boolean isSourceFile(final Path file) {
        final String name = file.getFileName().toString()
                .toLowerCase(Locale.ROOT);
        for (final String extension : sourceExtensions) {
            if (name.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    private static long size(final Path file) {
        try {
            return Files.size(file);
        } catch (final IOException e) {
            throw unreadable("Cannot stat " + file, e);
        }
    }

    private static String readFile(final Path file) {
        try {
            return new String(Files.readAllBytes(file),
                    StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw unreadable("Cannot read " + file, e);
        }
    }

    private static DomainException tooLarge(final Path root,
            final int maxChars) {
        return DomainException.invalidArgument("Sources under " + root
                + " exceed the limit of " + maxChars + " characters");
    }

    private static DomainException unreadable(final String message,
            final Exception cause) {
        return new DomainException(message + ": " + cause.getMessage(),
                DomainException.SOURCE_UNREADABLE, cause);
    }

}
