package co.fanki.editorguard.analysis.domain;

import co.fanki.editorguard.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Abstract strategy for turning source files into {@link SourceFile}s.
 *
 * <p>Subclasses provide the language-specific lexing in
 * {@link #parse(String, String)}. This class handles file discovery under
 * a project root and the loading of a file's text, so every parsed file
 * carries a path relative to the project root with forward slashes.
 * Excluded directories are pruned from the walk, never descended into.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public abstract class SourceParser {

    private static final Logger LOG = LoggerFactory.getLogger(
            SourceParser.class);

    /**
     * Returns the language identifier for this parser.
     *
     * @return the language name (e.g., "csharp")
     */
    public abstract String language();

    /**
     * Returns the extension of the files this parser handles.
     *
     * @return the extension including the dot (e.g., ".cs")
     */
    protected abstract String fileExtension();

    /**
     * Returns the directory names skipped during file discovery.
     *
     * @return the excluded directory names
     */
    protected abstract Set<String> excludedDirectories();

    /**
     * Parses source text.
     *
     * <p>Implementations never fail on malformed input; they return the
     * best parse they can.</p>
     *
     * @param path the file path, may be null for in-memory sources
     * @param content the source text
     * @return the parsed file
     */
    public abstract SourceFile parse(String path, String content);

    /**
     * Discovers all source files under a project root.
     *
     * @param projectRoot the project root directory
     * @return the absolute file paths, sorted
     * @throws IOException if the directory walk fails
     */
    public List<Path> discoverFiles(final Path projectRoot) throws IOException {
        Preconditions.requireNonNull(projectRoot, "Project root is required");

        if (!Files.isDirectory(projectRoot)) {
            LOG.warn("Project root not found: {}", projectRoot);
            return List.of();
        }

        final List<Path> files = new ArrayList<>();
        Files.walkFileTree(projectRoot, new SimpleFileVisitor<>() {

            @Override
            public FileVisitResult preVisitDirectory(final Path dir,
                    final BasicFileAttributes attrs) {
                if (!dir.equals(projectRoot) && excludedDirectories()
                        .contains(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(final Path file,
                    final BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && file.getFileName().toString()
                        .endsWith(fileExtension())) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }
        });
        files.sort(Comparator.naturalOrder());
        return files;
    }

    /**
     * Reads and parses a file of a project.
     *
     * <p>The text is read as UTF-8; bytes that are not valid UTF-8 become
     * replacement characters instead of failing the file.</p>
     *
     * @param projectRoot the project root directory
     * @param file the file to parse, under the project root
     * @return the parsed file, its path relative to the project root
     * @throws IOException if the file cannot be read
     */
    public SourceFile parseFile(final Path projectRoot, final Path file)
            throws IOException {
        Preconditions.requireNonNull(projectRoot, "Project root is required");
        Preconditions.requireNonNull(file, "File is required");

        final String content = decode(Files.readAllBytes(file));
        final String relativePath = projectRoot.relativize(file).toString()
                .replace('\\', '/');
        return parse(relativePath, content);
    }

    /**
     * Decodes file bytes as UTF-8, replacing malformed sequences.
     *
     * <p>Files saved in a legacy code page (e.g. Latin-1 or GBK comments)
     * keep every ASCII character, which is all the analysis looks at.</p>
     */
    private static String decode(final byte[] bytes)
            throws CharacterCodingException {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
    }

}
