package co.fanki.editorguard.analysis.domain;

import co.fanki.editorguard.shared.Preconditions;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * The configurable names the editor usage check is built around.
 *
 * <p>{@code targetFolders} is optional. When empty every file is
 * analyzed; otherwise only files whose path lies under one of the
 * listed folders are.</p>
 *
 * @param editorOnlyNamespace the namespace forbidden in runtime code
 * @param editorDirectorySegment the directory name holding editor-only code
 * @param editorCompilationSymbol the symbol defined only in editor builds
 * @param targetFolders folders restricting the analysis, may be empty
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record EditorUsageRules(
        String editorOnlyNamespace,
        String editorDirectorySegment,
        String editorCompilationSymbol,
        List<String> targetFolders
) {

    /** Unity's editor API namespace. */
    public static final String DEFAULT_NAMESPACE = "UnityEditor";

    /** Unity compiles folders named {@code Editor} into the editor only. */
    public static final String DEFAULT_DIRECTORY_SEGMENT = "Editor";

    /** Defined by Unity when compiling for the editor. */
    public static final String DEFAULT_COMPILATION_SYMBOL = "UNITY_EDITOR";

    private static final Pattern SEPARATORS = Pattern.compile("[/\\\\]");

    /**
     * Validates and normalizes the rules.
     *
     * @param editorOnlyNamespace the forbidden namespace
     * @param editorDirectorySegment the editor directory name
     * @param editorCompilationSymbol the editor compilation symbol
     * @param targetFolders folders restricting the analysis
     */
    public EditorUsageRules {
        Preconditions.requireNonBlank(editorOnlyNamespace,
                "Editor-only namespace is required");
        Preconditions.requireNonBlank(editorDirectorySegment,
                "Editor directory segment is required");
        Preconditions.requireNonBlank(editorCompilationSymbol,
                "Editor compilation symbol is required");
        editorOnlyNamespace = editorOnlyNamespace.trim();
        editorDirectorySegment = editorDirectorySegment.trim();
        editorCompilationSymbol = editorCompilationSymbol.trim();
        targetFolders = targetFolders == null ? List.of()
                : targetFolders.stream()
                        .filter(folder -> folder != null && !folder.isBlank())
                        .map(EditorUsageRules::normalizeFolder)
                        .toList();
    }

    /**
     * Returns the rules for a Unity project.
     *
     * @return the default rules
     */
    public static EditorUsageRules defaults() {
        return new EditorUsageRules(DEFAULT_NAMESPACE,
                DEFAULT_DIRECTORY_SEGMENT, DEFAULT_COMPILATION_SYMBOL,
                List.of());
    }

    /**
     * Returns a copy of these rules restricted to the given folders.
     *
     * @param folders the target folders
     * @return the new rules
     */
    public EditorUsageRules withTargetFolders(final List<String> folders) {
        return new EditorUsageRules(editorOnlyNamespace,
                editorDirectorySegment, editorCompilationSymbol, folders);
    }

    /**
     * Checks whether a namespace is the editor-only one or nested in it.
     *
     * <p>{@code UnityEditor} and {@code UnityEditor.SceneManagement}
     * match, {@code UnityEditorExtensions} does not.</p>
     *
     * @param namespaceName the imported name, may be null
     * @return true if the namespace is editor-only
     */
    public boolean isEditorOnlyNamespace(final String namespaceName) {
        if (namespaceName == null) {
            return false;
        }
        return namespaceName.equals(editorOnlyNamespace)
                || namespaceName.startsWith(editorOnlyNamespace + ".");
    }

    /**
     * Checks whether a file lives in an editor-only directory.
     *
     * <p>Any directory segment of the path equal to the editor directory
     * name, ignoring case, qualifies; both {@code /} and {@code \}
     * separate segments. The file name itself is not a directory. A
     * missing path never qualifies.</p>
     *
     * @param filePath the file path, may be null
     * @return true if the file is excluded by convention
     */
    public boolean isEditorPath(final String filePath) {
        if (filePath == null || filePath.isBlank()) {
            return false;
        }
        final String[] segments = SEPARATORS.split(filePath);
        for (int i = 0; i < segments.length - 1; i++) {
            if (segments[i].equalsIgnoreCase(editorDirectorySegment)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks whether a file falls under the configured target folders.
     *
     * <p>Always true when no target folder is configured or when the
     * path is missing.</p>
     *
     * @param filePath the file path, may be null
     * @return true if the file should be analyzed
     */
    public boolean isInTargetScope(final String filePath) {
        if (targetFolders.isEmpty() || filePath == null || filePath.isBlank()) {
            return true;
        }
        final String normalized = "/" + normalizeFolder(filePath);
        for (final String folder : targetFolders) {
            if (normalized.contains("/" + folder + "/")) {
                return true;
            }
        }
        return false;
    }

    private static String normalizeFolder(final String folder) {
        String result = folder.trim().replace('\\', '/');
        while (result.startsWith("./")) {
            result = result.substring(2);
        }
        while (result.startsWith("/")) {
            result = result.substring(1);
        }
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    /**
     * Describes the rules for log output.
     *
     * @return a one-line description
     */
    public String describe() {
        return String.format(Locale.ROOT,
                "namespace=%s, directory=%s, symbol=%s, targets=%s",
                editorOnlyNamespace, editorDirectorySegment,
                editorCompilationSymbol, targetFolders);
    }

}
