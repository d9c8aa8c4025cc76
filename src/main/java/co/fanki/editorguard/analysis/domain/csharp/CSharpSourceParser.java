package co.fanki.editorguard.analysis.domain.csharp;

import co.fanki.editorguard.analysis.domain.DirectiveKind;
import co.fanki.editorguard.analysis.domain.SourceFile;
import co.fanki.editorguard.analysis.domain.SourceParser;
import co.fanki.editorguard.analysis.domain.SyntaxTrivia;
import co.fanki.editorguard.analysis.domain.TextSpan;
import co.fanki.editorguard.analysis.domain.UsingDirective;
import co.fanki.editorguard.analysis.domain.csharp.CSharpLexer.Token;
import co.fanki.editorguard.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * C# implementation of {@link SourceParser}.
 *
 * <p>Lexes the text with {@link CSharpLexer} and then tracks brace
 * nesting to find {@code using} directives. A directive is only
 * recognized where C# allows one: at the top level of the file or
 * directly inside a {@code namespace} body, at the start of a
 * declaration. The supported forms are:</p>
 * <ul>
 *   <li>{@code using UnityEditor;}</li>
 *   <li>{@code using static UnityEditor.EditorGUILayout;}</li>
 *   <li>{@code using Menu = UnityEditor.Menu;}</li>
 *   <li>{@code global using UnityEditor;}</li>
 * </ul>
 *
 * <p>{@code using (...)} statements and {@code using var} declarations do
 * not match these shapes and are skipped, including in top-level
 * programs. A leading {@code global::} qualifier is dropped from the
 * recorded namespace name.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class CSharpSourceParser extends SourceParser {

    private static final Logger LOG = LoggerFactory.getLogger(
            CSharpSourceParser.class);

    private static final String GLOBAL_QUALIFIER = "global::";

    /** Unity, MSBuild and IDE output folders. */
    private static final Set<String> EXCLUDED_DIRS = Set.of(
            "Library", "Temp", "Logs", "obj", "bin", ".git", ".vs",
            ".idea", "node_modules");

    /** {@inheritDoc} */
    @Override
    public String language() {
        return "csharp";
    }

    /** {@inheritDoc} */
    @Override
    protected String fileExtension() {
        return ".cs";
    }

    /** {@inheritDoc} */
    @Override
    protected Set<String> excludedDirectories() {
        return EXCLUDED_DIRS;
    }

    /** {@inheritDoc} */
    @Override
    public SourceFile parse(final String path, final String content) {
        Preconditions.requireNonNull(content, "Source content is required");

        final CSharpLexer lexer = new CSharpLexer(content).run();
        final List<UsingDirective> usings = findUsingDirectives(
                lexer.tokens(), conditionalDirectiveOffsets(lexer.trivia()));

        LOG.trace("Parsed {}: {} tokens, {} trivia, {} usings", path,
                lexer.tokens().size(), lexer.trivia().size(), usings.size());

        return new SourceFile(path, content, lexer.trivia(), usings);
    }

    /**
     * Returns the offsets of the {@code #if}, {@code #elif}, {@code #else}
     * and {@code #endif} directives, in source order.
     */
    private static int[] conditionalDirectiveOffsets(
            final List<SyntaxTrivia> trivia) {
        return trivia.stream()
                .filter(SyntaxTrivia::isDirective)
                .filter(t -> DirectiveKind.fromKeyword(t.directiveKeyword())
                        .isPresent())
                .mapToInt(t -> t.span().start())
                .toArray();
    }

    /**
     * Walks the tokens keeping a stack of open braces, each flagged with
     * whether it opened a namespace body.
     *
     * <p>Every conditional directive starts a new declaration. A branch
     * that is not compiled may hold text that is not C#, and it must not
     * hide a directive following the block.</p>
     */
    private List<UsingDirective> findUsingDirectives(final List<Token> tokens,
            final int[] conditionalOffsets) {
        final List<UsingDirective> result = new ArrayList<>();
        final Deque<Boolean> scopes = new ArrayDeque<>();

        boolean atDeclarationStart = true;
        boolean namespaceHeader = false;
        int nextConditional = 0;
        int i = 0;

        while (i < tokens.size()) {
            final Token token = tokens.get(i);

            while (nextConditional < conditionalOffsets.length
                    && conditionalOffsets[nextConditional] < token.start()) {
                atDeclarationStart = true;
                nextConditional++;
            }

            if (token.is("{")) {
                scopes.push(namespaceHeader);
                namespaceHeader = false;
                atDeclarationStart = true;
                i++;
                continue;
            }
            if (token.is("}")) {
                scopes.poll();
                atDeclarationStart = true;
                i++;
                continue;
            }
            if (token.is(";")) {
                // Closes a file-scoped namespace header as well.
                namespaceHeader = false;
                atDeclarationStart = true;
                i++;
                continue;
            }

            final boolean namespaceLevel = !scopes.contains(Boolean.FALSE);

            if (namespaceLevel && atDeclarationStart) {
                final ParsedUsing parsed = tryParseUsing(tokens, i);
                if (parsed != null) {
                    result.add(parsed.directive());
                    i = parsed.next();
                    continue;
                }
            }
            if (namespaceLevel && token.is("namespace")) {
                namespaceHeader = true;
            }

            atDeclarationStart = false;
            i++;
        }
        return result;
    }

    /** A recognized directive and the index of the token following it. */
    private record ParsedUsing(UsingDirective directive, int next) {
    }

    /** A qualified name and the index of the token following it. */
    private record ParsedName(String text, int tokenCount, int next) {
    }

    private ParsedUsing tryParseUsing(final List<Token> tokens,
            final int start) {

        int i = start;
        boolean global = false;
        if (is(tokens, i, "global") && is(tokens, i + 1, "using")) {
            global = true;
            i++;
        }
        if (!is(tokens, i, "using")) {
            return null;
        }
        i++;

        boolean isStatic = false;
        if (is(tokens, i, "static")) {
            isStatic = true;
            i++;
        }

        final ParsedName name = readQualifiedName(tokens, i);
        if (name == null) {
            return null;
        }
        i = name.next();

        String alias = null;
        String target = name.text();

        if (!isStatic && name.tokenCount() == 1 && is(tokens, i, "=")) {
            alias = name.text();
            final ParsedName aliased = readUntilSemicolon(tokens, i + 1);
            if (aliased == null) {
                return null;
            }
            target = aliased.text();
            i = aliased.next();
        }

        if (!is(tokens, i, ";")) {
            return null;
        }

        final TextSpan span = new TextSpan(tokens.get(start).start(),
                tokens.get(i).end());
        final UsingDirective directive = new UsingDirective(
                stripGlobalQualifier(target), span, isStatic, alias, global);
        return new ParsedUsing(directive, i + 1);
    }

    /**
     * Reads {@code A.B::C<D, E>}-style names.
     *
     * @return the name, or null if no name starts at the index
     */
    private ParsedName readQualifiedName(final List<Token> tokens,
            final int start) {
        if (!isIdentifier(tokens, start)) {
            return null;
        }
        final StringBuilder text = new StringBuilder(tokens.get(start).text());
        int i = start + 1;

        while (i < tokens.size()) {
            if ((is(tokens, i, ".") || is(tokens, i, "::"))
                    && isIdentifier(tokens, i + 1)) {
                text.append(tokens.get(i).text())
                        .append(tokens.get(i + 1).text());
                i += 2;
            } else if (is(tokens, i, "<")) {
                final int close = skipTypeArguments(tokens, i, text);
                if (close < 0) {
                    return null;
                }
                i = close;
            } else {
                break;
            }
        }
        return new ParsedName(text.toString(), i - start, i);
    }

    /**
     * Appends balanced type arguments to the name.
     *
     * @return the index after the closing angle bracket, or -1
     */
    private int skipTypeArguments(final List<Token> tokens, final int open,
            final StringBuilder text) {
        int depth = 0;
        for (int i = open; i < tokens.size(); i++) {
            final Token token = tokens.get(i);
            if (token.is(";") || token.is("{") || token.is("}")) {
                return -1;
            }
            text.append(token.text());
            if (token.is("<")) {
                depth++;
            } else if (token.is(">")) {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
        }
        return -1;
    }

    /**
     * Reads an alias target, which may be any type (tuples, arrays,
     * pointers), up to the terminating semicolon.
     *
     * @return the target, or null if it is empty or not terminated
     */
    private ParsedName readUntilSemicolon(final List<Token> tokens,
            final int start) {
        final StringBuilder text = new StringBuilder();
        int i = start;
        while (i < tokens.size() && !is(tokens, i, ";")) {
            final Token token = tokens.get(i);
            if (token.is("{") || token.is("}") || token.is("=")) {
                return null;
            }
            text.append(token.text());
            if (token.isIdentifier() && isIdentifier(tokens, i + 1)) {
                text.append(' ');
            }
            i++;
        }
        if (i >= tokens.size() || text.length() == 0) {
            return null;
        }
        return new ParsedName(text.toString(), i - start, i);
    }

    private static String stripGlobalQualifier(final String name) {
        return name.startsWith(GLOBAL_QUALIFIER)
                ? name.substring(GLOBAL_QUALIFIER.length())
                : name;
    }

    private static boolean is(final List<Token> tokens, final int index,
            final String value) {
        return index < tokens.size() && tokens.get(index).is(value);
    }

    private static boolean isIdentifier(final List<Token> tokens,
            final int index) {
        return index < tokens.size() && tokens.get(index).isIdentifier();
    }

}
