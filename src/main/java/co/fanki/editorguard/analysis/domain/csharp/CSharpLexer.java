package co.fanki.editorguard.analysis.domain.csharp;

import co.fanki.editorguard.analysis.domain.SyntaxTrivia;
import co.fanki.editorguard.analysis.domain.TextSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits C# source text into tokens and trivia.
 *
 * <p>Comments and preprocessor directives become {@link SyntaxTrivia};
 * everything else becomes a {@link Token}. String and character literals
 * are single tokens, so directive-like or keyword-like text inside them
 * is never seen as code. The lexer never fails: unterminated comments,
 * literals and directives run to the end of the text.</p>
 *
 * <p>A lexer instance is single use and not thread-safe.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class CSharpLexer {

    /** Byte order mark some editors leave at the start of C# files. */
    private static final char BOM = '\uFEFF';

    /** The kinds of tokens the parser cares about. */
    enum TokenKind {
        IDENTIFIER,
        LITERAL,
        PUNCTUATION
    }

    /**
     * A lexical token.
     *
     * @param kind the token kind
     * @param text the token text, without the {@code @} of verbatim
     *             identifiers
     * @param start the offset of the first character
     * @param end the offset just past the last character
     */
    record Token(TokenKind kind, String text, int start, int end) {

        boolean is(final String value) {
            return kind != TokenKind.LITERAL && text.equals(value);
        }

        boolean isIdentifier() {
            return kind == TokenKind.IDENTIFIER;
        }
    }

    private final String text;

    private final int length;

    private final List<Token> tokens = new ArrayList<>();

    private final List<SyntaxTrivia> trivia = new ArrayList<>();

    private int pos;

    /** Only whitespace seen since the last line break. */
    private boolean atLineStart = true;

    CSharpLexer(final String theText) {
        text = theText;
        length = theText.length();
    }

    List<Token> tokens() {
        return tokens;
    }

    List<SyntaxTrivia> trivia() {
        return trivia;
    }

    /**
     * Lexes the whole text.
     *
     * @return this lexer, for chaining
     */
    CSharpLexer run() {
        while (pos < length) {
            final char c = text.charAt(pos);

            if (c == '\n' || c == '\r') {
                pos++;
                atLineStart = true;
                continue;
            }
            if (Character.isWhitespace(c) || c == BOM) {
                pos++;
                continue;
            }
            if (c == '#' && atLineStart) {
                lexDirective();
                continue;
            }

            atLineStart = false;

            if (c == '/' && peek(1) == '/') {
                lexLineComment();
            } else if (c == '/' && peek(1) == '*') {
                lexBlockComment();
            } else if (startsStringLiteral(pos)) {
                final int start = pos;
                pos = skipStringLiteral(pos);
                addToken(TokenKind.LITERAL, start, pos);
            } else if (c == '\'') {
                final int start = pos;
                pos = skipQuoted(pos, '\'');
                addToken(TokenKind.LITERAL, start, pos);
            } else if (c == '@' && isIdentifierStart(peek(1))) {
                final int start = pos + 1;
                pos = skipIdentifier(start);
                tokens.add(new Token(TokenKind.IDENTIFIER,
                        text.substring(start, pos), start - 1, pos));
            } else if (isIdentifierStart(c)) {
                final int start = pos;
                pos = skipIdentifier(pos);
                addToken(TokenKind.IDENTIFIER, start, pos);
            } else if (Character.isDigit(c)) {
                final int start = pos;
                pos = skipNumber(pos);
                addToken(TokenKind.LITERAL, start, pos);
            } else if (c == ':' && peek(1) == ':') {
                addToken(TokenKind.PUNCTUATION, pos, pos + 2);
                pos += 2;
            } else {
                addToken(TokenKind.PUNCTUATION, pos, pos + 1);
                pos++;
            }
        }
        return this;
    }

    private void addToken(final TokenKind kind, final int start,
            final int end) {
        tokens.add(new Token(kind, text.substring(start, end), start, end));
    }

    private char peek(final int ahead) {
        final int index = pos + ahead;
        return index < length ? text.charAt(index) : '\0';
    }

    private char charAt(final int index) {
        return index < length ? text.charAt(index) : '\0';
    }

    // -- trivia --

    private void lexDirective() {
        final int start = pos;
        final int end = endOfLine(pos);

        int i = skipInlineWhitespace(pos + 1, end);
        final int keywordStart = i;
        while (i < end && Character.isLetter(text.charAt(i))) {
            i++;
        }
        final String keyword = text.substring(keywordStart, i);
        final String argument = stripLineComment(text.substring(i, end))
                .trim();

        trivia.add(SyntaxTrivia.directive(new TextSpan(start, end), keyword,
                argument));
        pos = end;
    }

    private void lexLineComment() {
        final int start = pos;
        pos = endOfLine(pos);
        trivia.add(SyntaxTrivia.comment(new TextSpan(start, pos)));
    }

    private void lexBlockComment() {
        final int start = pos;
        final int close = text.indexOf("*/", pos + 2);
        pos = close < 0 ? length : close + 2;
        trivia.add(SyntaxTrivia.comment(new TextSpan(start, pos)));
    }

    private int endOfLine(final int from) {
        int i = from;
        while (i < length && text.charAt(i) != '\n' && text.charAt(i) != '\r') {
            i++;
        }
        return i;
    }

    private int skipInlineWhitespace(final int from, final int end) {
        int i = from;
        while (i < end && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }

    private static String stripLineComment(final String argument) {
        final int comment = argument.indexOf("//");
        return comment < 0 ? argument : argument.substring(0, comment);
    }

    // -- literals --

    /**
     * Checks whether a string literal starts at an offset, with any of
     * the {@code $}, {@code @}, {@code $@} and {@code @$} prefixes.
     */
    private boolean startsStringLiteral(final int at) {
        return charAt(quoteIndex(at)) == '"';
    }

    private int quoteIndex(final int at) {
        int i = at;
        while (charAt(i) == '$') {
            i++;
        }
        if (charAt(i) == '@') {
            i++;
            while (charAt(i) == '$') {
                i++;
            }
        }
        return i;
    }

    /**
     * Skips a string literal starting at an offset.
     *
     * @return the offset just past the literal
     */
    private int skipStringLiteral(final int at) {
        final int quote = quoteIndex(at);
        final String prefix = text.substring(at, quote);
        final boolean verbatim = prefix.indexOf('@') >= 0;
        final boolean interpolated = prefix.indexOf('$') >= 0;

        if (!verbatim && charAt(quote + 1) == '"' && charAt(quote + 2) == '"') {
            return skipRawString(quote);
        }
        if (verbatim) {
            return skipVerbatimString(quote + 1, interpolated);
        }
        return skipRegularString(quote + 1, interpolated);
    }

    private int skipRegularString(final int from, final boolean interpolated) {
        int i = from;
        while (i < length) {
            final char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == '"') {
                return i + 1;
            } else if (c == '\n' || c == '\r') {
                return i;
            } else if (interpolated && c == '{') {
                i = skipInterpolationHole(i);
            } else {
                i++;
            }
        }
        return length;
    }

    private int skipVerbatimString(final int from, final boolean interpolated) {
        int i = from;
        while (i < length) {
            final char c = text.charAt(i);
            if (c == '"') {
                if (charAt(i + 1) == '"') {
                    i += 2;
                } else {
                    return i + 1;
                }
            } else if (interpolated && c == '{') {
                i = skipInterpolationHole(i);
            } else {
                i++;
            }
        }
        return length;
    }

    private int skipRawString(final int quote) {
        int quotes = 0;
        int i = quote;
        while (charAt(i) == '"') {
            quotes++;
            i++;
        }
        final String delimiter = "\"".repeat(quotes);
        final int close = text.indexOf(delimiter, i);
        if (close < 0) {
            return length;
        }
        int end = close + quotes;
        // A raw literal ends at its longest run of closing quotes.
        while (charAt(end) == '"') {
            end++;
        }
        return end;
    }

    /**
     * Skips an interpolation hole starting at an opening brace.
     *
     * @return the offset just past the hole, or past an escaped brace
     */
    private int skipInterpolationHole(final int open) {
        if (charAt(open + 1) == '{') {
            return open + 2;
        }
        int depth = 0;
        int i = open;
        while (i < length) {
            final char c = text.charAt(i);
            if (c == '{') {
                depth++;
                i++;
            } else if (c == '}') {
                depth--;
                i++;
                if (depth == 0) {
                    return i;
                }
            } else if (startsStringLiteralAt(i)) {
                i = skipStringLiteral(i);
            } else if (c == '\'') {
                i = skipQuoted(i, '\'');
            } else {
                i++;
            }
        }
        return length;
    }

    private boolean startsStringLiteralAt(final int at) {
        final char c = text.charAt(at);
        return (c == '"' || c == '$' || c == '@') && startsStringLiteral(at);
    }

    private int skipQuoted(final int open, final char quote) {
        int i = open + 1;
        while (i < length) {
            final char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == quote) {
                return i + 1;
            } else if (c == '\n' || c == '\r') {
                return i;
            } else {
                i++;
            }
        }
        return length;
    }

    // -- words --

    private static boolean isIdentifierStart(final char c) {
        return c == '_' || Character.isLetter(c);
    }

    private int skipIdentifier(final int from) {
        int i = from;
        while (i < length && (text.charAt(i) == '_'
                || Character.isLetterOrDigit(text.charAt(i)))) {
            i++;
        }
        return i;
    }

    private int skipNumber(final int from) {
        int i = from;
        while (i < length && (Character.isLetterOrDigit(text.charAt(i))
                || text.charAt(i) == '_'
                || (text.charAt(i) == '.'
                        && Character.isDigit(charAt(i + 1))))) {
            i++;
        }
        return i;
    }

}
