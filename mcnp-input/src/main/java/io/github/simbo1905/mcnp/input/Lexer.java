package io.github.simbo1905.mcnp.input;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Splits the text of one record into [Token]s.
///
/// Rules are tried in a fixed order and the first one that matches at the current position wins,
/// so a word such as `1001.80c` is an isotope before it could be a number. Characters no rule
/// accepts are reported as problems and skipped; lexing carries on after them.
public final class Lexer {

    private static final Logger LOG = Logger.getLogger(Lexer.class.getName());

    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    private static final Pattern DOLLAR_COMMENT = Pattern.compile("\\$[^\\n]*");
    private static final Pattern SOURCE_COMMENT = Pattern.compile("sc\\d+[^\\n]*", FLAGS);
    private static final Pattern TALLY_COMMENT = Pattern.compile("fc\\d+[^\\n]*", FLAGS);
    private static final Pattern SPACE = Pattern.compile("\\s+");
    private static final Pattern ZAID = Pattern.compile("\\d{4,6}\\.(?:\\d{2}[a-z]|\\d{3}[a-z]{2})", FLAGS);
    private static final Pattern THERMAL_LAW = Pattern.compile("[a-z][a-z\\d/-]+\\.\\d+[a-z]", FLAGS);
    private static final Pattern MULTIPLY = Pattern.compile(
            "[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:e[+-]?\\d+|[+-]\\d+)?m(?![a-z\\d])", FLAGS);
    private static final Pattern NUMBER_WORD = Pattern.compile("[+-]?\\d+(?![e\\d])[a-z]+", FLAGS);
    private static final Pattern NUMBER = Pattern.compile("[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:e[+-]?\\d+|[+-]\\d+)?", FLAGS);
    private static final Pattern WORD = Pattern.compile("[a-z]+[a-z./]*", FLAGS);
    private static final Pattern PARTICLE_SPECIAL = Pattern.compile("(?:[|+\\-!<>/%^_~@*?]|#\\d*)+");
    private static final Pattern FILE_PATH = Pattern.compile("[^><:\"%,;=&()|?*\\s]+");

    private final LexerProfile profile;

    /// The tokens of one record with the lexical problems met along the way.
    public record Result(List<Token> tokens, List<ParseProblem> problems) {
        public Result {
            tokens = List.copyOf(tokens);
            problems = List.copyOf(problems);
        }
    }

    public Lexer(LexerProfile profile) {
        this.profile = Objects.requireNonNull(profile, "profile");
    }

    public LexerProfile profile() {
        return profile;
    }

    public Result lex(String text) {
        Objects.requireNonNull(text, "text");
        final var tokens = new ArrayList<Token>();
        final var problems = new ArrayList<ParseProblem>();
        final Matcher matcher = SPACE.matcher(text);
        int line = 1;
        int lineStart = 0;
        int pos = 0;
        while (pos < text.length()) {
            final Token token = next(text, pos, line, lineStart, matcher);
            if (token == null) {
                final var bad = new Token(TokenType.FILE_PATH, text.substring(pos, pos + 1), pos, line, pos - lineStart);
                problems.add(ParseProblem.at("Unknown character.", bad));
                StructuredLog.finer(LOG, "lex_unknown", "char", bad.text(), "line", line, "column", bad.column());
                pos++;
                continue;
            }
            tokens.add(token);
            for (int i = pos; i < pos + token.text().length(); i++) {
                if (text.charAt(i) == '\n') {
                    line++;
                    lineStart = i + 1;
                }
            }
            pos += token.text().length();
        }
        StructuredLog.finestSampled(LOG, "lexed", 50, "profile", profile, "tokens", tokens.size(), "problems", problems.size());
        return new Result(tokens, problems);
    }

    private Token next(String text, int pos, int line, int lineStart, Matcher matcher) {
        final char c = text.charAt(pos);
        final int column = pos - lineStart;
        if (c == '#') {
            return new Token(TokenType.COMPLEMENT, "#", pos, line, column);
        }
        String word = match(DOLLAR_COMMENT, matcher, text, pos);
        if (word != null) {
            return new Token(TokenType.DOLLAR_COMMENT, word, pos, line, column);
        }
        if (CommentNode.commentStart(text, lineStart) == pos) {
            return new Token(TokenType.COMMENT, toEndOfLine(text, pos), pos, line, column);
        }
        if (profile.classifierComments() && atLineStart(text, lineStart, pos)) {
            word = match(SOURCE_COMMENT, matcher, text, pos);
            if (word != null) {
                return new Token(TokenType.SOURCE_COMMENT, word, pos, line, column);
            }
            word = match(TALLY_COMMENT, matcher, text, pos);
            if (word != null) {
                return new Token(TokenType.TALLY_COMMENT, word, pos, line, column);
            }
        }
        word = match(SPACE, matcher, text, pos);
        if (word != null) {
            return new Token(TokenType.SPACE, word, pos, line, column);
        }
        word = match(ZAID, matcher, text, pos);
        if (word != null) {
            return new Token(TokenType.ZAID, word, pos, line, column);
        }
        word = match(THERMAL_LAW, matcher, text, pos);
        if (word != null) {
            return new Token(TokenType.THERMAL_LAW, word, pos, line, column);
        }
        word = match(MULTIPLY, matcher, text, pos);
        if (word != null) {
            return new Token(TokenType.NUM_MULTIPLY, word, pos, line, column);
        }
        word = match(NUMBER_WORD, matcher, text, pos);
        if (word != null) {
            final Shortcut shortcut = Shortcut.ofWord(word);
            final TokenType type = shortcut == null ? TokenType.NUMBER_WORD : TokenType.ofShortcut(shortcut, true);
            return new Token(type, word, pos, line, column);
        }
        word = match(NUMBER, matcher, text, pos);
        if (word != null) {
            final boolean zero = FortranNumbers.parseReal(word).orElse(1.0) == 0.0;
            return new Token(zero ? TokenType.NULL : TokenType.NUMBER, word, pos, line, column);
        }
        word = match(WORD, matcher, text, pos);
        if (word != null) {
            final Shortcut shortcut = Shortcut.ofWord(word);
            final TokenType type = shortcut == null ? profile.classifyWord(word) : TokenType.ofShortcut(shortcut, false);
            return new Token(type, word, pos, line, column);
        }
        if (profile.specialParticles()) {
            word = match(PARTICLE_SPECIAL, matcher, text, pos);
            if (word != null) {
                return new Token(TokenType.PARTICLE_SPECIAL, word, pos, line, column);
            }
        }
        final TokenType literal = literal(c);
        if (literal != null) {
            return new Token(literal, String.valueOf(c), pos, line, column);
        }
        word = match(FILE_PATH, matcher, text, pos);
        if (word != null) {
            return new Token(TokenType.FILE_PATH, word, pos, line, column);
        }
        return null;
    }

    private static TokenType literal(char c) {
        return switch (c) {
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            case ':' -> TokenType.COLON;
            case '&' -> TokenType.AMPERSAND;
            case '=' -> TokenType.EQUALS;
            case '*' -> TokenType.ASTERISK;
            case '+' -> TokenType.PLUS;
            case ',' -> TokenType.COMMA;
            default -> null;
        };
    }

    private static String match(Pattern pattern, Matcher matcher, String text, int pos) {
        matcher.usePattern(pattern);
        matcher.region(pos, text.length());
        return matcher.lookingAt() ? matcher.group() : null;
    }

    private static boolean atLineStart(String text, int lineStart, int pos) {
        if (pos - lineStart >= InputConstants.CONTINUE_INDENT) {
            return false;
        }
        for (int i = lineStart; i < pos; i++) {
            if (text.charAt(i) != ' ') {
                return false;
            }
        }
        return true;
    }

    private static String toEndOfLine(String text, int pos) {
        final int end = text.indexOf('\n', pos);
        return end < 0 ? text.substring(pos) : text.substring(pos, end);
    }
}
