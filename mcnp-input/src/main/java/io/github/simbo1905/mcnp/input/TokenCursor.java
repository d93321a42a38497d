package io.github.simbo1905.mcnp.input;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// A position in the token list of one record, with backtracking.
///
/// Rules take a [#mark()] before trying an alternative and [#reset(int)] when it does not apply.
/// The furthest position any rule reached is remembered so a failed parse can point at the token
/// that could not be consumed.
public final class TokenCursor {

    private final List<Token> tokens;
    private final List<ParseProblem> problems = new ArrayList<>();
    private int pos;
    private int furthest;

    public TokenCursor(List<Token> tokens) {
        this.tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens"));
    }

    public int mark() {
        return pos;
    }

    public void reset(int mark) {
        pos = mark;
    }

    public boolean atEnd() {
        return pos >= tokens.size();
    }

    /// The current token, or null at the end.
    public Token peek() {
        return peek(0);
    }

    public Token peek(int ahead) {
        final int at = pos + ahead;
        return at < tokens.size() ? tokens.get(at) : null;
    }

    public boolean at(TokenType type) {
        final Token token = peek();
        return token != null && token.type() == type;
    }

    public boolean atAny(TokenType... types) {
        final Token token = peek();
        if (token == null) {
            return false;
        }
        for (TokenType type : types) {
            if (token.type() == type) {
                return true;
            }
        }
        return false;
    }

    /// Consumes and returns the current token.
    /// @throws IllegalStateException at the end of the tokens
    public Token next() {
        if (atEnd()) {
            throw new IllegalStateException("No more tokens");
        }
        final Token token = tokens.get(pos++);
        furthest = Math.max(furthest, pos);
        return token;
    }

    /// Consumes the current token if it is of `type`.
    public Token accept(TokenType type) {
        return at(type) ? next() : null;
    }

    public Token acceptAny(TokenType... types) {
        return atAny(types) ? next() : null;
    }

    /// Queues a problem that does not stop the parse.
    public void problem(ParseProblem problem) {
        problems.add(Objects.requireNonNull(problem, "problem"));
    }

    public List<ParseProblem> problems() {
        return List.copyOf(problems);
    }

    /// The problem to report when the grammar did not consume the whole record: the first token
    /// no rule could take, or a premature end.
    public ParseProblem stuck(String message) {
        final int at = Math.max(furthest, pos);
        return at < tokens.size() ? ParseProblem.at(message, tokens.get(at)) : ParseProblem.prematureEnd(message);
    }

    public int size() {
        return tokens.size();
    }
}
