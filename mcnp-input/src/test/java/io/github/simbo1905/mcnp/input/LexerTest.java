package io.github.simbo1905.mcnp.input;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LexerTest extends InputTestBase {

    private static List<TokenType> types(LexerProfile profile, String text) {
        return new Lexer(profile).lex(text).tokens().stream()
                .map(Token::type)
                .filter(type -> type != TokenType.SPACE)
                .toList();
    }

    @Test
    void cellRecordTokens() {
        assertThat(types(LexerProfile.CELL, "10 0 -1 2 imp:n=1")).containsExactly(
                TokenType.NUMBER, TokenType.NULL, TokenType.NUMBER, TokenType.NUMBER,
                TokenType.KEYWORD, TokenType.COLON, TokenType.PARTICLE, TokenType.EQUALS, TokenType.NUMBER);
    }

    @Test
    void shortcutsAreRecognised() {
        assertThat(types(LexerProfile.DATA, "vol 1 4r 2j i 3ilog")).containsExactly(
                TokenType.KEYWORD, TokenType.NUMBER, TokenType.NUM_REPEAT, TokenType.NUM_JUMP,
                TokenType.INTERPOLATE, TokenType.NUM_LOG_INTERPOLATE);
    }

    @Test
    void multiplyWinsOverNumber() {
        assertThat(types(LexerProfile.DATA, "1 2m")).containsExactly(TokenType.NUMBER, TokenType.NUM_MULTIPLY);
    }

    @Test
    void isotopesAreNotNumbers() {
        assertThat(types(LexerProfile.DATA, "1001.80c 2 8016 1")).containsExactly(
                TokenType.ZAID, TokenType.NUMBER, TokenType.NUMBER, TokenType.NUMBER);
    }

    @Test
    void surfaceProfileReadsSurfaceTypes() {
        assertThat(types(LexerProfile.SURFACE, "1 pz 0")).containsExactly(
                TokenType.NUMBER, TokenType.SURFACE_TYPE, TokenType.NULL);
        assertThat(types(LexerProfile.CELL, "p")).containsExactly(TokenType.PARTICLE);
    }

    @Test
    void commentsKeepTheirText() {
        final var tokens = new Lexer(LexerProfile.CELL).lex("c a comment\n1 0 -1 $ inside").tokens();
        assertThat(tokens.get(0).type()).isEqualTo(TokenType.COMMENT);
        assertThat(tokens.get(0).text()).isEqualTo("c a comment");
        final Token last = tokens.get(tokens.size() - 1);
        assertThat(last.type()).isEqualTo(TokenType.DOLLAR_COMMENT);
        assertThat(last.text()).isEqualTo("$ inside");
        assertThat(last.line()).isEqualTo(2);
    }

    @Test
    void concatenatedTextIsEveryCharacter() {
        final String text = "10 1 -2.7 -1 2 #(3 : 4) imp:n=1 $ cell";
        final var sb = new StringBuilder();
        new Lexer(LexerProfile.CELL).lex(text).tokens().forEach(token -> sb.append(token.text()));
        assertThat(sb.toString()).isEqualTo(text);
    }

    @Test
    void unknownCharactersAreReportedAndSkipped() {
        final var result = new Lexer(LexerProfile.CELL).lex("1 \" 2");
        assertThat(result.problems()).hasSize(1);
        assertThat(result.problems().get(0).token().text()).isEqualTo("\"");
        assertThat(result.problems().get(0).column()).isEqualTo(2);
        assertThat(result.tokens()).extracting(Token::text).containsExactly("1", " ", " ", "2");
    }
}
