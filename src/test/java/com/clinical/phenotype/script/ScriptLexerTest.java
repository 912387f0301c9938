package com.clinical.phenotype.script;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScriptLexerTest {

    private static List<TokenType> types(String source) {
        return new ScriptLexer(source).tokenize().stream().map(Token::type).toList();
    }

    @Nested
    @DisplayName("Tokens")
    class TokenTests {

        @Test
        @DisplayName("Should tokenize a define with a comparison")
        void testDefineTokens() {
            assertEquals(List.of(TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.COLON,
                            TokenType.IDENTIFIER, TokenType.DOT, TokenType.IDENTIFIER,
                            TokenType.GREATER_EQUAL, TokenType.NUMBER, TokenType.SEMICOLON, TokenType.EOF),
                    types("define High: Ef.value >= 40.5;"));
        }

        @Test
        @DisplayName("Should treat == as =")
        void testDoubleEquals() {
            List<Token> tokens = new ScriptLexer("a == b").tokenize();
            assertEquals(TokenType.EQUAL, tokens.get(1).type());
        }

        @Test
        @DisplayName("Should decode escapes in both quote styles")
        void testStrings() {
            List<Token> tokens = new ScriptLexer("\"say \\\"hi\\\"\" 'it\\'s'").tokenize();
            assertEquals("say \"hi\"", tokens.get(0).text());
            assertEquals("it's", tokens.get(1).text());
        }

        @Test
        @DisplayName("Should not swallow a trailing dot after a number")
        void testNumberFollowedByDot() {
            assertEquals(List.of(TokenType.NUMBER, TokenType.DOT, TokenType.EOF), types("6."));
        }
    }

    @Nested
    @DisplayName("Comments and positions")
    class CommentTests {

        @Test
        @DisplayName("Should skip line and block comments")
        void testComments() {
            assertEquals(List.of(TokenType.IDENTIFIER, TokenType.SEMICOLON, TokenType.EOF),
                    types("// heading\n/* block\n comment */ debug;"));
        }

        @Test
        @DisplayName("Should track line and column")
        void testPositions() {
            List<Token> tokens = new ScriptLexer("debug;\n  limit 5;").tokenize();
            Token limit = tokens.get(2);
            assertEquals("limit", limit.text());
            assertEquals(2, limit.position().line());
            assertEquals(3, limit.position().column());
        }

        @Test
        @DisplayName("Should reject an unterminated block comment")
        void testUnterminatedComment() {
            PhenotypeSyntaxException e = assertThrows(PhenotypeSyntaxException.class,
                    () -> new ScriptLexer("debug; /* never closed").tokenize());
            assertTrue(e.getMessage().contains("unterminated block comment"));
            assertEquals(8, e.getPosition().column());
        }

        @Test
        @DisplayName("Should reject an unterminated string")
        void testUnterminatedString() {
            assertThrows(PhenotypeSyntaxException.class, () -> new ScriptLexer("'open").tokenize());
        }

        @Test
        @DisplayName("Should reject an unknown character")
        void testUnknownCharacter() {
            assertThrows(PhenotypeSyntaxException.class, () -> new ScriptLexer("a # b").tokenize());
        }
    }
}
