package com.clinical.phenotype.script;

import com.clinical.phenotype.core.model.SourcePosition;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns phenotype script text into tokens, skipping whitespace and comments.
 * Pure: no I/O, no shared state.
 */
public class ScriptLexer {

    private final String source;
    private int index = 0;
    private int line = 1;
    private int column = 1;

    public ScriptLexer(String source) {
        this.source = source != null ? source : "";
    }

    /**
     * Tokenizes the whole input. The last token is always {@link TokenType#EOF}.
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            Token token = next();
            tokens.add(token);
            if (token.is(TokenType.EOF)) {
                return tokens;
            }
        }
    }

    private Token next() {
        skipWhitespaceAndComments();
        SourcePosition start = position();
        if (index >= source.length()) {
            return new Token(TokenType.EOF, "", start);
        }
        char c = source.charAt(index);

        if (isIdentifierStart(c)) {
            int begin = index;
            while (index < source.length() && isIdentifierPart(source.charAt(index))) {
                advance();
            }
            return new Token(TokenType.IDENTIFIER, source.substring(begin, index), start);
        }
        if (Character.isDigit(c)) {
            return number(start);
        }
        if (c == '"' || c == '\'') {
            return string(c, start);
        }

        advance();
        switch (c) {
            case ';': return new Token(TokenType.SEMICOLON, ";", start);
            case ':': return new Token(TokenType.COLON, ":", start);
            case ',': return new Token(TokenType.COMMA, ",", start);
            case '.': return new Token(TokenType.DOT, ".", start);
            case '(': return new Token(TokenType.LEFT_PAREN, "(", start);
            case ')': return new Token(TokenType.RIGHT_PAREN, ")", start);
            case '[': return new Token(TokenType.LEFT_BRACKET, "[", start);
            case ']': return new Token(TokenType.RIGHT_BRACKET, "]", start);
            case '{': return new Token(TokenType.LEFT_BRACE, "{", start);
            case '}': return new Token(TokenType.RIGHT_BRACE, "}", start);
            case '+': return new Token(TokenType.PLUS, "+", start);
            case '-': return new Token(TokenType.MINUS, "-", start);
            case '*': return new Token(TokenType.STAR, "*", start);
            case '/': return new Token(TokenType.SLASH, "/", start);
            case '>':
                return match('=') ? new Token(TokenType.GREATER_EQUAL, ">=", start)
                        : new Token(TokenType.GREATER, ">", start);
            case '<':
                return match('=') ? new Token(TokenType.LESS_EQUAL, "<=", start)
                        : new Token(TokenType.LESS, "<", start);
            case '=':
                match('=');
                return new Token(TokenType.EQUAL, "=", start);
            case '!':
                if (match('=')) {
                    return new Token(TokenType.NOT_EQUAL, "!=", start);
                }
                throw new PhenotypeSyntaxException("'!='", "'!'", start);
            default:
                throw new PhenotypeSyntaxException("unexpected character '" + c + "'", start);
        }
    }

    private Token number(SourcePosition start) {
        int begin = index;
        while (index < source.length() && Character.isDigit(source.charAt(index))) {
            advance();
        }
        if (index + 1 < source.length() && source.charAt(index) == '.'
                && Character.isDigit(source.charAt(index + 1))) {
            advance();
            while (index < source.length() && Character.isDigit(source.charAt(index))) {
                advance();
            }
        }
        return new Token(TokenType.NUMBER, source.substring(begin, index), start);
    }

    private Token string(char quote, SourcePosition start) {
        advance();
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (index >= source.length()) {
                throw new PhenotypeSyntaxException("unterminated string literal", start);
            }
            char c = source.charAt(index);
            advance();
            if (c == quote) {
                return new Token(TokenType.STRING, sb.toString(), start);
            }
            if (c == '\\') {
                if (index >= source.length()) {
                    throw new PhenotypeSyntaxException("unterminated string literal", start);
                }
                char escaped = source.charAt(index);
                advance();
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append(escaped);
                }
            } else {
                sb.append(c);
            }
        }
    }

    private void skipWhitespaceAndComments() {
        while (index < source.length()) {
            char c = source.charAt(index);
            if (Character.isWhitespace(c)) {
                advance();
            } else if (c == '/' && peek(1) == '/') {
                while (index < source.length() && source.charAt(index) != '\n') {
                    advance();
                }
            } else if (c == '/' && peek(1) == '*') {
                SourcePosition start = position();
                advance();
                advance();
                while (!(peek(0) == '*' && peek(1) == '/')) {
                    if (index >= source.length()) {
                        throw new PhenotypeSyntaxException("unterminated block comment", start);
                    }
                    advance();
                }
                advance();
                advance();
            } else {
                return;
            }
        }
    }

    private boolean match(char expected) {
        if (index < source.length() && source.charAt(index) == expected) {
            advance();
            return true;
        }
        return false;
    }

    private char peek(int offset) {
        int i = index + offset;
        return i < source.length() ? source.charAt(i) : '\0';
    }

    private void advance() {
        if (source.charAt(index) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        index++;
    }

    private SourcePosition position() {
        return new SourcePosition(line, column);
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
