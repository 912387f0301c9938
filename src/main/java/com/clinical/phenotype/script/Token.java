package com.clinical.phenotype.script;

import com.clinical.phenotype.core.model.SourcePosition;

/**
 * Lexical token with its decoded text and start position.
 */
public record Token(TokenType type, String text, SourcePosition position) {

    public boolean is(TokenType expected) {
        return type == expected;
    }

    /**
     * True for an identifier spelled exactly {@code keyword}.
     */
    public boolean isKeyword(String keyword) {
        return type == TokenType.IDENTIFIER && keyword.equals(text);
    }

    /**
     * True for an identifier spelled {@code keyword} in any case.
     */
    public boolean isKeywordIgnoreCase(String keyword) {
        return type == TokenType.IDENTIFIER && keyword.equalsIgnoreCase(text);
    }

    public String describe() {
        return switch (type) {
            case EOF -> type.display();
            case STRING -> "string \"" + text + "\"";
            case IDENTIFIER, NUMBER -> "'" + text + "'";
            default -> type.display();
        };
    }
}
