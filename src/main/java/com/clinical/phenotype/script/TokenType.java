package com.clinical.phenotype.script;

/**
 * Lexical token categories. Keywords are contextual and arrive as {@link #IDENTIFIER}.
 */
public enum TokenType {
    IDENTIFIER("identifier"),
    STRING("string"),
    NUMBER("number"),
    SEMICOLON("';'"),
    COLON("':'"),
    COMMA("','"),
    DOT("'.'"),
    LEFT_PAREN("'('"),
    RIGHT_PAREN("')'"),
    LEFT_BRACKET("'['"),
    RIGHT_BRACKET("']'"),
    LEFT_BRACE("'{'"),
    RIGHT_BRACE("'}'"),
    GREATER("'>'"),
    LESS("'<'"),
    GREATER_EQUAL("'>='"),
    LESS_EQUAL("'<='"),
    EQUAL("'='"),
    NOT_EQUAL("'!='"),
    PLUS("'+'"),
    MINUS("'-'"),
    STAR("'*'"),
    SLASH("'/'"),
    EOF("end of script");

    private final String display;

    TokenType(String display) {
        this.display = display;
    }

    public String display() {
        return display;
    }
}
