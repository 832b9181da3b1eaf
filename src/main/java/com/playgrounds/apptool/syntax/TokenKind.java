package com.playgrounds.apptool.syntax;

public enum TokenKind {
    IDENTIFIER,
    STRING_LITERAL,
    NUMBER,
    POUND_KEYWORD,
    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_BRACKET,
    RIGHT_BRACKET,
    LEFT_BRACE,
    RIGHT_BRACE,
    COMMA,
    COLON,
    PERIOD,
    OPERATOR,
    END_OF_FILE
}
