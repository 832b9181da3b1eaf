package com.playgrounds.apptool.syntax;

public enum SyntaxKind {
    TOKEN,
    SOURCE_FILE,
    ARGUMENT,
    ARRAY_ELEMENT,
    IDENTIFIER,
    MEMBER_ACCESS,
    STRING_LITERAL,
    CALL,
    ARRAY,
    TUPLE,
    BLOCK,
    SEQUENCE,
    OPAQUE
}
