package de.bsommerfeld.fdf.parser;

public enum TokenType {

    STRING,
    NUMBER,
    IDENTIFIER,

    // keywords, matched case-insensitively
    FRAME,
    INHERITS,
    WITHCHILDREN,
    INCLUDEFILE,

    LEFT_BRACE,
    RIGHT_BRACE,
    COMMA,

    COMMENT,
    NEWLINE,
    EOF
}
