package com.arrowc;

public enum TokenType {
    // Grouping
    PAREN,          // ( or )
    SEPARATOR,      // ,

    // Arithmetic, single character only
    OPERATOR,       // + - * /

    ARROW,          // =>

    // Literals
    NUMBER,
    IDENTIFIER
}
