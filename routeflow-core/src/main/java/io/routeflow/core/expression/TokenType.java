package io.routeflow.core.expression;

enum TokenType {
    NUMBER,
    STRING,
    IDENTIFIER,
    REGEX,
    SYSTEM_REF,
    OPERATOR,
    EOF
}
