package work.yamlcli.engine.expr;

enum TokenType {
    NUMBER,
    STRING,
    NAME,
    DOT,
    COMMA,
    COLON,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    LBRACE,
    RBRACE,
    EQ,
    NE,
    LT,
    LE,
    GT,
    GE,
    /** Arithmetic and other operators that lex fine but are never evaluated. */
    FORBIDDEN,
    EOF
}
