package work.yamlcli.engine.expr;

record Token(TokenType type, String text, Object literal, int position) {
    boolean is(TokenType expected) {
        return type == expected;
    }

    boolean isName(String name) {
        return type == TokenType.NAME && text.equals(name);
    }
}
