package work.yamlcli.engine.expr;

import java.util.List;

/**
 * Closed set of AST nodes the evaluator understands. The parser can produce nothing else.
 */
public interface Node {
    record Literal(Object value) implements Node {}

    record Name(String name) implements Node {}

    record Attr(Node target, String name) implements Node {}

    record Index(Node target, Node key) implements Node {}

    record BoolOp(Operator operator, List<Node> operands) implements Node {}

    record Not(Node operand) implements Node {}

    record Compare(Node first, List<Comparison> rest) implements Node {}

    record Comparison(CompareOp op, Node operand) {}

    record Call(String function, Node argument) implements Node {}

    record ListLit(List<Node> items) implements Node {}

    record MapLit(List<Node> keys, List<Node> values) implements Node {}

    enum Operator { AND, OR }

    enum CompareOp {
        EQ("=="), NE("!="), LT("<"), LE("<="), GT(">"), GE(">=");

        private final String symbol;

        CompareOp(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }
}
