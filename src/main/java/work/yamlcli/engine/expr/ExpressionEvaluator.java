package work.yamlcli.engine.expr;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import work.yamlcli.engine.error.EvaluationException;
import work.yamlcli.engine.value.Values;

/**
 * Evaluates whitelisted expressions against a {@link Scope}. Parsed trees are cached by source text
 * up to a fixed number of entries; evaluation itself never mutates the scope, so repeated calls are
 * idempotent.
 */
public final class ExpressionEvaluator {
    static final int CACHE_LIMIT = 512;

    private final Path baseDirectory;
    private final Map<String, Node> cache = new ConcurrentHashMap<>();

    public ExpressionEvaluator() {
        this(null);
    }

    /**
     * @param baseDirectory directory that relative paths given to {@code exists()} resolve against
     */
    public ExpressionEvaluator(Path baseDirectory) {
        this.baseDirectory = baseDirectory;
    }

    public Object evaluate(String expression, Scope scope) {
        var source = expression == null ? "" : expression.strip();
        var node = cache.get(source);
        if (node == null) {
            node = ExpressionParser.parse(source);
            // Once full, new sources are parsed on every call.
            if (cache.size() < CACHE_LIMIT) {
                cache.putIfAbsent(source, node);
            }
        }
        return eval(node, scope == null ? Scope.empty() : scope);
    }

    public boolean test(String expression, Scope scope) {
        return Values.isTruthy(evaluate(expression, scope));
    }

    int cachedExpressions() {
        return cache.size();
    }

    private Object eval(Node node, Scope scope) {
        if (node instanceof Node.Literal literal) {
            return literal.value();
        }
        if (node instanceof Node.Name name) {
            if (!scope.contains(name.name())) {
                throw new EvaluationException("Unknown name in expression: " + name.name());
            }
            return scope.get(name.name());
        }
        if (node instanceof Node.Attr attr) {
            return Values.getAttribute(eval(attr.target(), scope), attr.name());
        }
        if (node instanceof Node.Index index) {
            return Values.getIndex(eval(index.target(), scope), eval(index.key(), scope));
        }
        if (node instanceof Node.BoolOp boolOp) {
            return evalBoolOp(boolOp, scope);
        }
        if (node instanceof Node.Not not) {
            return !Values.isTruthy(eval(not.operand(), scope));
        }
        if (node instanceof Node.Compare compare) {
            return evalCompare(compare, scope);
        }
        if (node instanceof Node.Call call) {
            return evalCall(call, scope);
        }
        if (node instanceof Node.ListLit list) {
            var items = new ArrayList<>(list.items().size());
            for (var item : list.items()) {
                items.add(eval(item, scope));
            }
            return items;
        }
        if (node instanceof Node.MapLit map) {
            var result = new LinkedHashMap<String, Object>();
            for (int i = 0; i < map.keys().size(); i++) {
                var key = eval(map.keys().get(i), scope);
                if (!(key instanceof String str)) {
                    throw new EvaluationException("Map literal keys must be strings, got " + Values.typeName(key));
                }
                result.put(str, eval(map.values().get(i), scope));
            }
            return result;
        }
        throw new EvaluationException("Unsupported expression node: " + node.getClass().getSimpleName());
    }

    private Object evalBoolOp(Node.BoolOp boolOp, Scope scope) {
        if (boolOp.operator() == Node.Operator.AND) {
            for (var operand : boolOp.operands()) {
                if (!Values.isTruthy(eval(operand, scope))) {
                    return false;
                }
            }
            return true;
        }
        for (var operand : boolOp.operands()) {
            if (Values.isTruthy(eval(operand, scope))) {
                return true;
            }
        }
        return false;
    }

    private Object evalCompare(Node.Compare compare, Scope scope) {
        var left = eval(compare.first(), scope);
        for (var comparison : compare.rest()) {
            var right = eval(comparison.operand(), scope);
            if (!holds(comparison.op(), left, right)) {
                return false;
            }
            left = right;
        }
        return true;
    }

    private static boolean holds(Node.CompareOp op, Object left, Object right) {
        switch (op) {
            case EQ: return Values.valueEquals(left, right);
            case NE: return !Values.valueEquals(left, right);
            case LT: return Values.compare(left, right) < 0;
            case LE: return Values.compare(left, right) <= 0;
            case GT: return Values.compare(left, right) > 0;
            case GE: return Values.compare(left, right) >= 0;
            default: throw new EvaluationException("Unsupported comparison operator " + op.symbol());
        }
    }

    private Object evalCall(Node.Call call, Scope scope) {
        var argument = eval(call.argument(), scope);
        switch (call.function()) {
            case "len":
                return (long) Values.length(argument);
            case "empty":
                return Values.isEmpty(argument);
            case "exists":
                return exists(argument);
            default:
                throw new EvaluationException("Unsupported function: " + call.function());
        }
    }

    private boolean exists(Object argument) {
        if (argument == null) {
            return false;
        }
        try {
            var path = Path.of(Values.stringify(argument));
            if (!path.isAbsolute() && baseDirectory != null) {
                path = baseDirectory.resolve(path);
            }
            return Files.exists(path);
        } catch (InvalidPathException ex) {
            return false;
        }
    }
}
