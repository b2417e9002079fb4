package work.yamlcli.engine.value;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.yamlcli.engine.error.EvaluationException;

/**
 * Operations over the dynamic value model shared by expressions, templates and argv specs.
 *
 * <p>A value is one of {@code null}, {@link Boolean}, {@link Number}, {@link String}, {@link List} or
 * {@link Map} with string keys. Other objects are rejected by {@link #typeName(Object)} callers.
 */
public final class Values {
    private static final ObjectMapper JSON = new ObjectMapper();

    private Values() {}

    public static boolean isTruthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) return n.doubleValue() != 0 && !Double.isNaN(n.doubleValue());
        if (value instanceof String s) return !s.isEmpty();
        if (value instanceof List<?> list) return !list.isEmpty();
        if (value instanceof Map<?, ?> map) return !map.isEmpty();
        return true;
    }

    /**
     * {@code empty(x)}: null, the empty string or the empty list.
     */
    public static boolean isEmpty(Object value) {
        return value == null
            || (value instanceof String s && s.isEmpty())
            || (value instanceof List<?> list && list.isEmpty());
    }

    public static String stringify(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (!Double.isInfinite(d) && d == Math.rint(d) && Math.abs(d) < 1e15) {
                return BigDecimal.valueOf(d).setScale(1).toPlainString();
            }
            return String.valueOf(d);
        }
        if (value instanceof BigDecimal big) {
            return big.toPlainString();
        }
        if (value instanceof Number || value instanceof Boolean) {
            return String.valueOf(value);
        }
        if (value instanceof List<?> || value instanceof Map<?, ?>) {
            try {
                return JSON.writeValueAsString(value);
            } catch (JsonProcessingException ex) {
                throw new EvaluationException("Cannot stringify " + typeName(value) + ": " + ex.getOriginalMessage(), ex);
            }
        }
        return String.valueOf(value);
    }

    /**
     * Dotted attribute access: a missing key on a map yields {@code null}; any other target is an error.
     */
    public static Object getAttribute(Object target, String name) {
        if (target instanceof Map<?, ?> map) {
            return map.get(name);
        }
        throw new EvaluationException("Attribute access '." + name + "' is only allowed on maps, got " + typeName(target));
    }

    public static Object getIndex(Object target, Object key) {
        if (target instanceof Map<?, ?> map) {
            if (!(key instanceof String)) {
                throw new EvaluationException("Map keys must be strings, got " + typeName(key));
            }
            if (!map.containsKey(key)) {
                throw new EvaluationException("Key not found: '" + key + "'");
            }
            return map.get(key);
        }
        if (target instanceof List<?> list) {
            if (!isIntegral(key)) {
                throw new EvaluationException("List indices must be integers, got " + typeName(key));
            }
            long index = ((Number) key).longValue();
            if (index < 0) {
                index += list.size();
            }
            if (index < 0 || index >= list.size()) {
                throw new EvaluationException("List index out of range: " + key);
            }
            return list.get((int) index);
        }
        throw new EvaluationException("Cannot index into " + typeName(target));
    }

    public static int length(Object value) {
        if (value instanceof String s) return s.length();
        if (value instanceof List<?> list) return list.size();
        if (value instanceof Map<?, ?> map) return map.size();
        throw new EvaluationException("len() is not defined for " + typeName(value));
    }

    public static boolean valueEquals(Object left, Object right) {
        if (left == null || right == null) {
            return left == right;
        }
        if (left instanceof Number a && right instanceof Number b) {
            return toDecimal(a).compareTo(toDecimal(b)) == 0;
        }
        if (left instanceof List<?> a && right instanceof List<?> b) {
            if (a.size() != b.size()) return false;
            for (int i = 0; i < a.size(); i++) {
                if (!valueEquals(a.get(i), b.get(i))) return false;
            }
            return true;
        }
        if (left instanceof Map<?, ?> a && right instanceof Map<?, ?> b) {
            if (a.size() != b.size()) return false;
            for (var entry : a.entrySet()) {
                if (!b.containsKey(entry.getKey()) || !valueEquals(entry.getValue(), b.get(entry.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        return Objects.equals(left, right);
    }

    public static int compare(Object left, Object right) {
        if (left instanceof Number a && right instanceof Number b) {
            return toDecimal(a).compareTo(toDecimal(b));
        }
        if (left instanceof String a && right instanceof String b) {
            return a.compareTo(b);
        }
        if (left instanceof List<?> a && right instanceof List<?> b) {
            Iterator<?> ia = a.iterator();
            Iterator<?> ib = b.iterator();
            while (ia.hasNext() && ib.hasNext()) {
                Object x = ia.next();
                Object y = ib.next();
                if (!valueEquals(x, y)) {
                    return compare(x, y);
                }
            }
            return Integer.compare(a.size(), b.size());
        }
        throw new EvaluationException("Cannot order " + typeName(left) + " and " + typeName(right));
    }

    public static String typeName(Object value) {
        if (value == null) return "null";
        if (value instanceof Boolean) return "boolean";
        if (value instanceof Number) return "number";
        if (value instanceof String) return "string";
        if (value instanceof List<?>) return "list";
        if (value instanceof Map<?, ?>) return "map";
        return value.getClass().getSimpleName();
    }

    public static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte;
    }

    /**
     * Deep, read-only copy: scope snapshots handed to expressions can never be mutated through the view.
     */
    public static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            for (var entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), freeze(entry.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<>(list.size());
            for (var item : list) {
                copy.add(freeze(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    private static BigDecimal toDecimal(Number number) {
        if (number instanceof BigDecimal big) {
            return big;
        }
        if (isIntegral(number)) {
            return BigDecimal.valueOf(number.longValue());
        }
        double d = number.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new EvaluationException("Cannot compare non-finite number " + d);
        }
        return BigDecimal.valueOf(d);
    }
}
