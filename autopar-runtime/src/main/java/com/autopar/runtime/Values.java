package com.autopar.runtime;

import com.autopar.core.tree.SourcePos;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Operations on interpreter values: {@code Long}, {@code Double}, {@code String},
 * {@code Boolean}, {@code List<Object>} and {@code null}. Type errors surface as
 * {@link ProgramException} so the program's own {@code try} can see them.
 */
public final class Values {

    private Values() {}

    public static String display(Object value) {
        if (value instanceof List<?>) {
            List<?> list = (List<?>) value;
            StringBuilder sb = new StringBuilder("[");
            for (int k = 0; k < list.size(); k++) {
                if (k > 0) sb.append(", ");
                sb.append(display(list.get(k)));
            }
            return sb.append(']').toString();
        }
        return String.valueOf(value);
    }

    public static boolean truthy(Object value) {
        if (value instanceof Boolean) return (Boolean) value;
        if (value instanceof Long) return (Long) value != 0L;
        if (value instanceof Double) return (Double) value != 0.0;
        if (value instanceof String) return !((String) value).isEmpty();
        if (value instanceof List<?>) return !((List<?>) value).isEmpty();
        return value != null;
    }

    public static Object binary(String op, Object left, Object right, SourcePos pos) {
        switch (op) {
            case "==":
                return valueEquals(left, right);
            case "!=":
                return !valueEquals(left, right);
            case "+":
                if (left instanceof String || right instanceof String) {
                    return display(left) + display(right);
                }
                if (left instanceof List<?> && right instanceof List<?>) {
                    List<Object> joined = new ArrayList<>((List<?>) left);
                    joined.addAll((List<?>) right);
                    return joined;
                }
                return arithmetic(op, left, right, pos);
            case "-":
            case "*":
            case "/":
            case "%":
                return arithmetic(op, left, right, pos);
            case "<":
                return compare(left, right, pos) < 0;
            case "<=":
                return compare(left, right, pos) <= 0;
            case ">":
                return compare(left, right, pos) > 0;
            case ">=":
                return compare(left, right, pos) >= 0;
            case "&":
                return truthy(left) & truthy(right);
            case "|":
                return truthy(left) | truthy(right);
            default:
                throw new ProgramException("Unsupported operator " + op, pos);
        }
    }

    public static Object unary(String op, Object operand, SourcePos pos) {
        switch (op) {
            case "!":
                return !truthy(operand);
            case "-":
                if (operand instanceof Long) return -(Long) operand;
                if (operand instanceof Double) return -(Double) operand;
                throw new ProgramException("Cannot negate " + typeName(operand), pos);
            case "+":
                return number(operand, pos);
            default:
                throw new ProgramException("Unsupported operator " + op, pos);
        }
    }

    private static Object arithmetic(String op, Object left, Object right, SourcePos pos) {
        Number a = number(left, pos);
        Number b = number(right, pos);
        if (a instanceof Long && b instanceof Long) {
            long x = a.longValue();
            long y = b.longValue();
            switch (op) {
                case "+": return x + y;
                case "-": return x - y;
                case "*": return x * y;
                case "/":
                    if (y == 0) throw new ProgramException("Division by zero", pos);
                    return x / y;
                default:
                    if (y == 0) throw new ProgramException("Division by zero", pos);
                    return x % y;
            }
        }
        double x = a.doubleValue();
        double y = b.doubleValue();
        switch (op) {
            case "+": return x + y;
            case "-": return x - y;
            case "*": return x * y;
            case "/": return x / y;
            default: return x % y;
        }
    }

    public static int compare(Object left, Object right, SourcePos pos) {
        if (left instanceof String && right instanceof String) {
            return ((String) left).compareTo((String) right);
        }
        Number a = number(left, pos);
        Number b = number(right, pos);
        if (a instanceof Long && b instanceof Long) {
            return Long.compare(a.longValue(), b.longValue());
        }
        return Double.compare(a.doubleValue(), b.doubleValue());
    }

    public static boolean valueEquals(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            if (left instanceof Long && right instanceof Long) return left.equals(right);
            return ((Number) left).doubleValue() == ((Number) right).doubleValue();
        }
        return Objects.equals(left, right);
    }

    public static Number number(Object value, SourcePos pos) {
        if (value instanceof Long || value instanceof Double) return (Number) value;
        throw new ProgramException("Expected a number, got " + typeName(value), pos);
    }

    public static int index(Object value, int size, SourcePos pos) {
        if (!(value instanceof Long)) {
            throw new ProgramException("Index must be an integer, got " + typeName(value), pos);
        }
        long k = (Long) value;
        if (k < 0 || k >= size) {
            throw new ProgramException("Index " + k + " out of range for size " + size, pos);
        }
        return (int) k;
    }

    @SuppressWarnings("unchecked")
    public static List<Object> list(Object value, SourcePos pos) {
        if (value instanceof List<?>) return (List<Object>) value;
        throw new ProgramException("Expected a list, got " + typeName(value), pos);
    }

    /** The sequence a {@code for each} loop walks: a snapshot of a list, or the characters of a string. */
    public static List<Object> iterable(Object value, SourcePos pos) {
        if (value instanceof String) {
            String s = (String) value;
            List<Object> chars = new ArrayList<>(s.length());
            for (int k = 0; k < s.length(); k++) {
                chars.add(String.valueOf(s.charAt(k)));
            }
            return chars;
        }
        return new ArrayList<>(list(value, pos));
    }

    /** Values of {@code [start, end)} stepping by {@code step}. */
    public static List<Object> range(long start, long end, long step, SourcePos pos) {
        if (step == 0) throw new ProgramException("Range step must not be zero", pos);
        List<Object> out = new ArrayList<>();
        if (step > 0) {
            for (long v = start; v < end; v += step) out.add(v);
        } else {
            for (long v = start; v > end; v += step) out.add(v);
        }
        return out;
    }

    /** Deep copy of lists so two runs over the same input cannot observe each other. */
    public static Object copy(Object value) {
        if (value instanceof List<?>) {
            List<Object> out = new ArrayList<>();
            for (Object o : (List<?>) value) out.add(copy(o));
            return out;
        }
        return value;
    }

    public static String typeName(Object value) {
        if (value == null) return "null";
        if (value instanceof Long) return "int";
        if (value instanceof Double) return "float";
        if (value instanceof List<?>) return "list";
        if (value instanceof Closure) return "function";
        return value.getClass().getSimpleName().toLowerCase(java.util.Locale.ROOT);
    }
}
