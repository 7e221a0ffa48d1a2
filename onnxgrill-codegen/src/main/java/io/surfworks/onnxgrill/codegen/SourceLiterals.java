package io.surfworks.onnxgrill.codegen;

import java.lang.reflect.Array;
import java.lang.reflect.RecordComponent;
import java.util.List;
import java.util.StringJoiner;

/**
 * Renders values as Java source expressions.
 *
 * <p>Compiling a rendered expression yields a value equal to the original:
 * <ul>
 *   <li>{@code 3} becomes {@code 3}, {@code 3L} becomes {@code 3L}, {@code 1.5f} becomes {@code 1.5f}</li>
 *   <li>arrays of any depth become {@code new int[][] {new int[] {1, 2}}}</li>
 *   <li>lists become {@code List.of(...)}</li>
 *   <li>records become constructor calls, e.g. {@code new PaddingConfig2d.Explicit(1, 1)}</li>
 * </ul>
 *
 * <p>Enum and record types are named relative to their top-level class, which
 * the generated file must import.
 */
public final class SourceLiterals {

    private SourceLiterals() {}

    /**
     * Renders a value.
     *
     * @throws IllegalArgumentException if the value's type has no literal form
     */
    public static String toSource(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Integer i) {
            return Integer.toString(i);
        }
        if (value instanceof Long l) {
            return l + "L";
        }
        if (value instanceof Double d) {
            return doubleLiteral(d);
        }
        if (value instanceof Float f) {
            return floatLiteral(f);
        }
        if (value instanceof Boolean b) {
            return Boolean.toString(b);
        }
        if (value instanceof Short s) {
            return "(short) " + s;
        }
        if (value instanceof Byte b) {
            return "(byte) " + b;
        }
        if (value instanceof Character c) {
            return "'" + (c == '\'' ? "\\'" : escape(String.valueOf(c), false)) + "'";
        }
        if (value instanceof String s) {
            return "\"" + escape(s, true) + "\"";
        }
        if (value instanceof Enum<?> e) {
            return typeName(e.getDeclaringClass()) + "." + e.name();
        }
        if (value.getClass().isArray()) {
            return arrayLiteral(value);
        }
        if (value instanceof List<?> list) {
            StringJoiner joiner = new StringJoiner(", ", "List.of(", ")");
            for (Object element : list) {
                joiner.add(toSource(element));
            }
            return joiner.toString();
        }
        if (value instanceof Record record) {
            return recordLiteral(record);
        }
        throw new IllegalArgumentException("No source form for " + value.getClass().getName());
    }

    public static String doubleLiteral(double d) {
        if (Double.isNaN(d)) {
            return "Double.NaN";
        }
        if (d == Double.POSITIVE_INFINITY) {
            return "Double.POSITIVE_INFINITY";
        }
        if (d == Double.NEGATIVE_INFINITY) {
            return "Double.NEGATIVE_INFINITY";
        }
        return Double.toString(d);
    }

    public static String floatLiteral(float f) {
        if (Float.isNaN(f)) {
            return "Float.NaN";
        }
        if (f == Float.POSITIVE_INFINITY) {
            return "Float.POSITIVE_INFINITY";
        }
        if (f == Float.NEGATIVE_INFINITY) {
            return "Float.NEGATIVE_INFINITY";
        }
        return Float.toString(f) + "f";
    }

    /**
     * Source name of a type: primitives by keyword, arrays with brackets,
     * nested classes qualified by their enclosing classes.
     */
    public static String typeName(Class<?> type) {
        if (type.isArray()) {
            return typeName(type.getComponentType()) + "[]";
        }
        if (type.isPrimitive()) {
            return type.getName();
        }
        Class<?> enclosing = type.getEnclosingClass();
        if (enclosing == null) {
            return type.getSimpleName();
        }
        return typeName(enclosing) + "." + type.getSimpleName();
    }

    private static String arrayLiteral(Object array) {
        int length = Array.getLength(array);
        StringJoiner joiner = new StringJoiner(", ", "new " + typeName(array.getClass()) + " {", "}");
        for (int i = 0; i < length; i++) {
            joiner.add(toSource(Array.get(array, i)));
        }
        return joiner.toString();
    }

    private static String recordLiteral(Record record) {
        StringJoiner joiner = new StringJoiner(", ", "new " + typeName(record.getClass()) + "(", ")");
        for (RecordComponent component : record.getClass().getRecordComponents()) {
            Object componentValue;
            try {
                componentValue = component.getAccessor().invoke(record);
            } catch (ReflectiveOperationException e) {
                throw new IllegalArgumentException(
                    "Cannot read component " + component.getName() + " of " + record.getClass().getName(), e);
            }
            joiner.add(toSource(componentValue));
        }
        return joiner.toString();
    }

    private static String escape(String s, boolean inString) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '"' -> sb.append(inString ? "\\\"" : "\"");
                default -> {
                    if (c < 0x20 || c > 0x7e) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.toString();
    }
}
