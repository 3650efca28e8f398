package com.minipy.script.parser;

import java.util.Arrays;
import java.util.List;

/**
 * Runtime value: a closed tagged union of None, bool, int, string and list.
 *
 * Lists are fixed-length arrays shared by reference: every holder of the same
 * LIST value sees element assignments made through any other holder.
 */
public final class Value implements Comparable<Value> {
    // Declaration order is also the cross-tag ordering.
    public enum Type { NONE, BOOL, INT, STRING, LIST }

    private static final Value NONE = new Value(Type.NONE, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value none() { return NONE; }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value integer(long n) { return new Value(Type.INT, n); }
    public static Value string(String s) {
        if (s == null) throw new IllegalArgumentException("string value must not be null");
        return new Value(Type.STRING, s);
    }

    /** Wraps {@code elements} without copying; the array becomes the list's storage. */
    public static Value list(Value[] elements) {
        if (elements == null) throw new IllegalArgumentException("list storage must not be null");
        return new Value(Type.LIST, elements);
    }

    public static Value list(List<Value> elements) {
        return list(elements.toArray(new Value[0]));
    }

    public Type getType() { return type; }

    public boolean asBool() {
        if (type != Type.BOOL) throw ScriptError.type("Expected bool, got " + typeName());
        return (Boolean) value;
    }

    public long asInt() {
        if (type != Type.INT) throw ScriptError.type("Expected int, got " + typeName());
        return (Long) value;
    }

    public String asString() {
        if (type != Type.STRING) throw ScriptError.type("Expected string, got " + typeName());
        return (String) value;
    }

    /** Live list storage. Writes go straight through to every holder. */
    public Value[] asList() {
        if (type != Type.LIST) throw ScriptError.type("Expected list, got " + typeName());
        return (Value[]) value; // NO defensive copy
    }

    public int length() {
        return asList().length;
    }

    public Value get(long index) {
        Value[] items = asList();
        if (index < 0 || index >= items.length) {
            throw ScriptError.index("list index out of range: " + index + " (length " + items.length + ")");
        }
        return items[(int) index];
    }

    public void set(long index, Value element) {
        Value[] items = asList();
        if (index < 0 || index >= items.length) {
            throw ScriptError.index("list assignment index out of range: " + index + " (length " + items.length + ")");
        }
        items[(int) index] = element;
    }

    /** New list holding the elements of this list followed by those of {@code other}. */
    public Value concat(Value other) {
        Value[] a = asList();
        Value[] b = other.asList();
        Value[] out = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return list(out);
    }

    public boolean isTruthy() {
        switch (type) {
            case NONE:   return false;
            case BOOL:   return (Boolean) value;
            case INT:    return (Long) value != 0L;
            case STRING: return !((String) value).isEmpty();
            case LIST:   return ((Value[]) value).length != 0;
            default:     throw new IllegalStateException("Unknown value type: " + type);
        }
    }

    /** Language-level type name used in error messages. */
    public String typeName() {
        switch (type) {
            case NONE:   return "NoneType";
            case BOOL:   return "bool";
            case INT:    return "int";
            case STRING: return "str";
            case LIST:   return "list";
            default:     return "unknown";
        }
    }

    /** Text emitted by {@code print}. */
    public String display() {
        StringBuilder sb = new StringBuilder();
        appendDisplay(sb);
        return sb.toString();
    }

    private void appendDisplay(StringBuilder sb) {
        switch (type) {
            case NONE:
                sb.append("None");
                break;
            case BOOL:
                sb.append((Boolean) value ? "True" : "False");
                break;
            case INT:
                sb.append((long) (Long) value);
                break;
            case STRING:
                sb.append((String) value);
                break;
            case LIST: {
                Value[] items = (Value[]) value;
                sb.append('[');
                for (int i = 0; i < items.length; i++) {
                    if (i > 0) sb.append(", ");
                    items[i].appendDisplay(sb);
                }
                sb.append(']');
                break;
            }
            default:
                throw new IllegalStateException("Unknown value type: " + type);
        }
    }

    /**
     * Total order: same-tag values compare naturally (lists element-wise, then by
     * length); values of different tags compare by tag.
     */
    @Override
    public int compareTo(Value other) {
        if (type != other.type) return Integer.compare(type.ordinal(), other.type.ordinal());
        switch (type) {
            case NONE:
                return 0;
            case BOOL:
                return Boolean.compare((Boolean) value, (Boolean) other.value);
            case INT:
                return Long.compare((Long) value, (Long) other.value);
            case STRING:
                return ((String) value).compareTo((String) other.value);
            case LIST: {
                Value[] a = (Value[]) value;
                Value[] b = (Value[]) other.value;
                int n = Math.min(a.length, b.length);
                for (int i = 0; i < n; i++) {
                    int c = a[i].compareTo(b[i]);
                    if (c != 0) return c;
                }
                return Integer.compare(a.length, b.length);
            }
            default:
                throw new IllegalStateException("Unknown value type: " + type);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (type != other.type) return false;
        if (type == Type.LIST) return Arrays.equals((Value[]) value, (Value[]) other.value);
        if (type == Type.NONE) return true;
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        if (type == Type.LIST) return Arrays.hashCode((Value[]) value);
        return 31 * type.hashCode() + (value == null ? 0 : value.hashCode());
    }

    @Override
    public String toString() {
        if (type == Type.STRING) return '"' + (String) value + '"';
        return display();
    }
}
