package com.example.workflowgraph.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Value held by a port, tagged with the data type it was created for.
 * <p>
 * Raw kinds per tag: {@code text}, {@code image}, {@code file} hold a {@link String}; {@code number} a {@link Double};
 * {@code boolean} a {@link Boolean}; {@code list} an unmodifiable list of strings, doubles and booleans.
 * {@link #empty()} carries no tag and no raw value.
 * </p>
 */
public record PortValue(DataType type, Object raw) {

    private static final PortValue EMPTY = new PortValue(null, null);

    public PortValue {
        if (type == null) {
            if (raw != null) {
                throw new IllegalArgumentException("untyped port value must be empty");
            }
        } else {
            if (type == DataType.ANY) {
                throw new IllegalArgumentException("a value is tagged with a concrete type, not 'any'");
            }
            raw = normalize(type, raw);
        }
    }

    public static PortValue empty() {
        return EMPTY;
    }

    public static PortValue text(String value) {
        return new PortValue(DataType.TEXT, value);
    }

    public static PortValue number(double value) {
        return new PortValue(DataType.NUMBER, value);
    }

    public static PortValue bool(boolean value) {
        return new PortValue(DataType.BOOLEAN, value);
    }

    public static PortValue list(List<?> values) {
        return new PortValue(DataType.LIST, values);
    }

    public static PortValue image(String url) {
        return new PortValue(DataType.IMAGE, url);
    }

    public static PortValue file(String path) {
        return new PortValue(DataType.FILE, path);
    }

    /**
     * Builds a value for a port declared with {@code portType} from a raw JSON value.
     * For {@code any} ports the tag is inferred from the raw kind.
     *
     * @throws IllegalArgumentException if the raw value does not fit the declared type
     */
    public static PortValue fromRaw(DataType portType, Object raw) {
        Objects.requireNonNull(portType, "portType");
        if (raw == null) {
            return EMPTY;
        }
        if (portType != DataType.ANY) {
            return new PortValue(portType, raw);
        }
        if (raw instanceof String) {
            return new PortValue(DataType.TEXT, raw);
        }
        if (raw instanceof Number) {
            return new PortValue(DataType.NUMBER, raw);
        }
        if (raw instanceof Boolean) {
            return new PortValue(DataType.BOOLEAN, raw);
        }
        if (raw instanceof List<?>) {
            return new PortValue(DataType.LIST, raw);
        }
        throw new IllegalArgumentException("unsupported value kind " + raw.getClass().getSimpleName());
    }

    public boolean isEmpty() {
        return type == null;
    }

    /**
     * Returns whether this value may be stored in a port declared with {@code portType}.
     */
    public boolean fits(DataType portType) {
        return isEmpty() || portType == DataType.ANY || portType == type;
    }

    /**
     * Raw value for serialization: integral numbers become {@link Long} so they are written as JSON integers.
     */
    public Object toRaw() {
        if (raw instanceof Double d) {
            return integralOrSelf(d);
        }
        if (raw instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) {
                out.add(item instanceof Double d ? integralOrSelf(d) : item);
            }
            return out;
        }
        return raw;
    }

    private static Object integralOrSelf(double d) {
        if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
            return (long) d;
        }
        return d;
    }

    private static Object normalize(DataType type, Object raw) {
        Objects.requireNonNull(raw, "raw");
        return switch (type) {
            case TEXT, IMAGE, FILE -> {
                if (!(raw instanceof String)) {
                    throw new IllegalArgumentException("expected a string for " + type.tag() + " but got " + kind(raw));
                }
                yield raw;
            }
            case NUMBER -> {
                if (!(raw instanceof Number n)) {
                    throw new IllegalArgumentException("expected a number but got " + kind(raw));
                }
                yield n.doubleValue();
            }
            case BOOLEAN -> {
                if (!(raw instanceof Boolean)) {
                    throw new IllegalArgumentException("expected a boolean but got " + kind(raw));
                }
                yield raw;
            }
            case LIST -> {
                if (!(raw instanceof List<?> items)) {
                    throw new IllegalArgumentException("expected a list but got " + kind(raw));
                }
                List<Object> copy = new ArrayList<>(items.size());
                for (Object item : items) {
                    if (item instanceof Number n) {
                        copy.add(n.doubleValue());
                    } else if (item instanceof String || item instanceof Boolean) {
                        copy.add(item);
                    } else {
                        throw new IllegalArgumentException("list items must be strings, numbers or booleans, got " + kind(item));
                    }
                }
                yield Collections.unmodifiableList(copy);
            }
            case ANY -> throw new IllegalArgumentException("a value is tagged with a concrete type, not 'any'");
        };
    }

    private static String kind(Object raw) {
        return raw == null ? "null" : raw.getClass().getSimpleName();
    }
}
