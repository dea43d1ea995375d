/*
 * MR Protocol Compliance
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.protocol.parameter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts raw header values into typed {@link ParameterValue}s according to the
 * kind declared for the parameter in the registry.
 *
 * Coercion never throws for bad data. A value that cannot be converted is kept as
 * {@link ValueKind#RAW} text so the sequence can still be built; the comparator
 * later reports it as uncoerced.
 */
public final class ValueCoercer {
    private static final Logger log = LoggerFactory.getLogger(ValueCoercer.class);

    // Longer units first so "Hz/Px" and "MHz" win over "Hz", "ms" over "s"
    private static final String[] UNITS = {"Hz/Px", "MHz", "Hz", "ms", "mm", "deg", "°", "s", "%", "T"};

    private static final Pattern NUMBER_WITH_UNIT = Pattern.compile(
            "^\\s*([-+]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][-+]?\\d+)?)\\s*("
                    + String.join("|", UNITS) + ")?\\s*$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern VECTOR_SEPARATOR = Pattern.compile("[,\\\\\\s]+");

    private ValueCoercer() {
    }

    /**
     * A raw value counts as present unless it is null, blank text, an empty
     * array or collection, or the ABSENT sentinel.
     */
    public static boolean isPresent(Object raw) {
        if (raw == null) {
            return false;
        }
        if (raw instanceof CharSequence) {
            return raw.toString().trim().length() > 0;
        }
        if (raw instanceof ParameterValue) {
            return !((ParameterValue) raw).isAbsent();
        }
        if (raw instanceof Parameter) {
            return true;
        }
        List<Object> items = asList(raw);
        return items == null || !items.isEmpty();
    }

    /**
     * Coerce a raw value for a recognized parameter.
     *
     * @param def registry entry the key resolved to
     * @param raw the raw value; a {@link Parameter} or {@link ParameterValue} is re-normalized
     * @return a recognized parameter, holding a RAW value if coercion failed
     */
    public static Parameter coerce(ParameterDefinition def, Object raw) {
        String inputUnit = null;
        Object source = raw;
        if (source instanceof Parameter) {
            inputUnit = ((Parameter) source).getUnit();
            source = ((Parameter) source).getValue();
        }
        if (source instanceof ParameterValue) {
            source = unwrap((ParameterValue) source);
        }

        Coerced result;
        switch (def.getKind()) {
            case NUMBER:
                result = toNumber(source);
                break;
            case VECTOR:
                result = toVector(source);
                break;
            case SYMBOL:
                result = toSymbol(def, source);
                break;
            case STRING:
            default:
                result = new Coerced(ParameterValue.ofString(stringify(source)), null);
                break;
        }

        if (result != null) {
            String unit = resolveUnit(def.getUnit(), result.unit != null ? result.unit : inputUnit);
            if (unit != null) {
                return Parameter.recognized(def.getName(), result.value, unit.isEmpty() ? null : unit);
            }
            log.warn("Unit mismatch for {}: expected {} but got '{}'", def.getName(), def.getUnit(), stringify(raw));
        } else {
            log.warn("Could not coerce {} value '{}' to {}", def.getName(), stringify(source), def.getKind());
        }
        return Parameter.recognized(def.getName(), ParameterValue.raw(stringify(source)), def.getUnit());
    }

    /**
     * Text form of a raw value. Multi-values are joined with a backslash.
     */
    public static String stringify(Object raw) {
        if (raw == null) {
            return "";
        }
        if (raw instanceof ParameterValue) {
            return ((ParameterValue) raw).asText();
        }
        if (raw instanceof Parameter) {
            return ((Parameter) raw).getValue().asText();
        }
        if (raw instanceof Double || raw instanceof Float) {
            return ParameterValue.formatNumber(((Number) raw).doubleValue());
        }
        List<Object> items = asList(raw);
        if (items != null) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < items.size(); i++) {
                if (i > 0) sb.append('\\');
                sb.append(stringify(items.get(i)));
            }
            return sb.toString();
        }
        return raw.toString().trim();
    }

    /**
     * @return the unit to store, "" for none, or null when the declared and observed units conflict
     */
    private static String resolveUnit(String declared, String observed) {
        if (declared == null || declared.isEmpty()) {
            return observed == null ? "" : observed;
        }
        if (observed == null || sameUnit(declared, observed)) {
            return declared;
        }
        return null;
    }

    /**
     * @return the known spelling of a unit suffix matched in any case
     */
    static String canonicalUnit(String matched) {
        if (matched == null) {
            return null;
        }
        for (String unit : UNITS) {
            if (unit.equalsIgnoreCase(matched)) {
                return unit;
            }
        }
        return matched;
    }

    private static boolean sameUnit(String a, String b) {
        if (a.equalsIgnoreCase(b)) {
            return true;
        }
        return isDegrees(a) && isDegrees(b);
    }

    private static boolean isDegrees(String unit) {
        return "deg".equalsIgnoreCase(unit) || "°".equals(unit);
    }

    private static Object unwrap(ParameterValue value) {
        switch (value.getKind()) {
            case NUMBER:
                return value.getNumber();
            case VECTOR:
                return value.getVector();
            default:
                return value.asText();
        }
    }

    private static Coerced toNumber(Object source) {
        if (source instanceof Number) {
            return new Coerced(ParameterValue.ofNumber(((Number) source).doubleValue()), null);
        }
        if (source instanceof CharSequence) {
            Matcher m = NUMBER_WITH_UNIT.matcher(source.toString());
            if (m.matches()) {
                return new Coerced(ParameterValue.ofNumber(Double.parseDouble(m.group(1))), canonicalUnit(m.group(2)));
            }
            return null;
        }
        List<Object> items = asList(source);
        if (items != null && items.size() == 1) {
            return toNumber(items.get(0));
        }
        return null;
    }

    private static Coerced toVector(Object source) {
        if (source instanceof Number) {
            return new Coerced(ParameterValue.ofVector(((Number) source).doubleValue()), null);
        }
        if (source instanceof CharSequence) {
            return parseVector(source.toString());
        }
        List<Object> items = asList(source);
        if (items == null || items.isEmpty()) {
            return null;
        }
        double[] values = new double[items.size()];
        String unit = null;
        for (int i = 0; i < values.length; i++) {
            Coerced item = toNumber(items.get(i));
            if (item == null) {
                return null;
            }
            values[i] = item.value.getNumber();
            if (item.unit != null) {
                unit = item.unit;
            }
        }
        return new Coerced(ParameterValue.ofVector(values), unit);
    }

    private static Coerced parseVector(String text) {
        Matcher single = NUMBER_WITH_UNIT.matcher(text);
        if (single.matches()) {
            return new Coerced(ParameterValue.ofVector(Double.parseDouble(single.group(1))), canonicalUnit(single.group(2)));
        }

        String body = text.trim();
        if ((body.startsWith("[") && body.endsWith("]")) || (body.startsWith("(") && body.endsWith(")"))) {
            body = body.substring(1, body.length() - 1).trim();
        }
        if (body.isEmpty()) {
            return null;
        }
        String[] parts = VECTOR_SEPARATOR.split(body);
        double[] values = new double[parts.length];
        for (int i = 0; i < parts.length; i++) {
            try {
                values[i] = Double.parseDouble(parts[i]);
            } catch (NumberFormatException e) {
                log.debug("Vector component '{}' is not a number", parts[i]);
                return null;
            }
        }
        return new Coerced(ParameterValue.ofVector(values), null);
    }

    private static Coerced toSymbol(ParameterDefinition def, Object source) {
        String text = stringify(source);
        String symbol = def.canonicalSymbol(text);
        if (symbol == null) {
            return null;
        }
        return new Coerced(ParameterValue.ofSymbol(symbol), null);
    }

    /**
     * @return the elements of an array or collection, or null for a scalar
     */
    private static List<Object> asList(Object raw) {
        if (raw instanceof Collection) {
            return new ArrayList<>((Collection<?>) raw);
        }
        if (raw != null && raw.getClass().isArray()) {
            int length = Array.getLength(raw);
            List<Object> items = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                items.add(Array.get(raw, i));
            }
            return items;
        }
        return null;
    }

    private static final class Coerced {
        private final ParameterValue value;
        private final String unit;

        private Coerced(ParameterValue value, String unit) {
            this.value = value;
            this.unit = unit;
        }
    }
}
