package com.lyshra.open.flow.core.util;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;

public class CastUtil {

    private CastUtil() {}

    /**
     * Truthiness used by condition rules: {@code null}, {@code false}, zero, empty strings and
     * empty collections are falsy; everything else is truthy.
     */
    public static boolean isTruthy(Object e) {
        if (e == null) {
            return false;
        }
        if (e instanceof Boolean bool) {
            return bool;
        }
        if (e instanceof Number number) {
            return !isNumeric(number) || castAsBigDecimal(number).signum() != 0;
        }
        if (e instanceof CharSequence chars) {
            return chars.length() > 0;
        }
        if (e instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (e instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        return true;
    }

    public static boolean isNumeric(Object e) {
        return e instanceof Number && !(e instanceof Double d && (d.isNaN() || d.isInfinite()))
                && !(e instanceof Float f && (f.isNaN() || f.isInfinite()));
    }

    public static BigDecimal castAsBigDecimal(Object e) {
        if (e instanceof BigDecimal decimal) {
            return decimal;
        } else if (e instanceof Double || e instanceof Float) {
            return BigDecimal.valueOf(((Number) e).doubleValue());
        } else if (e instanceof Number number) {
            return new BigDecimal(number.toString());
        } else if (e instanceof Boolean bool) {
            return bool ? BigDecimal.ONE : BigDecimal.ZERO;
        }
        return new BigDecimal(e.toString().trim());
    }

    public static String castAsString(Object e) {
        if (e instanceof String string) {
            return string;
        }
        return e == null ? null : e.toString();
    }
}
