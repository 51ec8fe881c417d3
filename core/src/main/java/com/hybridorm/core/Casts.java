package com.hybridorm.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;

/**
 * Read and write coercions for {@link CastKind}.
 * <p>
 * Writes are eager: temporal values become canonical strings and maps on {@code json}
 * fields become JSON text before they reach the attribute store. Reads are lazy and run
 * on every {@link Entity#getAttribute(String)}.
 */
public final class Casts {
    private static final Logger logger = LoggerFactory.getLogger(Casts.class);

    private Casts() {
    }

    /**
     * Decodes a stored value into its rich form. Only a malformed {@code json} value fails;
     * every other miss returns the raw value.
     *
     * @throws DecodeException when a json-cast string is not a JSON object
     */
    public static Object read(String key, Object value, CastKind kind) {
        if (value == null) {
            return null;
        }
        switch (kind) {
            case DATETIME:
                return readMoment(key, value);
            case JSON:
                return readJson(key, value);
            case BOOL:
                return readBool(value);
            case INT:
                return readLong(value);
            case DOUBLE:
                return readDouble(value);
            default:
                return value;
        }
    }

    /**
     * Encodes a value for storage in the attribute map.
     */
    public static Object write(Object value, CastKind kind) {
        if (Moment.isTemporal(value)) {
            return Moment.from(value).format();
        }
        if (kind == CastKind.JSON && value instanceof Map) {
            return Json.encode(value);
        }
        return value;
    }

    private static Object readMoment(String key, Object value) {
        if (value instanceof String) {
            try {
                return Moment.parse((String) value);
            } catch (DateTimeParseException e) {
                logger.debug("Attribute {} holds an unparseable datetime '{}'", key, value);
                return value;
            }
        }
        Moment moment = Moment.from(value);
        return moment != null ? moment : value;
    }

    private static Object readJson(String key, Object value) {
        if (value instanceof Map) {
            return value;
        }
        if (value instanceof String) {
            try {
                return Json.decodeMap((String) value);
            } catch (JsonProcessingException e) {
                throw new DecodeException(key, "Attribute " + key + " is not a valid JSON object", e);
            }
        }
        return value;
    }

    private static Object readBool(Object value) {
        if (value instanceof Boolean) {
            return value;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue() == 1L;
        }
        if (value instanceof String) {
            return ((String) value).toLowerCase(Locale.ROOT).equals("true");
        }
        return value;
    }

    private static Object readLong(Object value) {
        if (value instanceof Long) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            return value;
        }
    }

    private static Object readDouble(Object value) {
        if (value instanceof Double) {
            return value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            return value;
        }
    }
}
