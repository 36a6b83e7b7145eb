package org.comicinfo.model.enums;

import org.comicinfo.exception.InvalidEnumException;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An enumeration whose constants map one-to-one onto a closed set of ComicInfo XML strings.
 */
public interface SchemaValue {

    /**
     * @return the exact string written to and read from XML
     */
    String getValue();

    static <E extends Enum<E> & SchemaValue> E lenient(Class<E> type, String value, E fallback) {
        if (value == null || value.isEmpty()) {
            return fallback;
        }
        for (E constant : type.getEnumConstants()) {
            if (constant.getValue().equals(value)) {
                return constant;
            }
        }
        return fallback;
    }

    static <E extends Enum<E> & SchemaValue> E strict(Class<E> type, String field, String value) throws InvalidEnumException {
        if (value != null) {
            for (E constant : type.getEnumConstants()) {
                if (constant.getValue().equals(value)) {
                    return constant;
                }
            }
        }
        throw new InvalidEnumException(field, value, validValues(type));
    }

    static <E extends Enum<E> & SchemaValue> List<String> validValues(Class<E> type) {
        return Arrays.stream(type.getEnumConstants())
                .map(SchemaValue::getValue)
                .collect(Collectors.toList());
    }
}
