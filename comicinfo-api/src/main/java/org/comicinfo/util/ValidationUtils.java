package org.comicinfo.util;

import lombok.experimental.UtilityClass;
import org.comicinfo.exception.RangeException;

/**
 * Closed-range checks shared by the XML parser and the JSON decoder. Absent values always pass.
 */
@UtilityClass
public class ValidationUtils {

    public static void requireInRange(String field, Integer value, int min, int max) throws RangeException {
        if (value != null && (value < min || value > max)) {
            throw new RangeException(field, String.valueOf(value), String.valueOf(min), String.valueOf(max));
        }
    }

    public static void requireInRange(String field, Double value, double min, double max) throws RangeException {
        // NaN fails both comparisons
        if (value != null && !(value >= min && value <= max)) {
            throw new RangeException(field, String.valueOf(value), String.valueOf(min), String.valueOf(max));
        }
    }
}
