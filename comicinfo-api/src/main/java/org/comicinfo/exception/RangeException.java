package org.comicinfo.exception;

import lombok.Getter;

/**
 * A numeric field was coerced successfully but lies outside its closed range.
 * Bounds are kept as text so integer and decimal fields report them the same way.
 */
@Getter
public class RangeException extends ComicInfoException {

    private final String field;
    private final String value;
    private final String min;
    private final String max;

    public RangeException(String field, String value, String min, String max) {
        super(ComicInfoError.RANGE_ERROR, String.format(ComicInfoError.RANGE_ERROR.getMessage(), value, field, min, max));
        this.field = field;
        this.value = value;
        this.min = min;
        this.max = max;
    }
}
