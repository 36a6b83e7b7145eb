package org.comicinfo.exception;

import lombok.Getter;

@Getter
public class TypeCoercionException extends ComicInfoException {

    public static final String INT = "Int";
    public static final String DOUBLE = "Double";

    private final String field;
    private final String value;
    private final String expectedType;

    public TypeCoercionException(String field, String value, String expectedType) {
        super(ComicInfoError.TYPE_COERCION_ERROR,
                String.format(ComicInfoError.TYPE_COERCION_ERROR.getMessage(), value, field, expectedType));
        this.field = field;
        this.value = value;
        this.expectedType = expectedType;
    }
}
