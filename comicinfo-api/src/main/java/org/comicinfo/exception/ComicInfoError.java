package org.comicinfo.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ComicInfoError {
    PARSE_ERROR("Parse error: %s"),
    FILE_ERROR("File error: %s"),
    INVALID_ENUM("Invalid value '%s' for field '%s'. Valid values are: %s"),
    RANGE_ERROR("Value '%s' for field '%s' is out of range (%s..%s)"),
    TYPE_COERCION_ERROR("Cannot convert value '%s' for field '%s' to %s"),
    SCHEMA_ERROR("Schema error: %s");

    private final String message;

    public ComicInfoException createException(Object... details) {
        return new ComicInfoException(this, String.format(message, details));
    }

    public ComicInfoException createException(Throwable cause, Object... details) {
        return new ComicInfoException(this, String.format(message, details), cause);
    }
}
