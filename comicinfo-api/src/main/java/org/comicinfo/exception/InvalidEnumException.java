package org.comicinfo.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class InvalidEnumException extends ComicInfoException {

    private final String field;
    private final String value;
    private final List<String> validValues;

    public InvalidEnumException(String field, String value, List<String> validValues) {
        super(ComicInfoError.INVALID_ENUM, String.format(ComicInfoError.INVALID_ENUM.getMessage(),
                value, field, String.join(", ", validValues)));
        this.field = field;
        this.value = value;
        this.validValues = List.copyOf(validValues);
    }
}
