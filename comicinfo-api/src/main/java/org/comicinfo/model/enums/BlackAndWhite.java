package org.comicinfo.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.comicinfo.exception.InvalidEnumException;

@Getter
@RequiredArgsConstructor
public enum BlackAndWhite implements SchemaValue {
    UNKNOWN("Unknown"),
    NO("No"),
    YES("Yes");

    public static final String FIELD = "BlackAndWhite";

    @JsonValue
    private final String value;

    public boolean isBlackAndWhite() {
        return this == YES;
    }

    public static BlackAndWhite fromValue(String value) {
        return SchemaValue.lenient(BlackAndWhite.class, value, UNKNOWN);
    }

    public static BlackAndWhite parse(String value) throws InvalidEnumException {
        return SchemaValue.strict(BlackAndWhite.class, FIELD, value);
    }
}
