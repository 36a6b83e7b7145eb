package org.comicinfo.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.comicinfo.exception.InvalidEnumException;

@Getter
@RequiredArgsConstructor
public enum Manga implements SchemaValue {
    UNKNOWN("Unknown"),
    NO("No"),
    YES("Yes"),
    YES_AND_RIGHT_TO_LEFT("YesAndRightToLeft");

    public static final String FIELD = "Manga";

    @JsonValue
    private final String value;

    public boolean isManga() {
        return this == YES || this == YES_AND_RIGHT_TO_LEFT;
    }

    public boolean isRightToLeft() {
        return this == YES_AND_RIGHT_TO_LEFT;
    }

    public static Manga fromValue(String value) {
        return SchemaValue.lenient(Manga.class, value, UNKNOWN);
    }

    public static Manga parse(String value) throws InvalidEnumException {
        return SchemaValue.strict(Manga.class, FIELD, value);
    }
}
