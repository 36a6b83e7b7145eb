package org.comicinfo.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.comicinfo.exception.InvalidEnumException;

@Getter
@RequiredArgsConstructor
public enum AgeRating implements SchemaValue {
    UNKNOWN("Unknown"),
    ADULTS_ONLY_18_PLUS("Adults Only 18+"),
    EARLY_CHILDHOOD("Early Childhood"),
    EVERYONE("Everyone"),
    EVERYONE_10_PLUS("Everyone 10+"),
    G("G"),
    KIDS_TO_ADULTS("Kids to Adults"),
    M("M"),
    MA15_PLUS("MA15+"),
    MATURE_17_PLUS("Mature 17+"),
    PG("PG"),
    R18_PLUS("R18+"),
    RATING_PENDING("Rating Pending"),
    TEEN("Teen"),
    X18_PLUS("X18+");

    public static final String FIELD = "AgeRating";

    @JsonValue
    private final String value;

    public static AgeRating fromValue(String value) {
        return SchemaValue.lenient(AgeRating.class, value, UNKNOWN);
    }

    public static AgeRating parse(String value) throws InvalidEnumException {
        return SchemaValue.strict(AgeRating.class, FIELD, value);
    }
}
