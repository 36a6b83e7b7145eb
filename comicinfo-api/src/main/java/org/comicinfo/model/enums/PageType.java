package org.comicinfo.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.comicinfo.exception.InvalidEnumException;

import java.util.EnumSet;
import java.util.Set;

/**
 * Role of a single page image inside the archive. Unspecified pages are story pages.
 */
@Getter
@RequiredArgsConstructor
public enum PageType implements SchemaValue {
    FRONT_COVER("FrontCover"),
    INNER_COVER("InnerCover"),
    ROUNDUP("Roundup"),
    STORY("Story"),
    ADVERTISEMENT("Advertisement"),
    EDITORIAL("Editorial"),
    LETTERS("Letters"),
    PREVIEW("Preview"),
    BACK_COVER("BackCover"),
    OTHER("Other"),
    DELETED("Deleted");

    public static final String FIELD = "PageType";

    private static final Set<PageType> COVERS = EnumSet.of(FRONT_COVER, INNER_COVER, BACK_COVER);

    @JsonValue
    private final String value;

    public boolean isCover() {
        return COVERS.contains(this);
    }

    public boolean isStory() {
        return this == STORY;
    }

    public boolean isDeleted() {
        return this == DELETED;
    }

    public static PageType fromValue(String value) {
        return SchemaValue.lenient(PageType.class, value, STORY);
    }

    public static PageType parse(String value) throws InvalidEnumException {
        return SchemaValue.strict(PageType.class, FIELD, value);
    }
}
