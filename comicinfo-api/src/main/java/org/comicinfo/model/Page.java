package org.comicinfo.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.apache.commons.lang3.StringUtils;
import org.comicinfo.model.enums.PageType;

import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Metadata for one page image of an issue, as carried by the attributes of a {@code <Page>} element.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class Page {

    public static final int UNKNOWN_DIMENSION = -1;

    int image;

    @Builder.Default
    PageType type = PageType.STORY;

    @Builder.Default
    boolean doublePage = false;

    // 0 means the size was not recorded
    @Builder.Default
    long imageSize = 0L;

    @Builder.Default
    String key = "";

    @Builder.Default
    String bookmark = "";

    @Builder.Default
    int imageWidth = UNKNOWN_DIMENSION;

    @Builder.Default
    int imageHeight = UNKNOWN_DIMENSION;

    public static Page of(int image) {
        return builder().image(image).build();
    }

    public boolean isCover() {
        return type != null && type.isCover();
    }

    public boolean isStory() {
        return type != null && type.isStory();
    }

    public boolean isDeleted() {
        return type != null && type.isDeleted();
    }

    public boolean isBookmarked() {
        return StringUtils.isNotEmpty(bookmark);
    }

    public OptionalInt getWidth() {
        return imageWidth == UNKNOWN_DIMENSION ? OptionalInt.empty() : OptionalInt.of(imageWidth);
    }

    public OptionalInt getHeight() {
        return imageHeight == UNKNOWN_DIMENSION ? OptionalInt.empty() : OptionalInt.of(imageHeight);
    }

    public boolean dimensionsAvailable() {
        return imageWidth != UNKNOWN_DIMENSION && imageHeight != UNKNOWN_DIMENSION;
    }

    public OptionalDouble getAspectRatio() {
        if (!dimensionsAvailable() || imageHeight == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((double) imageWidth / imageHeight);
    }
}
