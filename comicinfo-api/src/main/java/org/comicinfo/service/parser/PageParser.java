package org.comicinfo.service.parser;

import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;
import org.comicinfo.exception.ComicInfoError;
import org.comicinfo.exception.ComicInfoException;
import org.comicinfo.model.Page;
import org.comicinfo.model.enums.PageType;
import org.comicinfo.util.ComicInfoXmlUtils;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the {@code <Pages>} block. Page metadata lives in attributes; DoublePage, ImageSize,
 * ImageWidth and ImageHeight fall back to their defaults on unreadable values, while Image and
 * Type are validated strictly.
 */
@UtilityClass
public class PageParser {

    static final String PAGES = "Pages";
    static final String PAGE = "Page";
    static final String IMAGE_FIELD = "Page.Image";

    public static List<Page> parsePages(Element root) throws ComicInfoException {
        Element pagesElement = ComicInfoXmlUtils.firstChild(root, PAGES);
        if (pagesElement == null) {
            return List.of();
        }
        List<Page> pages = new ArrayList<>();
        for (Element pageElement : ComicInfoXmlUtils.children(pagesElement, PAGE)) {
            pages.add(parsePage(pageElement));
        }
        return pages;
    }

    public static Page parsePage(Element pageElement) throws ComicInfoException {
        String image = ComicInfoXmlUtils.getAttribute(pageElement, "Image");
        if (image == null) {
            throw ComicInfoError.SCHEMA_ERROR.createException("Page element missing required Image attribute");
        }

        return Page.builder()
                .image(ComicInfoXmlUtils.parseInteger(IMAGE_FIELD, StringUtils.strip(image)))
                .type(PageType.parse(ComicInfoXmlUtils.getAttribute(pageElement, "Type", PageType.STORY.getValue())))
                .doublePage(ComicInfoXmlUtils.getLenientBoolean(pageElement, "DoublePage"))
                .imageSize(ComicInfoXmlUtils.getLenientLong(pageElement, "ImageSize", 0L))
                .key(ComicInfoXmlUtils.getAttribute(pageElement, "Key", ""))
                .bookmark(ComicInfoXmlUtils.getAttribute(pageElement, "Bookmark", ""))
                .imageWidth(ComicInfoXmlUtils.getLenientInt(pageElement, "ImageWidth", Page.UNKNOWN_DIMENSION))
                .imageHeight(ComicInfoXmlUtils.getLenientInt(pageElement, "ImageHeight", Page.UNKNOWN_DIMENSION))
                .build();
    }
}
