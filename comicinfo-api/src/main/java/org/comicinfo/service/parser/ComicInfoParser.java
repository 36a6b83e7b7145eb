package org.comicinfo.service.parser;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.comicinfo.exception.ComicInfoError;
import org.comicinfo.exception.ComicInfoException;
import org.comicinfo.model.Issue;
import org.comicinfo.model.enums.AgeRating;
import org.comicinfo.model.enums.BlackAndWhite;
import org.comicinfo.model.enums.Manga;
import org.comicinfo.util.SecureXmlUtils;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;

import static org.comicinfo.util.ComicInfoXmlUtils.getDouble;
import static org.comicinfo.util.ComicInfoXmlUtils.getInteger;
import static org.comicinfo.util.ComicInfoXmlUtils.getText;
import static org.comicinfo.util.ComicInfoXmlUtils.getValue;

/**
 * Turns ComicInfo.xml text into an {@link Issue}. The first invalid field aborts the whole
 * document; no partially populated issue is ever returned.
 */
@Slf4j
public class ComicInfoParser {

    public static final String ROOT_ELEMENT = "ComicInfo";

    public Issue parse(String xml) throws ComicInfoException {
        if (StringUtils.isBlank(xml)) {
            throw ComicInfoError.PARSE_ERROR.createException("XML string cannot be null or empty");
        }

        Document document = buildDocument(xml);
        Element root = document.getDocumentElement();
        if (root == null) {
            throw ComicInfoError.PARSE_ERROR.createException("No root element found");
        }
        if (!ROOT_ELEMENT.equals(root.getNodeName())) {
            throw ComicInfoError.PARSE_ERROR.createException("No " + ROOT_ELEMENT + " root element found, got <" + root.getNodeName() + ">");
        }

        Issue issue = mapRootToIssue(root);
        log.debug("Parsed ComicInfo - Title: {}, Series: {}, Pages: {}", issue.getTitle(), issue.getSeries(), issue.getPages().size());
        return issue;
    }

    private Document buildDocument(String xml) throws ComicInfoException {
        try {
            DocumentBuilder builder = SecureXmlUtils.createSecureDocumentBuilder(true);
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (SAXException e) {
            log.warn("Rejected malformed ComicInfo XML: {}", e.getMessage());
            throw ComicInfoError.PARSE_ERROR.createException(e, "Invalid XML syntax: " + e.getMessage());
        } catch (ParserConfigurationException | IOException e) {
            throw ComicInfoError.PARSE_ERROR.createException(e, "Could not read XML: " + e.getMessage());
        }
    }

    private Issue mapRootToIssue(Element root) throws ComicInfoException {
        return Issue.builder()
                .title(getText(root, "Title"))
                .series(getText(root, "Series"))
                .number(getText(root, "Number"))
                .count(getInteger(root, "Count"))
                .volume(getInteger(root, "Volume"))
                .alternateSeries(getText(root, "AlternateSeries"))
                .alternateNumber(getText(root, "AlternateNumber"))
                .alternateCount(getInteger(root, "AlternateCount"))
                .summary(getText(root, "Summary"))
                .notes(getText(root, "Notes"))
                .year(getInteger(root, "Year", Issue.MIN_YEAR, Issue.MAX_YEAR))
                .month(getInteger(root, "Month", Issue.MIN_MONTH, Issue.MAX_MONTH))
                .day(getInteger(root, "Day", Issue.MIN_DAY, Issue.MAX_DAY))
                .writer(getText(root, "Writer"))
                .penciller(getText(root, "Penciller"))
                .inker(getText(root, "Inker"))
                .colorist(getText(root, "Colorist"))
                .letterer(getText(root, "Letterer"))
                .coverArtist(getText(root, "CoverArtist"))
                .editor(getText(root, "Editor"))
                .translator(getText(root, "Translator"))
                .publisher(getText(root, "Publisher"))
                .imprint(getText(root, "Imprint"))
                .genre(getText(root, "Genre"))
                .tags(getText(root, "Tags"))
                .web(getText(root, "Web"))
                .pageCount(getInteger(root, "PageCount"))
                .languageISO(getText(root, "LanguageISO"))
                .format(getText(root, "Format"))
                .blackAndWhite(getValue(root, BlackAndWhite.FIELD, BlackAndWhite::parse))
                .manga(getValue(root, Manga.FIELD, Manga::parse))
                .characters(getText(root, "Characters"))
                .teams(getText(root, "Teams"))
                .locations(getText(root, "Locations"))
                .scanInformation(getText(root, "ScanInformation"))
                .storyArc(getText(root, "StoryArc"))
                .storyArcNumber(getText(root, "StoryArcNumber"))
                .seriesGroup(getText(root, "SeriesGroup"))
                .ageRating(getValue(root, AgeRating.FIELD, AgeRating::parse))
                .pages(PageParser.parsePages(root))
                .communityRating(getDouble(root, "CommunityRating", Issue.MIN_COMMUNITY_RATING, Issue.MAX_COMMUNITY_RATING))
                .mainCharacterOrTeam(getText(root, "MainCharacterOrTeam"))
                .review(getText(root, "Review"))
                .build();
    }
}
