package org.comicinfo.service.writer;

import jakarta.xml.bind.JAXBContext;
import jakarta.xml.bind.JAXBException;
import jakarta.xml.bind.Marshaller;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.comicinfo.config.ComicInfoProperties;
import org.comicinfo.exception.ComicInfoError;
import org.comicinfo.exception.ComicInfoException;
import org.comicinfo.model.Issue;
import org.comicinfo.model.Page;
import org.comicinfo.model.enums.PageType;
import org.comicinfo.model.enums.SchemaValue;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;

/**
 * Writes an {@link Issue} as ComicInfo.xml. Absent fields are left out entirely and page attributes
 * are only written when they differ from their defaults, so reading the output back yields an
 * equal issue.
 */
@Slf4j
@RequiredArgsConstructor
public class ComicInfoXmlWriter {

    private static final JAXBContext JAXB_CONTEXT;

    static {
        try {
            JAXB_CONTEXT = JAXBContext.newInstance(ComicInfoDocument.class);
        } catch (JAXBException e) {
            throw new ExceptionInInitializerError(e);
        }
    }

    private final ComicInfoProperties properties;

    public ComicInfoXmlWriter() {
        this(new ComicInfoProperties());
    }

    public String write(Issue issue) throws ComicInfoException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        write(issue, out);
        return out.toString(StandardCharsets.UTF_8);
    }

    public void write(Issue issue, OutputStream out) throws ComicInfoException {
        try {
            Marshaller marshaller = JAXB_CONTEXT.createMarshaller();
            marshaller.setProperty(Marshaller.JAXB_FORMATTED_OUTPUT, properties.getXml().isPrettyPrint());
            marshaller.setProperty(Marshaller.JAXB_ENCODING, StandardCharsets.UTF_8.name());
            marshaller.setProperty(Marshaller.JAXB_FRAGMENT, false);
            marshaller.setProperty(ComicInfoEscapeHandler.PROPERTY, ComicInfoEscapeHandler.INSTANCE);
            marshaller.marshal(toDocument(issue), out);
        } catch (JAXBException e) {
            log.warn("Failed to write ComicInfo XML for '{}': {}", issue.getTitle(), e.getMessage());
            throw ComicInfoError.PARSE_ERROR.createException(e, "Failed to render ComicInfo XML: " + e.getMessage());
        }
    }

    ComicInfoDocument toDocument(Issue issue) throws ComicInfoException {
        ComicInfoDocument info = new ComicInfoDocument();
        info.setTitle(issue.getTitle());
        info.setSeries(issue.getSeries());
        info.setNumber(issue.getNumber());
        info.setCount(issue.getCount());
        info.setVolume(issue.getVolume());
        info.setAlternateSeries(issue.getAlternateSeries());
        info.setAlternateNumber(issue.getAlternateNumber());
        info.setAlternateCount(issue.getAlternateCount());
        info.setSummary(issue.getSummary());
        info.setNotes(issue.getNotes());
        info.setYear(issue.getYear());
        info.setMonth(issue.getMonth());
        info.setDay(issue.getDay());
        info.setWriter(issue.getWriter());
        info.setPenciller(issue.getPenciller());
        info.setInker(issue.getInker());
        info.setColorist(issue.getColorist());
        info.setLetterer(issue.getLetterer());
        info.setCoverArtist(issue.getCoverArtist());
        info.setEditor(issue.getEditor());
        info.setTranslator(issue.getTranslator());
        info.setPublisher(issue.getPublisher());
        info.setImprint(issue.getImprint());
        info.setGenre(issue.getGenre());
        info.setTags(issue.getTags());
        info.setWeb(issue.getWeb());
        info.setPageCount(issue.getPageCount());
        info.setLanguageISO(issue.getLanguageISO());
        info.setFormat(issue.getFormat());
        info.setBlackAndWhite(valueOf(issue.getBlackAndWhite()));
        info.setManga(valueOf(issue.getManga()));
        info.setCharacters(issue.getCharacters());
        info.setTeams(issue.getTeams());
        info.setLocations(issue.getLocations());
        info.setScanInformation(issue.getScanInformation());
        info.setStoryArc(issue.getStoryArc());
        info.setStoryArcNumber(issue.getStoryArcNumber());
        info.setSeriesGroup(issue.getSeriesGroup());
        info.setAgeRating(valueOf(issue.getAgeRating()));
        if (issue.hasPages()) {
            ComicInfoDocument.Pages pages = new ComicInfoDocument.Pages();
            issue.getPages().forEach(page -> pages.getPage().add(toPageEntry(page)));
            info.setPages(pages);
        }
        Double rating = issue.getCommunityRating();
        if (rating != null) {
            if (rating.isNaN() || rating.isInfinite()) {
                throw ComicInfoError.PARSE_ERROR.createException("Failed to render ComicInfo XML: CommunityRating '" + rating + "' is not a finite number");
            }
            info.setCommunityRating(BigDecimal.valueOf(rating).toPlainString());
        }
        info.setMainCharacterOrTeam(issue.getMainCharacterOrTeam());
        info.setReview(issue.getReview());
        return info;
    }

    private ComicInfoDocument.PageEntry toPageEntry(Page page) {
        ComicInfoDocument.PageEntry entry = new ComicInfoDocument.PageEntry();
        entry.setImage(page.getImage());
        entry.setType(page.getType() == null ? PageType.STORY.getValue() : page.getType().getValue());
        if (page.isDoublePage()) {
            entry.setDoublePage(Boolean.TRUE);
        }
        if (page.getImageSize() != 0L) {
            entry.setImageSize(page.getImageSize());
        }
        if (StringUtils.isNotEmpty(page.getKey())) {
            entry.setKey(page.getKey());
        }
        if (page.isBookmarked()) {
            entry.setBookmark(page.getBookmark());
        }
        if (page.getImageWidth() != Page.UNKNOWN_DIMENSION) {
            entry.setImageWidth(page.getImageWidth());
        }
        if (page.getImageHeight() != Page.UNKNOWN_DIMENSION) {
            entry.setImageHeight(page.getImageHeight());
        }
        return entry;
    }

    private static String valueOf(SchemaValue value) {
        return value == null ? null : value.getValue();
    }
}
