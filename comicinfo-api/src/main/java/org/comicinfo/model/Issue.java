package org.comicinfo.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.apache.commons.lang3.StringUtils;
import org.comicinfo.model.enums.AgeRating;
import org.comicinfo.model.enums.BlackAndWhite;
import org.comicinfo.model.enums.Manga;
import org.comicinfo.util.MultiValueUtils;

import java.net.URI;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Metadata of one comic book issue, as described by a ComicInfo.xml document.
 * <p>
 * Every field except {@code pages} is optional and {@code null} when absent. String fields are
 * trimmed on construction and blank values are stored as {@code null}. Multi-value fields
 * (Characters, Genre, Web, ...) are kept as the raw delimited string; the {@code get...List()}
 * accessors derive the split view on each call.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class Issue {

    public static final int MIN_YEAR = 1000;
    public static final int MAX_YEAR = 9999;
    public static final int MIN_MONTH = 1;
    public static final int MAX_MONTH = 12;
    public static final int MIN_DAY = 1;
    public static final int MAX_DAY = 31;
    public static final double MIN_COMMUNITY_RATING = 0.0;
    public static final double MAX_COMMUNITY_RATING = 5.0;

    String title;
    String series;
    String number;
    Integer count;
    Integer volume;
    String alternateSeries;
    String alternateNumber;
    Integer alternateCount;
    String summary;
    String notes;
    Integer year;
    Integer month;
    Integer day;
    String writer;
    String penciller;
    String inker;
    String colorist;
    String letterer;
    String coverArtist;
    String editor;
    String translator;
    String publisher;
    String imprint;
    String genre;
    String tags;
    String web;
    Integer pageCount;
    String languageISO;
    String format;
    BlackAndWhite blackAndWhite;
    Manga manga;
    String characters;
    String teams;
    String locations;
    String scanInformation;
    String storyArc;
    String storyArcNumber;
    String seriesGroup;
    AgeRating ageRating;
    List<Page> pages;
    Double communityRating;
    String mainCharacterOrTeam;
    String review;

    @Builder(toBuilder = true)
    @Jacksonized
    private Issue(String title, String series, String number, Integer count, Integer volume,
                  String alternateSeries, String alternateNumber, Integer alternateCount,
                  String summary, String notes, Integer year, Integer month, Integer day,
                  String writer, String penciller, String inker, String colorist, String letterer,
                  String coverArtist, String editor, String translator, String publisher, String imprint,
                  String genre, String tags, String web, Integer pageCount, String languageISO, String format,
                  BlackAndWhite blackAndWhite, Manga manga, String characters, String teams, String locations,
                  String scanInformation, String storyArc, String storyArcNumber, String seriesGroup,
                  AgeRating ageRating, @Singular List<Page> pages, Double communityRating,
                  String mainCharacterOrTeam, String review) {
        this.title = StringUtils.stripToNull(title);
        this.series = StringUtils.stripToNull(series);
        this.number = StringUtils.stripToNull(number);
        this.count = count;
        this.volume = volume;
        this.alternateSeries = StringUtils.stripToNull(alternateSeries);
        this.alternateNumber = StringUtils.stripToNull(alternateNumber);
        this.alternateCount = alternateCount;
        this.summary = StringUtils.stripToNull(summary);
        this.notes = StringUtils.stripToNull(notes);
        this.year = year;
        this.month = month;
        this.day = day;
        this.writer = StringUtils.stripToNull(writer);
        this.penciller = StringUtils.stripToNull(penciller);
        this.inker = StringUtils.stripToNull(inker);
        this.colorist = StringUtils.stripToNull(colorist);
        this.letterer = StringUtils.stripToNull(letterer);
        this.coverArtist = StringUtils.stripToNull(coverArtist);
        this.editor = StringUtils.stripToNull(editor);
        this.translator = StringUtils.stripToNull(translator);
        this.publisher = StringUtils.stripToNull(publisher);
        this.imprint = StringUtils.stripToNull(imprint);
        this.genre = StringUtils.stripToNull(genre);
        this.tags = StringUtils.stripToNull(tags);
        this.web = StringUtils.stripToNull(web);
        this.pageCount = pageCount;
        this.languageISO = StringUtils.stripToNull(languageISO);
        this.format = StringUtils.stripToNull(format);
        this.blackAndWhite = blackAndWhite;
        this.manga = manga;
        this.characters = StringUtils.stripToNull(characters);
        this.teams = StringUtils.stripToNull(teams);
        this.locations = StringUtils.stripToNull(locations);
        this.scanInformation = StringUtils.stripToNull(scanInformation);
        this.storyArc = StringUtils.stripToNull(storyArc);
        this.storyArcNumber = StringUtils.stripToNull(storyArcNumber);
        this.seriesGroup = StringUtils.stripToNull(seriesGroup);
        this.ageRating = ageRating;
        this.pages = pages == null ? List.of() : List.copyOf(pages);
        this.communityRating = communityRating;
        this.mainCharacterOrTeam = StringUtils.stripToNull(mainCharacterOrTeam);
        this.review = StringUtils.stripToNull(review);
    }

    public List<String> getCharacterList() {
        return MultiValueUtils.splitValues(characters);
    }

    public List<String> getTeamList() {
        return MultiValueUtils.splitValues(teams);
    }

    public List<String> getLocationList() {
        return MultiValueUtils.splitValues(locations);
    }

    public List<String> getGenreList() {
        return MultiValueUtils.splitValues(genre);
    }

    public List<String> getTagList() {
        return MultiValueUtils.splitValues(tags);
    }

    public List<String> getStoryArcList() {
        return MultiValueUtils.splitValues(storyArc);
    }

    public List<String> getStoryArcNumberList() {
        return MultiValueUtils.splitValues(storyArcNumber);
    }

    public List<URI> getWebUrls() {
        return MultiValueUtils.splitUrls(web);
    }

    public boolean hasPages() {
        return !pages.isEmpty();
    }

    public List<Page> getCoverPages() {
        return pages.stream().filter(Page::isCover).collect(Collectors.toUnmodifiableList());
    }

    public List<Page> getStoryPages() {
        return pages.stream().filter(Page::isStory).collect(Collectors.toUnmodifiableList());
    }

    public boolean isManga() {
        return manga != null && manga.isManga();
    }

    public boolean isRightToLeft() {
        return manga != null && manga.isRightToLeft();
    }

    public boolean isBlackAndWhite() {
        return blackAndWhite != null && blackAndWhite.isBlackAndWhite();
    }

    /**
     * Combines Year, Month and Day into a date. Missing month or day default to 1, and a day past
     * the end of its month rolls over into the next one (February 31 becomes March 2 or 3).
     *
     * @return the publication date, or empty unless a year between 1 and {@value #MAX_YEAR} is set
     */
    public Optional<LocalDate> getPublicationDate() {
        if (year == null || year <= 0 || year > MAX_YEAR) {
            return Optional.empty();
        }
        int m = month == null ? 1 : month;
        int d = day == null ? 1 : day;
        return Optional.of(LocalDate.of(year, 1, 1).plusMonths(m - 1L).plusDays(d - 1L));
    }

    /**
     * Adds list-valued setters for the multi-value fields. Each joins its parts with
     * {@value MultiValueUtils#JOIN_DELIMITER}; an empty list clears the field.
     */
    public static class IssueBuilder {

        public IssueBuilder characterList(List<String> characters) {
            return characters(MultiValueUtils.joinValues(characters));
        }

        public IssueBuilder teamList(List<String> teams) {
            return teams(MultiValueUtils.joinValues(teams));
        }

        public IssueBuilder locationList(List<String> locations) {
            return locations(MultiValueUtils.joinValues(locations));
        }

        public IssueBuilder genreList(List<String> genres) {
            return genre(MultiValueUtils.joinValues(genres));
        }

        public IssueBuilder tagList(List<String> tags) {
            return tags(MultiValueUtils.joinValues(tags));
        }

        public IssueBuilder storyArcList(List<String> storyArcs) {
            return storyArc(MultiValueUtils.joinValues(storyArcs));
        }

        public IssueBuilder storyArcNumberList(List<String> storyArcNumbers) {
            return storyArcNumber(MultiValueUtils.joinValues(storyArcNumbers));
        }

        public IssueBuilder webUrls(List<URI> urls) {
            return web(urls == null ? null : urls.stream().map(URI::toString).collect(Collectors.joining(" ")));
        }
    }
}
