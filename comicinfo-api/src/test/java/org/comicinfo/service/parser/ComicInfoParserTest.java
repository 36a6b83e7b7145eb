package org.comicinfo.service.parser;

import org.comicinfo.exception.ComicInfoError;
import org.comicinfo.exception.ComicInfoException;
import org.comicinfo.exception.InvalidEnumException;
import org.comicinfo.exception.RangeException;
import org.comicinfo.exception.TypeCoercionException;
import org.comicinfo.model.Issue;
import org.comicinfo.model.Page;
import org.comicinfo.model.enums.AgeRating;
import org.comicinfo.model.enums.BlackAndWhite;
import org.comicinfo.model.enums.Manga;
import org.comicinfo.model.enums.PageType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ComicInfoParserTest {

    private ComicInfoParser parser;

    @BeforeEach
    void setUp() {
        parser = new ComicInfoParser();
    }

    static String fixture(String name) throws IOException {
        try (InputStream is = ComicInfoParserTest.class.getResourceAsStream("/fixtures/" + name)) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static String doc(String body) {
        return "<ComicInfo>" + body + "</ComicInfo>";
    }

    @Test
    void minimalDocument() throws Exception {
        Issue issue = parser.parse("<ComicInfo><Title>Minimal Comic</Title><Series>Test Series</Series><Number>1</Number></ComicInfo>");

        assertThat(issue).isEqualTo(Issue.builder().title("Minimal Comic").series("Test Series").number("1").build());
        assertThat(issue.getYear()).isNull();
        assertThat(issue.getManga()).isNull();
        assertThat(issue.getPages()).isEmpty();
    }

    @Test
    void minimalFixtureWithXmlDeclaration() throws Exception {
        Issue issue = parser.parse(fixture("minimal.xml"));

        assertThat(issue.getTitle()).isEqualTo("Minimal Comic");
        assertThat(issue.getSeries()).isEqualTo("Test Series");
        assertThat(issue.getNumber()).isEqualTo("1");
    }

    @Test
    void completeFixture() throws Exception {
        Issue issue = parser.parse(fixture("complete.xml"));

        assertThat(issue.getTitle()).isEqualTo("The Beginning");
        assertThat(issue.getSeries()).isEqualTo("Amazing Adventures");
        assertThat(issue.getNumber()).isEqualTo("1");
        assertThat(issue.getCount()).isEqualTo(12);
        assertThat(issue.getVolume()).isEqualTo(2);
        assertThat(issue.getAlternateSeries()).isEqualTo("Amazing Crossover");
        assertThat(issue.getAlternateNumber()).isEqualTo("5");
        assertThat(issue.getAlternateCount()).isEqualTo(6);
        assertThat(issue.getSummary()).isEqualTo("Our heroes begin their journey.");
        assertThat(issue.getNotes()).isEqualTo("Scanned from the original print run.");
        assertThat(issue.getPublicationDate()).hasValue(LocalDate.of(2023, 6, 15));
        assertThat(issue.getWriter()).isEqualTo("Jane Writer");
        assertThat(issue.getPenciller()).isEqualTo("John Artist");
        assertThat(issue.getInker()).isEqualTo("Ink Master");
        assertThat(issue.getColorist()).isEqualTo("Color Wizard");
        assertThat(issue.getLetterer()).isEqualTo("Letter Expert");
        assertThat(issue.getCoverArtist()).isEqualTo("Cover Artist");
        assertThat(issue.getEditor()).isEqualTo("Editor Supreme");
        assertThat(issue.getTranslator()).isEqualTo("Lang Expert");
        assertThat(issue.getPublisher()).isEqualTo("Marvel Comics");
        assertThat(issue.getImprint()).isEqualTo("Marvel Knights");
        assertThat(issue.getGenreList()).containsExactly("Action", "Adventure", "Superhero");
        assertThat(issue.getTagList()).containsExactly("origin", "team-up");
        assertThat(issue.getWebUrls()).containsExactly(URI.create("https://example.com/comics/1"), URI.create("https://example.org/issue-1"));
        assertThat(issue.getPageCount()).isEqualTo(24);
        assertThat(issue.getLanguageISO()).isEqualTo("en");
        assertThat(issue.getFormat()).isEqualTo("Comic");
        assertThat(issue.getBlackAndWhite()).isEqualTo(BlackAndWhite.NO);
        assertThat(issue.getManga()).isEqualTo(Manga.NO);
        assertThat(issue.getCharacterList()).containsExactly("Spider-Man", "Peter Parker", "Mary Jane");
        assertThat(issue.getTeamList()).containsExactly("Avengers", "X-Men");
        assertThat(issue.getLocationList()).containsExactly("New York", "Manhattan");
        assertThat(issue.getScanInformation()).isEqualTo("Scanned at 300 DPI");
        assertThat(issue.getStoryArcList()).containsExactly("Civil War", "Secret Wars");
        assertThat(issue.getStoryArcNumberList()).containsExactly("1", "3");
        assertThat(issue.getSeriesGroup()).isEqualTo("Marvel Universe");
        assertThat(issue.getAgeRating()).isEqualTo(AgeRating.TEEN);
        assertThat(issue.getCommunityRating()).isEqualTo(4.5);
        assertThat(issue.getMainCharacterOrTeam()).isEqualTo("Spider-Man");
        assertThat(issue.getReview()).isEqualTo("A strong opening issue.");

        assertThat(issue.getPages()).extracting(Page::getImage).containsExactly(0, 1, 2, 3, 4);
        assertThat(issue.getCoverPages()).extracting(Page::getImage).containsExactly(0, 4);
        assertThat(issue.getStoryPages()).extracting(Page::getImage).containsExactly(1, 2);
        Page spread = issue.getPages().get(2);
        assertThat(spread.isDoublePage()).isTrue();
        assertThat(spread.getBookmark()).isEqualTo("Big reveal");
        assertThat(spread.getAspectRatio().getAsDouble()).isEqualTo(4.0 / 3.0);
        assertThat(issue.getPages().get(1).getKey()).isEqualTo("p1");
        assertThat(issue.getPages().get(3).getType()).isEqualTo(PageType.ADVERTISEMENT);
    }

    @Test
    void whitespaceAroundValuesIsTrimmed() throws Exception {
        Issue padded = parser.parse(doc("<Title>\n   Padded  \t</Title><Year>  2001 </Year><Manga> Yes </Manga><CommunityRating> 3.5 </CommunityRating>"));
        Issue trimmed = parser.parse(doc("<Title>Padded</Title><Year>2001</Year><Manga>Yes</Manga><CommunityRating>3.5</CommunityRating>"));

        assertThat(padded).isEqualTo(trimmed);
    }

    @Test
    void blankElementsAreAbsent() throws Exception {
        Issue issue = parser.parse(doc("<Title>   </Title><Summary/><Month></Month><Day> </Day><Year/><Manga></Manga><CommunityRating> </CommunityRating>"));

        assertThat(issue).isEqualTo(Issue.builder().build());
    }

    @Test
    void firstOccurrenceWins() throws Exception {
        Issue issue = parser.parse(doc("<Title>First</Title><Title>Second</Title>"));

        assertThat(issue.getTitle()).isEqualTo("First");
    }

    @Test
    void declaredNamespacesAreAccepted() throws Exception {
        Issue issue = parser.parse("<ComicInfo xmlns:xsd=\"http://www.w3.org/2001/XMLSchema\" "
                + "xmlns:xsi=\"http://www.w3.org/2001/XMLSchema-instance\"><Title>NS</Title></ComicInfo>");

        assertThat(issue.getTitle()).isEqualTo("NS");
    }

    @Test
    void escapedTextIsDecoded() throws Exception {
        Issue issue = parser.parse(doc("<Summary>Tom &amp; Jerry &lt;3</Summary>"));

        assertThat(issue.getSummary()).isEqualTo("Tom & Jerry <3");
    }

    @Nested
    @DisplayName("document level errors")
    class DocumentErrors {

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "\n"})
        void blankInput(String input) {
            assertParseError(input);
        }

        @Test
        void nullInput() {
            assertParseError(null);
        }

        @Test
        void mismatchedClosingTag() {
            assertParseError("<ComicInfo><Title>Test</ComicInfo>");
        }

        @Test
        void notXmlAtAll() {
            assertParseError("this is not xml");
        }

        @Test
        void wrongRootElement() {
            assertParseError("<ComicBook><Title>Test</Title></ComicBook>");
        }

        @Test
        void rootNameIsCaseSensitive() {
            assertParseError("<comicinfo><Title>Test</Title></comicinfo>");
        }

        @Test
        void doctypeIsRejected() {
            assertParseError("<?xml version=\"1.0\"?><!DOCTYPE ComicInfo [<!ENTITY x SYSTEM \"file:///etc/passwd\">]>"
                    + "<ComicInfo><Title>&x;</Title></ComicInfo>");
        }

        private void assertParseError(String xml) {
            assertThatThrownBy(() -> parser.parse(xml))
                    .isInstanceOfSatisfying(ComicInfoException.class,
                            ex -> assertThat(ex.getError()).isEqualTo(ComicInfoError.PARSE_ERROR));
        }
    }

    @Nested
    @DisplayName("range boundaries")
    class RangeBoundaries {

        @ParameterizedTest
        @ValueSource(strings = {"1000", "9999"})
        void yearInRange(String year) throws Exception {
            assertThat(parser.parse(doc("<Year>" + year + "</Year>")).getYear()).isEqualTo(Integer.parseInt(year));
        }

        @ParameterizedTest
        @CsvSource({
                "Year, 999, 1000, 9999",
                "Year, 10000, 1000, 9999",
                "Month, 0, 1, 12",
                "Month, 13, 1, 12",
                "Day, 0, 1, 31",
                "Day, 32, 1, 31",
                "CommunityRating, 5.1, 0.0, 5.0",
                "CommunityRating, -0.1, 0.0, 5.0",
        })
        void outOfRange(String field, String value, String min, String max) {
            assertThatThrownBy(() -> parser.parse(doc("<" + field + ">" + value + "</" + field + ">")))
                    .isInstanceOfSatisfying(RangeException.class, ex -> {
                        assertThat(ex.getError()).isEqualTo(ComicInfoError.RANGE_ERROR);
                        assertThat(ex.getField()).isEqualTo(field);
                        assertThat(ex.getValue()).isEqualTo(value);
                        assertThat(ex.getMin()).isEqualTo(min);
                        assertThat(ex.getMax()).isEqualTo(max);
                    });
        }

        @Test
        void ratingBounds() throws Exception {
            assertThat(parser.parse(doc("<CommunityRating>5.0</CommunityRating>")).getCommunityRating()).isEqualTo(5.0);
            assertThat(parser.parse(doc("<CommunityRating>0</CommunityRating>")).getCommunityRating()).isEqualTo(0.0);
        }

        @Test
        void dayIsNotCheckedAgainstMonth() throws Exception {
            Issue issue = parser.parse(doc("<Year>2023</Year><Month>2</Month><Day>31</Day>"));

            assertThat(issue.getDay()).isEqualTo(31);
        }

        @Test
        void blankMonthIsAbsent() throws Exception {
            assertThat(parser.parse(doc("<Month></Month>")).getMonth()).isNull();
        }
    }

    @Nested
    @DisplayName("coercion and enum errors")
    class FieldErrors {

        @Test
        void dayNotANumber() {
            assertThatThrownBy(() -> parser.parse(doc("<Day>not a number</Day>")))
                    .isInstanceOfSatisfying(TypeCoercionException.class, ex -> {
                        assertThat(ex.getField()).isEqualTo("Day");
                        assertThat(ex.getValue()).isEqualTo("not a number");
                        assertThat(ex.getExpectedType()).isEqualTo("Int");
                    });
        }

        @ParameterizedTest
        @ValueSource(strings = {"Count", "Volume", "AlternateCount", "PageCount", "Year", "Month"})
        void integerFieldsRejectDecimals(String field) {
            assertThatThrownBy(() -> parser.parse(doc("<" + field + ">1.5</" + field + ">")))
                    .isInstanceOfSatisfying(TypeCoercionException.class, ex -> {
                        assertThat(ex.getField()).isEqualTo(field);
                        assertThat(ex.getExpectedType()).isEqualTo("Int");
                    });
        }

        @Test
        void ratingNotADecimal() {
            assertThatThrownBy(() -> parser.parse(doc("<CommunityRating>great</CommunityRating>")))
                    .isInstanceOfSatisfying(TypeCoercionException.class, ex -> {
                        assertThat(ex.getField()).isEqualTo("CommunityRating");
                        assertThat(ex.getExpectedType()).isEqualTo("Double");
                    });
        }

        @Test
        void invalidManga() {
            assertThatThrownBy(() -> parser.parse(doc("<Manga>InvalidValue</Manga>")))
                    .isInstanceOfSatisfying(InvalidEnumException.class, ex -> {
                        assertThat(ex.getField()).isEqualTo("Manga");
                        assertThat(ex.getValue()).isEqualTo("InvalidValue");
                        assertThat(ex.getValidValues()).containsExactly("Unknown", "No", "Yes", "YesAndRightToLeft");
                    });
        }

        @Test
        void invalidAgeRatingAndBlackAndWhite() {
            assertThatThrownBy(() -> parser.parse(doc("<AgeRating>PG-13</AgeRating>")))
                    .isInstanceOfSatisfying(InvalidEnumException.class, ex -> assertThat(ex.getField()).isEqualTo("AgeRating"));
            assertThatThrownBy(() -> parser.parse(doc("<BlackAndWhite>Sometimes</BlackAndWhite>")))
                    .isInstanceOfSatisfying(InvalidEnumException.class, ex -> assertThat(ex.getField()).isEqualTo("BlackAndWhite"));
        }

        @Test
        void enumUnknownIsDistinctFromAbsent() throws Exception {
            assertThat(parser.parse(doc("<Manga>Unknown</Manga>")).getManga()).isEqualTo(Manga.UNKNOWN);
            assertThat(parser.parse(doc("<Title>x</Title>")).getManga()).isNull();
        }

        @Test
        void firstInvalidFieldAborts() {
            assertThatThrownBy(() -> parser.parse(doc("<Year>99</Year><Manga>Nope</Manga>")))
                    .isInstanceOf(RangeException.class);
        }

        @Test
        void pageErrorsAbortTheWholeDocument() {
            assertThatThrownBy(() -> parser.parse(doc("<Title>Ok</Title><Pages><Page Image=\"0\"/><Page Type=\"Story\"/></Pages>")))
                    .isInstanceOfSatisfying(ComicInfoException.class,
                            ex -> assertThat(ex.getError()).isEqualTo(ComicInfoError.SCHEMA_ERROR));
        }
    }

    @Nested
    @DisplayName("number syntax")
    class NumberSyntax {

        @ParameterizedTest
        @ValueSource(strings = {"\u0662\u0660\u0662\u0660", "\uFF12\uFF10\uFF12\uFF10"})
        void nonAsciiDigitsAreCoercionErrors(String year) {
            assertThatThrownBy(() -> parser.parse(doc("<Year>" + year + "</Year>")))
                    .isInstanceOfSatisfying(TypeCoercionException.class, ex -> {
                        assertThat(ex.getField()).isEqualTo("Year");
                        assertThat(ex.getValue()).isEqualTo(year);
                    });
        }

        @Test
        void integerBeyondIntIsRangeError() {
            assertThatThrownBy(() -> parser.parse(doc("<Year>99999999999</Year>")))
                    .isInstanceOfSatisfying(RangeException.class, ex -> {
                        assertThat(ex.getField()).isEqualTo("Year");
                        assertThat(ex.getValue()).isEqualTo("99999999999");
                        assertThat(ex.getMin()).isEqualTo("1000");
                        assertThat(ex.getMax()).isEqualTo("9999");
                    });
        }

        @Test
        void unboundedIntegerBeyondIntIsRangeError() {
            assertThatThrownBy(() -> parser.parse(doc("<PageCount>4294967296</PageCount>")))
                    .isInstanceOfSatisfying(RangeException.class,
                            ex -> assertThat(ex.getField()).isEqualTo("PageCount"));
        }

        @Test
        void unicodeWhitespaceAroundValuesIsStripped() throws Exception {
            Issue issue = parser.parse(doc("<Title>\u3000Padded\u2003</Title><Year>\u20032020\u2003</Year>"
                    + "<CommunityRating>\u20034.5\u3000</CommunityRating>"));

            assertThat(issue.getTitle()).isEqualTo("Padded");
            assertThat(issue.getYear()).isEqualTo(2020);
            assertThat(issue.getCommunityRating()).isEqualTo(4.5);
        }
    }
}
