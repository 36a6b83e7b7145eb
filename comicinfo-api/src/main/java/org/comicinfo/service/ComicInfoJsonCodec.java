package org.comicinfo.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import org.comicinfo.exception.ComicInfoError;
import org.comicinfo.exception.ComicInfoException;
import org.comicinfo.exception.RangeException;
import org.comicinfo.model.Issue;
import org.comicinfo.util.ValidationUtils;

/**
 * JSON form of an {@link Issue}: the stored fields only, with multi-value fields kept as their
 * raw delimited strings and enums written by their ComicInfo value.
 */
@Slf4j
public class ComicInfoJsonCodec {

    private static final String PAGES = "pages";
    private static final String IMAGE = "image";

    private final ObjectMapper objectMapper;

    public ComicInfoJsonCodec() {
        this(JsonMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .build());
    }

    public ComicInfoJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toJson(Issue issue) throws ComicInfoException {
        try {
            return objectMapper.writeValueAsString(issue);
        } catch (JsonProcessingException e) {
            throw ComicInfoError.PARSE_ERROR.createException(e, "Failed to write issue as JSON: " + e.getOriginalMessage());
        }
    }

    /**
     * Decodes an issue and applies the same checks as the XML parser: Year, Month, Day and
     * CommunityRating must lie in their ranges and every page must carry an image number.
     */
    public Issue fromJson(String json) throws ComicInfoException {
        if (json == null || json.isBlank()) {
            throw ComicInfoError.PARSE_ERROR.createException("JSON string cannot be null or empty");
        }
        Issue issue;
        try {
            JsonNode tree = objectMapper.readTree(json);
            if (tree == null || !tree.isObject()) {
                throw ComicInfoError.PARSE_ERROR.createException("Invalid issue JSON: expected an object");
            }
            requirePageImages(tree.get(PAGES));
            issue = objectMapper.treeToValue(tree, Issue.class);
        } catch (JsonProcessingException e) {
            log.warn("Rejected ComicInfo JSON: {}", e.getOriginalMessage());
            throw ComicInfoError.PARSE_ERROR.createException(e, "Invalid issue JSON: " + e.getOriginalMessage());
        }
        validateRanges(issue);
        return issue;
    }

    private static void requirePageImages(JsonNode pages) throws ComicInfoException {
        if (pages == null || !pages.isArray()) {
            return;
        }
        for (JsonNode page : pages) {
            if (page.isObject() && !page.hasNonNull(IMAGE)) {
                throw ComicInfoError.SCHEMA_ERROR.createException("Page element missing required Image attribute");
            }
        }
    }

    private static void validateRanges(Issue issue) throws RangeException {
        ValidationUtils.requireInRange("Year", issue.getYear(), Issue.MIN_YEAR, Issue.MAX_YEAR);
        ValidationUtils.requireInRange("Month", issue.getMonth(), Issue.MIN_MONTH, Issue.MAX_MONTH);
        ValidationUtils.requireInRange("Day", issue.getDay(), Issue.MIN_DAY, Issue.MAX_DAY);
        ValidationUtils.requireInRange("CommunityRating", issue.getCommunityRating(),
                Issue.MIN_COMMUNITY_RATING, Issue.MAX_COMMUNITY_RATING);
    }
}
