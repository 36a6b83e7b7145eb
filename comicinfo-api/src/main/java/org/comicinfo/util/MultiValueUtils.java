package org.comicinfo.util;

import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Derived list views over the delimited string fields of ComicInfo (Characters, Genre, Web, ...).
 */
@UtilityClass
public class MultiValueUtils {

    public static final String JOIN_DELIMITER = ", ";

    private static final Pattern COMMA_PATTERN = Pattern.compile(",");
    private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");

    /**
     * Splits a comma-delimited value into trimmed, non-empty parts, in their original order.
     *
     * @param value raw field value, may be null
     * @return the parts, or an empty list if the value is null or blank
     */
    public static List<String> splitValues(String value) {
        if (StringUtils.isBlank(value)) {
            return List.of();
        }
        return Arrays.stream(COMMA_PATTERN.split(value))
                .map(StringUtils::strip)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableList());
    }

    public static String joinValues(List<String> values) {
        return values == null ? null : StringUtils.stripToNull(String.join(JOIN_DELIMITER, values));
    }

    /**
     * Splits a whitespace-delimited Web value into absolute URLs. Tokens that are not valid URLs are skipped.
     */
    public static List<URI> splitUrls(String value) {
        if (StringUtils.isBlank(value)) {
            return List.of();
        }
        return Arrays.stream(WHITESPACE_PATTERN.split(value.strip()))
                .map(MultiValueUtils::toUrl)
                .filter(Objects::nonNull)
                .collect(Collectors.toUnmodifiableList());
    }

    private static URI toUrl(String token) {
        try {
            URI uri = new URI(token);
            if (!uri.isAbsolute()) {
                return null;
            }
            // rejects schemes without a registered protocol handler
            uri.toURL();
            return uri;
        } catch (URISyntaxException | MalformedURLException | IllegalArgumentException e) {
            return null;
        }
    }
}
