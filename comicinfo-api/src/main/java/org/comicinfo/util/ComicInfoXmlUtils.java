package org.comicinfo.util;

import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;
import org.comicinfo.exception.ComicInfoException;
import org.comicinfo.exception.RangeException;
import org.comicinfo.exception.TypeCoercionException;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reads typed values out of ComicInfo elements. Issue fields are child elements and page fields are
 * attributes, so the two are read by separate helpers.
 */
@UtilityClass
public class ComicInfoXmlUtils {

    // the JDK parsers also accept non-ASCII digits, hex floats and d/f suffixes, none of which are schema numbers
    private static final Pattern INTEGER_PATTERN = Pattern.compile("[+-]?[0-9]+");
    private static final Pattern DECIMAL_PATTERN = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    @FunctionalInterface
    public interface ValueParser<T> {
        T parse(String value) throws ComicInfoException;
    }

    /**
     * @return the first direct child element with exactly this name, or null
     */
    public static Element firstChild(Element parent, String name) {
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node.getNodeType() == Node.ELEMENT_NODE && name.equals(node.getNodeName())) {
                return (Element) node;
            }
        }
        return null;
    }

    public static List<Element> children(Element parent, String name) {
        List<Element> result = new ArrayList<>();
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node.getNodeType() == Node.ELEMENT_NODE && name.equals(node.getNodeName())) {
                result.add((Element) node);
            }
        }
        return result;
    }

    /**
     * Trimmed text of the named child element. A missing element and a blank one both read as null.
     */
    public static String getText(Element parent, String name) {
        Element child = firstChild(parent, name);
        if (child == null) {
            return null;
        }
        return StringUtils.stripToNull(child.getTextContent());
    }

    public static <T> T getValue(Element parent, String name, ValueParser<T> parser) throws ComicInfoException {
        String text = getText(parent, name);
        return text == null ? null : parser.parse(text);
    }

    public static Integer getInteger(Element parent, String name) throws TypeCoercionException, RangeException {
        String text = getText(parent, name);
        return text == null ? null : parseInteger(name, text);
    }

    public static Integer getInteger(Element parent, String name, int min, int max) throws TypeCoercionException, RangeException {
        String text = getText(parent, name);
        return text == null ? null : parseInteger(name, text, min, max);
    }

    public static Double getDouble(Element parent, String name, double min, double max) throws TypeCoercionException, RangeException {
        String text = getText(parent, name);
        if (text == null) {
            return null;
        }
        double value = parseDouble(name, text);
        if (!(value >= min && value <= max)) {
            throw new RangeException(name, text, String.valueOf(min), String.valueOf(max));
        }
        return value;
    }

    /**
     * Parses a base-10 integer made of ASCII digits. Well-formed values outside the {@code int}
     * range are range errors, not coercion errors.
     */
    public static int parseInteger(String field, String text) throws TypeCoercionException, RangeException {
        return parseInteger(field, text, Integer.MIN_VALUE, Integer.MAX_VALUE);
    }

    public static int parseInteger(String field, String text, int min, int max) throws TypeCoercionException, RangeException {
        if (!isInteger(text)) {
            throw new TypeCoercionException(field, text, TypeCoercionException.INT);
        }
        BigInteger value = new BigInteger(text);
        if (value.compareTo(BigInteger.valueOf(min)) < 0 || value.compareTo(BigInteger.valueOf(max)) > 0) {
            throw new RangeException(field, text, String.valueOf(min), String.valueOf(max));
        }
        return value.intValueExact();
    }

    public static double parseDouble(String field, String text) throws TypeCoercionException {
        if (!DECIMAL_PATTERN.matcher(text).matches()) {
            throw new TypeCoercionException(field, text, TypeCoercionException.DOUBLE);
        }
        return Double.parseDouble(text);
    }

    private static boolean isInteger(String text) {
        return text != null && INTEGER_PATTERN.matcher(text).matches();
    }

    /**
     * Raw attribute value, untrimmed. Returns null when the attribute is not present.
     */
    public static String getAttribute(Element element, String name) {
        return element.hasAttribute(name) ? element.getAttribute(name) : null;
    }

    public static String getAttribute(Element element, String name, String defaultValue) {
        String value = getAttribute(element, name);
        return value == null ? defaultValue : value;
    }

    public static int getLenientInt(Element element, String name, int defaultValue) {
        String value = getAttribute(element, name);
        if (value == null) {
            return defaultValue;
        }
        String text = StringUtils.strip(value);
        if (!isInteger(text)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static long getLenientLong(Element element, String name, long defaultValue) {
        String value = getAttribute(element, name);
        if (value == null) {
            return defaultValue;
        }
        String text = StringUtils.strip(value);
        if (!isInteger(text)) {
            return defaultValue;
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static boolean getLenientBoolean(Element element, String name) {
        String value = getAttribute(element, name);
        if (value == null) {
            return false;
        }
        switch (StringUtils.strip(value).toLowerCase(Locale.ROOT)) {
            case "true":
            case "1":
            case "yes":
                return true;
            default:
                return false;
        }
    }
}
