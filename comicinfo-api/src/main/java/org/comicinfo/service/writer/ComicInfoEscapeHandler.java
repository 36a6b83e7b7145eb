package org.comicinfo.service.writer;

import org.glassfish.jaxb.core.marshaller.CharacterEscapeHandler;

import java.io.IOException;
import java.io.Writer;

/**
 * Escapes markup characters like the JAXB default, and additionally writes tab, line feed and
 * carriage return inside attribute values as character references. Attribute-value normalization
 * would otherwise turn them into spaces when the document is read back.
 */
class ComicInfoEscapeHandler implements CharacterEscapeHandler {

    static final String PROPERTY = "org.glassfish.jaxb.core.marshaller.CharacterEscapeHandler";

    static final ComicInfoEscapeHandler INSTANCE = new ComicInfoEscapeHandler();

    @Override
    public void escape(char[] ch, int start, int length, boolean isAttVal, Writer out) throws IOException {
        int limit = start + length;
        int run = start;
        for (int i = start; i < limit; i++) {
            String replacement = replacementFor(ch[i], isAttVal);
            if (replacement != null) {
                out.write(ch, run, i - run);
                out.write(replacement);
                run = i + 1;
            }
        }
        out.write(ch, run, limit - run);
    }

    private static String replacementFor(char c, boolean isAttVal) {
        switch (c) {
            case '&':
                return "&amp;";
            case '<':
                return "&lt;";
            case '>':
                return "&gt;";
            case '"':
                return isAttVal ? "&quot;" : null;
            case '\t':
                return isAttVal ? "&#9;" : null;
            case '\n':
                return isAttVal ? "&#10;" : null;
            case '\r':
                return "&#13;";
            default:
                return null;
        }
    }
}
