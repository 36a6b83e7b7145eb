package org.comicinfo.exception;

import lombok.Getter;

/**
 * Raised when a ComicInfo document cannot be read, parsed or written.
 * The {@link #getError() error kind} tells callers which stage failed; the
 * field-level subclasses additionally carry the offending field and value.
 */
@Getter
public class ComicInfoException extends Exception {

    private final ComicInfoError error;

    public ComicInfoException(ComicInfoError error, String message) {
        super(message);
        this.error = error;
    }

    public ComicInfoException(ComicInfoError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }
}
