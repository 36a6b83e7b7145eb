package org.comicinfo.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.comicinfo.config.ComicInfoProperties;
import org.comicinfo.exception.ComicInfoError;
import org.comicinfo.exception.ComicInfoException;
import org.comicinfo.model.Issue;
import org.comicinfo.service.parser.ComicInfoParser;
import org.comicinfo.util.ArchiveUtils;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Entry points for reading ComicInfo metadata from strings, files, CBZ archives and URLs.
 * I/O failures are reported as {@link ComicInfoError#FILE_ERROR}; errors raised while parsing the
 * XML are passed through unchanged.
 */
@Slf4j
@RequiredArgsConstructor
public class ComicInfoLoader {

    private static final Pattern DIGITS_ONLY_PATTERN = Pattern.compile("^\\d+$");

    private final ComicInfoParser parser;
    private final HttpClient httpClient;
    private final ComicInfoProperties properties;

    public ComicInfoLoader() {
        this(new ComicInfoParser(), HttpClient.newHttpClient(), new ComicInfoProperties());
    }

    public Issue loadFromXml(String xml) throws ComicInfoException {
        return parser.parse(xml);
    }

    /**
     * Loads from either XML text or a file path. Input starting with {@code <} (after trimming)
     * is parsed as XML; anything else is treated as a path.
     */
    public Issue load(String input) throws ComicInfoException {
        if (input == null || input.isEmpty()) {
            throw ComicInfoError.PARSE_ERROR.createException("Input cannot be null or empty");
        }
        if (looksLikeXml(input)) {
            return parser.parse(input);
        }
        validateFilePath(input);
        try {
            return load(Path.of(input));
        } catch (InvalidPathException e) {
            throw ComicInfoError.PARSE_ERROR.createException(e, "Input '" + input + "' does not appear to be valid XML or a file path");
        }
    }

    public Issue load(Path path) throws ComicInfoException {
        if (!Files.exists(path)) {
            throw ComicInfoError.FILE_ERROR.createException("File does not exist: '" + path + "'");
        }
        String xml;
        try {
            xml = FileUtils.readFileToString(path.toFile(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Failed to read ComicInfo.xml file '{}': {}", path.toAbsolutePath(), e.getMessage());
            throw ComicInfoError.FILE_ERROR.createException(e, "Failed to read file '" + path + "': " + e.getMessage());
        }
        return parser.parse(xml);
    }

    public Issue load(InputStream inputStream) throws ComicInfoException {
        String xml;
        try {
            xml = IOUtils.toString(inputStream, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw ComicInfoError.FILE_ERROR.createException(e, "Failed to read stream: " + e.getMessage());
        }
        return parser.parse(xml);
    }

    /**
     * Loads the ComicInfo.xml embedded in a CBZ (ZIP) comic archive.
     */
    public Issue loadFromArchive(Path archive) throws ComicInfoException {
        if (!ArchiveUtils.isZipArchive(archive)) {
            throw ComicInfoError.FILE_ERROR.createException("Not a readable CBZ/ZIP archive: '" + archive + "'");
        }
        byte[] xmlBytes;
        try {
            xmlBytes = ArchiveUtils.readComicInfoEntry(archive)
                    .orElseThrow(() -> ComicInfoError.FILE_ERROR.createException(
                            "No " + ArchiveUtils.COMIC_INFO_FILE_NAME + " found in archive '" + archive + "'"));
        } catch (IOException e) {
            log.warn("Failed to read archive '{}': {}", archive.toAbsolutePath(), e.getMessage());
            throw ComicInfoError.FILE_ERROR.createException(e, "Failed to read archive '" + archive + "': " + e.getMessage());
        }
        return parser.parse(new String(xmlBytes, StandardCharsets.UTF_8));
    }

    public Issue load(URI uri) throws ComicInfoException {
        if (isFileUri(uri)) {
            return load(toPath(uri));
        }
        HttpResponse<String> response;
        try {
            response = httpClient.send(buildRequest(uri), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ComicInfoError.FILE_ERROR.createException(e, "Interrupted while loading from URL '" + uri + "'");
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to load ComicInfo from URL '{}': {}", uri, e.getMessage());
            throw ComicInfoError.FILE_ERROR.createException(e, "Failed to read from URL '" + uri + "': " + e.getMessage());
        }
        return parser.parse(readBody(uri, response));
    }

    /**
     * Asynchronous variant of {@link #load(URI)}. The returned future completes exceptionally with
     * the same {@link ComicInfoException} the synchronous call would throw.
     */
    public CompletableFuture<Issue> loadAsync(URI uri) {
        if (isFileUri(uri)) {
            try {
                return CompletableFuture.completedFuture(load(uri));
            } catch (ComicInfoException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
        HttpRequest request;
        try {
            request = buildRequest(uri);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(
                    ComicInfoError.FILE_ERROR.createException(e, "Failed to load from URL '" + uri + "': " + e.getMessage()));
        }
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8))
                .handle((response, error) -> {
                    if (error != null) {
                        Throwable cause = error.getCause() != null ? error.getCause() : error;
                        log.warn("Failed to load ComicInfo from URL '{}': {}", uri, cause.getMessage());
                        return CompletableFuture.<Issue>failedFuture(
                                ComicInfoError.FILE_ERROR.createException(cause, "Failed to load from URL '" + uri + "': " + cause.getMessage()));
                    }
                    try {
                        return CompletableFuture.completedFuture(parser.parse(readBody(uri, response)));
                    } catch (ComicInfoException e) {
                        return CompletableFuture.<Issue>failedFuture(e);
                    }
                })
                .thenCompose(Function.identity());
    }

    private HttpRequest buildRequest(URI uri) {
        return HttpRequest.newBuilder()
                .uri(uri)
                .timeout(properties.getHttp().getRequestTimeout())
                .header("User-Agent", properties.getHttp().getUserAgent())
                .header("Accept", "application/xml, text/xml, */*")
                .GET()
                .build();
    }

    private String readBody(URI uri, HttpResponse<String> response) throws ComicInfoException {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw ComicInfoError.FILE_ERROR.createException("Failed to read from URL '" + uri + "': HTTP status " + status);
        }
        return response.body();
    }

    private boolean isFileUri(URI uri) {
        return uri.getScheme() != null && "file".equals(uri.getScheme().toLowerCase(Locale.ROOT));
    }

    private Path toPath(URI uri) throws ComicInfoException {
        try {
            return Path.of(uri);
        } catch (IllegalArgumentException e) {
            throw ComicInfoError.FILE_ERROR.createException(e, "Invalid file URL '" + uri + "': " + e.getMessage());
        }
    }

    private static boolean looksLikeXml(String input) {
        return input.trim().startsWith("<");
    }

    private static void validateFilePath(String input) throws ComicInfoException {
        boolean digitsOnly = DIGITS_ONLY_PATTERN.matcher(input).matches();
        boolean noPathCharacters = !input.contains(".") && !input.contains("/") && !input.contains("\\");
        if (digitsOnly || noPathCharacters) {
            throw ComicInfoError.PARSE_ERROR.createException("Input '" + input + "' does not appear to be valid XML or a file path");
        }
    }
}
