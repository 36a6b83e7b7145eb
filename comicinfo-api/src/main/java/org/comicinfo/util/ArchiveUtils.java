package org.comicinfo.util;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Enumeration;
import java.util.Locale;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

@Slf4j
@UtilityClass
public class ArchiveUtils {

    public static final String COMIC_INFO_FILE_NAME = "ComicInfo.xml";

    private static final byte[] ZIP_MAGIC = {0x50, 0x4B, 0x03, 0x04};

    /**
     * Checks the ZIP signature rather than the extension, since .cbz/.cbr files are often misnamed.
     */
    public static boolean isZipArchive(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            return false;
        }
        try (InputStream is = Files.newInputStream(path)) {
            byte[] buffer = is.readNBytes(ZIP_MAGIC.length);
            return Arrays.equals(buffer, ZIP_MAGIC);
        } catch (IOException e) {
            log.warn("Failed to read archive signature for file: {}", path.toAbsolutePath());
            return false;
        }
    }

    public static boolean isComicInfoXml(String entryName) {
        if (entryName == null) return false;
        String normalized = entryName.replace('\\', '/');
        if (normalized.endsWith("/")) return false;
        String lowerCase = normalized.toLowerCase(Locale.ROOT);
        return "comicinfo.xml".equals(lowerCase) || lowerCase.endsWith("/comicinfo.xml");
    }

    /**
     * Reads the bytes of the first ComicInfo.xml entry of a ZIP archive, at any folder depth.
     *
     * @return the entry content, or empty if the archive has no such entry
     * @throws IOException if the archive cannot be opened or read
     */
    public static Optional<byte[]> readComicInfoEntry(Path archive) throws IOException {
        try (ZipFile zipFile = new ZipFile(archive.toFile())) {
            Enumeration<? extends ZipEntry> entries = zipFile.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                if (!entry.isDirectory() && isComicInfoXml(entry.getName())) {
                    try (InputStream is = zipFile.getInputStream(entry)) {
                        return Optional.of(is.readAllBytes());
                    }
                }
            }
        }
        return Optional.empty();
    }
}
