package com.catalog.indexer.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One monthly catalog dump: whitespace-trimmed lines in file order, identified
 * by the {@code YYYY-MM} date taken from a {@code catalog_<YYYY>_<MM>.txt} file name.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CatalogDocument {

    private static final Pattern FILE_NAME = Pattern.compile("^catalog_(\\d{4})_(\\d{2})\\.txt$");

    // PDF-extracted text carries no-break and other Unicode spaces that String.strip() keeps
    private static final Pattern EDGE_WHITESPACE = Pattern.compile("^[\\p{Z}\\s]+|[\\p{Z}\\s]+$",
            Pattern.UNICODE_CHARACTER_CLASS);

    @NonNull
    String fileName;

    @NonNull
    String catalogDate;

    @NonNull
    List<String> lines;

    /**
     * Derives the catalog date from a file name, or empty when the name does not follow the pattern.
     */
    public static Optional<String> catalogDateOf(String fileName) {
        Matcher m = FILE_NAME.matcher(fileName);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(m.group(1) + "-" + m.group(2));
    }

    public static boolean isCatalogFile(Path path) {
        return Files.isRegularFile(path) && catalogDateOf(path.getFileName().toString()).isPresent();
    }

    public static CatalogDocument load(Path path) throws IOException {
        String name = path.getFileName().toString();
        String date = catalogDateOf(name)
                .orElseThrow(() -> new IllegalArgumentException("Not a catalog file name: " + name));
        return of(name, date, Files.readAllLines(path, StandardCharsets.UTF_8));
    }

    public static CatalogDocument of(String fileName, String catalogDate, List<String> rawLines) {
        List<String> trimmed = rawLines.stream().map(CatalogDocument::trim).toList();
        return new CatalogDocument(fileName, catalogDate, trimmed);
    }

    /**
     * Strips leading and trailing whitespace, Unicode space separators included.
     */
    public static String trim(String line) {
        return EDGE_WHITESPACE.matcher(line).replaceAll("");
    }

    public int lineCount() {
        return lines.size();
    }

    public String line(int index) {
        return lines.get(index);
    }

    /**
     * First index in {@code [from, lineCount())} whose line satisfies the predicate.
     */
    public OptionalInt indexOf(Predicate<String> predicate, int from) {
        for (int i = Math.max(from, 0); i < lines.size(); i++) {
            if (predicate.test(lines.get(i))) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }
}
