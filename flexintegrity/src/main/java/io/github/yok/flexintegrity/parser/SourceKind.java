package io.github.yok.flexintegrity.parser;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Enumeration of supported source kinds.
 *
 * <p>
 * Each kind defines the file extensions that are recognized as belonging to it. For example,
 * {@link #SPREADSHEET} supports both {@code .xlsx} and {@code .xls}. {@link #RELATIONAL_ROWS} has
 * no extension; it is only ever assigned explicitly.
 * </p>
 *
 * <p>
 * This enum is responsible for handling extension matching in a centralized way, so that the
 * dispatcher and the parsers do not need to hardcode string comparisons.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum SourceKind {

    // Delimited text table (CSV / TSV)
    DELIMITED_TEXT("delimited-text", "csv", "tsv"),

    // Spreadsheet workbook (first worksheet only)
    SPREADSHEET("spreadsheet", "xlsx", "xls"),

    // Free-text document (PDF is paginated, plain text is a single page)
    DOCUMENT_TEXT("document-text", "pdf", "txt"),

    // Rows returned by a relational query
    RELATIONAL_ROWS("relational-rows");

    // Tag used in logs and error reports
    private final String tag;

    // Set of valid extensions for this kind (all lowercase)
    private final Set<String> extensions;

    SourceKind(String tag, String... exts) {
        this.tag = tag;
        this.extensions =
                Arrays.stream(exts).map(e -> e.toLowerCase(Locale.ROOT))
                        .collect(Collectors.toSet());
    }

    /**
     * Determines whether the given file extension belongs to this kind.
     *
     * @param ext file extension to check (case-insensitive, without dot)
     * @return {@code true} if the extension matches this kind, {@code false} otherwise
     */
    public boolean matches(String ext) {
        return ext != null && extensions.contains(ext.toLowerCase(Locale.ROOT));
    }

    /**
     * Resolves the kind for a file extension.
     *
     * @param ext file extension (case-insensitive, without dot)
     * @return matching kind, or empty when the extension is not supported
     */
    public static Optional<SourceKind> fromExtension(String ext) {
        return Arrays.stream(values()).filter(kind -> kind.matches(ext)).findFirst();
    }

    @Override
    public String toString() {
        return tag;
    }
}
