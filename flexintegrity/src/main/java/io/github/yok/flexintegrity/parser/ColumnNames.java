package io.github.yok.flexintegrity.parser;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.Generated;
import org.apache.commons.lang3.StringUtils;

/**
 * Helpers shared by the table parsers: header naming and strict UTF-8 decoding.
 *
 * @author Yasuharu.Okawauchi
 */
public final class ColumnNames {

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private ColumnNames() {}

    /**
     * Normalizes raw header cells into unique column names.
     *
     * <p>
     * A blank header cell is named {@code Unnamed: <index>}. A repeated name gets a numeric suffix:
     * the second {@code a} becomes {@code a.1}, the third {@code a.2}, skipping suffixes that are
     * already taken.
     * </p>
     *
     * @param rawHeaders header cells in order ({@code null} allowed)
     * @return unique column names, same size as the input
     */
    public static List<String> normalize(List<String> rawHeaders) {
        List<String> names = new ArrayList<>(rawHeaders.size());
        Set<String> taken = new HashSet<>();
        for (int i = 0; i < rawHeaders.size(); i++) {
            String raw = rawHeaders.get(i);
            String base = StringUtils.isBlank(raw) ? unnamed(i) : raw;
            String name = base;
            int suffix = 1;
            while (taken.contains(name)) {
                name = base + "." + suffix++;
            }
            taken.add(name);
            names.add(name);
        }
        return names;
    }

    /**
     * Returns the placeholder name for a column without header.
     *
     * @param index zero-based column index
     * @return placeholder name
     */
    public static String unnamed(int index) {
        return "Unnamed: " + index;
    }

    /**
     * Decodes bytes as UTF-8, failing on malformed or unmappable input instead of substituting
     * replacement characters. A leading byte order mark is dropped.
     *
     * @param payload raw bytes
     * @param kind kind being parsed (for the error)
     * @param sourceName source display name (for the error)
     * @return decoded text
     * @throws SourceFormatException if the bytes are not valid UTF-8
     */
    static String decodeUtf8(byte[] payload, SourceKind kind, String sourceName)
            throws SourceFormatException {
        try {
            String text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(payload)).toString();
            return StringUtils.removeStart(text, "\uFEFF");
        } catch (CharacterCodingException e) {
            throw new SourceFormatException(kind, sourceName, "payload is not valid UTF-8", e);
        }
    }
}
