package io.github.yok.flexintegrity.model;

import com.google.common.base.Preconditions;
import io.github.yok.flexintegrity.parser.SourceKind;
import java.util.Locale;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.Getter;
import org.apache.commons.io.FilenameUtils;

/**
 * One input unit handed over by the upload transport: raw bytes, an optional explicit kind tag and
 * an optional display name (usually the uploaded file name).
 *
 * <p>
 * When no explicit kind is given, the kind is derived from the display name's extension.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public final class Source {

    // Raw payload, never handed out directly
    @Getter(AccessLevel.NONE)
    private final byte[] payload;

    // Explicit kind tag (null = derive from the file name)
    private final SourceKind kind;

    // File name or other label used in logs and error reports
    private final String displayName;

    private Source(byte[] payload, SourceKind kind, String displayName) {
        this.payload = Preconditions.checkNotNull(payload, "payload must not be null").clone();
        this.kind = kind;
        this.displayName = displayName;
    }

    /**
     * Returns a copy of the raw bytes; the source itself never changes.
     *
     * @return payload copy
     */
    public byte[] getPayload() {
        return payload.clone();
    }

    /**
     * Creates a source whose kind is derived from the file name extension.
     *
     * @param fileName declared file name
     * @param payload raw bytes
     * @return source
     */
    public static Source ofFile(String fileName, byte[] payload) {
        return new Source(payload, null, fileName);
    }

    /**
     * Creates a source with an explicit kind tag.
     *
     * @param kind kind tag
     * @param payload raw bytes
     * @param displayName label for logs (may be {@code null})
     * @return source
     */
    public static Source ofKind(SourceKind kind, byte[] payload, String displayName) {
        Preconditions.checkNotNull(kind, "kind must not be null");
        return new Source(payload, kind, displayName);
    }

    /**
     * Resolves the kind: the explicit tag if present, otherwise the kind matching the display
     * name's extension.
     *
     * @return resolved kind, or empty when the source cannot be classified
     */
    public Optional<SourceKind> resolveKind() {
        if (kind != null) {
            return Optional.of(kind);
        }
        if (displayName == null) {
            return Optional.empty();
        }
        return SourceKind.fromExtension(FilenameUtils.getExtension(displayName));
    }

    /**
     * Returns the extension of the display name (lower case, without dot).
     *
     * @return extension, empty string if none
     */
    public String getExtension() {
        return displayName == null ? ""
                : FilenameUtils.getExtension(displayName).toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the display name, or a placeholder when none was given.
     *
     * @return label for logs
     */
    public String getLabel() {
        return displayName == null ? "<unnamed>" : displayName;
    }
}
