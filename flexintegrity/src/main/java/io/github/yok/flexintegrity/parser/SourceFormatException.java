package io.github.yok.flexintegrity.parser;

import lombok.Getter;

/**
 * Thrown when the bytes of a source do not conform to its declared kind (ragged delimited rows,
 * corrupt workbook, undecodable text, unreadable PDF, ...).
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class SourceFormatException extends Exception {

    private static final long serialVersionUID = 1L;

    // Kind the source was parsed as
    private final SourceKind kind;

    // Display name of the offending source
    private final String sourceName;

    // Message without the kind/source prefix
    private final String detail;

    /**
     * Creates an exception.
     *
     * @param kind source kind
     * @param sourceName display name of the source
     * @param detail description of the problem
     */
    public SourceFormatException(SourceKind kind, String sourceName, String detail) {
        this(kind, sourceName, detail, null);
    }

    /**
     * Creates an exception with a root cause.
     *
     * @param kind source kind
     * @param sourceName display name of the source
     * @param detail description of the problem
     * @param cause root cause
     */
    public SourceFormatException(SourceKind kind, String sourceName, String detail,
            Throwable cause) {
        super("Invalid " + kind + " source [" + sourceName + "]: " + detail, cause);
        this.kind = kind;
        this.sourceName = sourceName;
        this.detail = detail;
    }
}
