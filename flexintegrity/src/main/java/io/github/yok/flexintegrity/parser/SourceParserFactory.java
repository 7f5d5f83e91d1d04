package io.github.yok.flexintegrity.parser;

import io.github.yok.flexintegrity.config.IngestConfig;
import io.github.yok.flexintegrity.model.Source;
import java.util.Optional;

/**
 * Factory class for resolving the {@link SourceParser} of a {@link Source}.
 *
 * <p>
 * Supported kinds are:
 * </p>
 * <ul>
 * <li>{@link SourceKind#DELIMITED_TEXT}: {@link DelimitedTextParser} ({@code .tsv} uses a tab,
 * anything else the configured delimiter)</li>
 * <li>{@link SourceKind#SPREADSHEET}: {@link SpreadsheetParser}</li>
 * <li>{@link SourceKind#DOCUMENT_TEXT}: {@link DocumentTextParser}</li>
 * </ul>
 *
 * <p>
 * {@link SourceKind#RELATIONAL_ROWS} has no byte parser; its rows arrive as tables already.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class SourceParserFactory {

    private final IngestConfig ingestConfig;

    /**
     * Creates a factory.
     *
     * @param ingestConfig ingestion settings
     */
    public SourceParserFactory(IngestConfig ingestConfig) {
        this.ingestConfig = ingestConfig;
    }

    /**
     * Creates the parser for the given source and resolved kind.
     *
     * @param source the source to parse
     * @param kind the resolved kind of the source
     * @return parser, or empty when the kind cannot be parsed from bytes
     */
    public Optional<SourceParser> createParser(Source source, SourceKind kind) {
        switch (kind) {
            case DELIMITED_TEXT:
                char delimiter = "tsv".equals(source.getExtension()) ? '\t'
                        : ingestConfig.getDelimiter();
                return Optional.of(new DelimitedTextParser(delimiter));
            case SPREADSHEET:
                return Optional.of(new SpreadsheetParser());
            case DOCUMENT_TEXT:
                return Optional.of(new DocumentTextParser());
            default:
                return Optional.empty();
        }
    }
}
