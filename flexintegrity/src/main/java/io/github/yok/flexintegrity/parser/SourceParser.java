package io.github.yok.flexintegrity.parser;

import io.github.yok.flexintegrity.model.Source;
import io.github.yok.flexintegrity.model.Table;

/**
 * Interface for converting the raw bytes of one {@link Source} into a {@link Table}.
 *
 * <p>
 * A parser either returns a complete table or fails; it never returns a partially read table.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface SourceParser {

    /**
     * Parses the payload of the given source.
     *
     * @param source source holding the raw bytes
     * @return the parsed {@link Table}
     * @throws SourceFormatException if the bytes do not conform to the source kind
     */
    Table parse(Source source) throws SourceFormatException;
}
