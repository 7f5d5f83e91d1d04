package io.github.yok.flexintegrity.core;

import io.github.yok.flexintegrity.parser.SourceKind;

/**
 * Sink for sources that were skipped because they could not be ingested.
 *
 * <p>
 * Implementations decide how the failure is presented; the pipeline only reports and continues.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface ErrorChannel {

    /**
     * Reports one failed source.
     *
     * @param sourceName display name of the source (file name or connection id)
     * @param kind kind the source was ingested as, may be {@code null} when unknown
     * @param message description of the failure
     */
    void report(String sourceName, SourceKind kind, String message);
}
