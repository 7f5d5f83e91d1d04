package io.github.yok.flexintegrity.core;

import io.github.yok.flexintegrity.parser.SourceKind;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link ErrorChannel} that writes every report as a WARN log line and counts them.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class LoggingErrorChannel implements ErrorChannel {

    private final AtomicInteger reported = new AtomicInteger();

    /**
     * {@inheritDoc}
     */
    @Override
    public void report(String sourceName, SourceKind kind, String message) {
        reported.incrementAndGet();
        log.warn("Skipped source [{}] (kind={}): {}", sourceName, kind, message);
    }

    /**
     * Returns the number of reports received so far.
     *
     * @return report count
     */
    public int getReportedCount() {
        return reported.get();
    }
}
