package io.github.yok.flexintegrity.core;

import com.google.common.base.Preconditions;
import io.github.yok.flexintegrity.model.Source;
import io.github.yok.flexintegrity.model.Table;
import io.github.yok.flexintegrity.parser.SourceFormatException;
import io.github.yok.flexintegrity.parser.SourceKind;
import io.github.yok.flexintegrity.parser.SourceParser;
import io.github.yok.flexintegrity.parser.SourceParserFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import lombok.extern.slf4j.Slf4j;

/**
 * Routes each {@link Source} to the parser of its kind and collects the resulting tables.
 *
 * <p>
 * <strong>Rules:</strong>
 * </p>
 * <ul>
 * <li>The kind is the source's explicit tag, otherwise the one matching its file extension.</li>
 * <li>Sources of an unsupported kind are omitted silently (DEBUG log only).</li>
 * <li>A source whose parser fails is reported to the {@link ErrorChannel} and omitted; the
 * remaining sources are still parsed.</li>
 * <li>The returned tables keep the arrival order of their sources.</li>
 * </ul>
 *
 * <p>
 * With {@code parallelism > 1} the sources are parsed on a fixed thread pool created for the call
 * and shut down before returning.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SourceDispatcher {

    private final SourceParserFactory parserFactory;
    private final ErrorChannel errorChannel;
    private final int parallelism;

    /**
     * Creates a dispatcher.
     *
     * @param parserFactory parser resolver
     * @param errorChannel sink for failed sources
     * @param parallelism number of worker threads (values below 1 mean 1)
     */
    public SourceDispatcher(SourceParserFactory parserFactory, ErrorChannel errorChannel,
            int parallelism) {
        this.parserFactory = Preconditions.checkNotNull(parserFactory);
        this.errorChannel = Preconditions.checkNotNull(errorChannel);
        this.parallelism = Math.max(1, parallelism);
    }

    /**
     * Parses the given sources.
     *
     * @param sources sources in arrival order
     * @return tables of the successfully parsed sources, in arrival order
     */
    public List<Table> dispatch(List<Source> sources) {
        Preconditions.checkNotNull(sources, "sources must not be null");
        List<Optional<Table>> parsed =
                parallelism == 1 || sources.size() < 2 ? parseSequentially(sources)
                        : parseInParallel(sources);

        List<Table> tables = new ArrayList<>(sources.size());
        parsed.forEach(table -> table.ifPresent(tables::add));
        log.info("Dispatched sources: received={}, parsed={}", sources.size(), tables.size());
        return tables;
    }

    private List<Optional<Table>> parseSequentially(List<Source> sources) {
        List<Optional<Table>> results = new ArrayList<>(sources.size());
        for (Source source : sources) {
            results.add(parseOne(source));
        }
        return results;
    }

    private List<Optional<Table>> parseInParallel(List<Source> sources) {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, sources.size()));
        try {
            List<Future<Optional<Table>>> futures = new ArrayList<>(sources.size());
            for (Source source : sources) {
                futures.add(pool.submit(() -> parseOne(source)));
            }
            List<Optional<Table>> results = new ArrayList<>(sources.size());
            for (int i = 0; i < futures.size(); i++) {
                results.add(await(futures.get(i), sources.get(i)));
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    private Optional<Table> await(Future<Optional<Table>> future, Source source) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            errorChannel.report(source.getLabel(), source.resolveKind().orElse(null),
                    "interrupted while parsing");
            return Optional.empty();
        } catch (ExecutionException e) {
            // parseOne catches runtime failures, so only an Error ends up here
            Throwable cause = e.getCause();
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Parser failed for [" + source.getLabel() + "]",
                    cause);
        }
    }

    private Optional<Table> parseOne(Source source) {
        Optional<SourceKind> kind = source.resolveKind();
        if (kind.isEmpty()) {
            log.debug("Source [{}] ignored: unsupported format", source.getLabel());
            return Optional.empty();
        }
        Optional<SourceParser> parser = parserFactory.createParser(source, kind.get());
        if (parser.isEmpty()) {
            log.debug("Source [{}] ignored: kind {} is not parsed from bytes", source.getLabel(),
                    kind.get());
            return Optional.empty();
        }
        try {
            Table table = parser.get().parse(source);
            log.debug("Source [{}] parsed as {}: {}", source.getLabel(), kind.get(), table);
            return Optional.of(table);
        } catch (SourceFormatException e) {
            errorChannel.report(source.getLabel(), e.getKind(), e.getDetail());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.debug("Unexpected failure while parsing [{}]", source.getLabel(), e);
            errorChannel.report(source.getLabel(), kind.get(),
                    "unexpected parser failure: " + e);
            return Optional.empty();
        }
    }
}
