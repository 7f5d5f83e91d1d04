package io.github.yok.flexintegrity.core;

import com.google.common.base.Preconditions;
import io.github.yok.flexintegrity.db.RelationalSource;
import io.github.yok.flexintegrity.model.Metrics;
import io.github.yok.flexintegrity.model.Source;
import io.github.yok.flexintegrity.model.Table;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * One-shot ingestion and scoring run: sources are parsed by the {@link SourceDispatcher}, merged
 * with the relational tables by the {@link TableUnifier}, and scored by the
 * {@link MetricsEngine}.
 *
 * <p>
 * Relational tables (when requested) come first, followed by the parsed sources in arrival order.
 * The run always returns metrics; sources that cannot be ingested are reported through the
 * {@link ErrorChannel} and left out. The pipeline keeps no state between runs.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class IntegrityPipeline {

    private final SourceDispatcher dispatcher;
    private final TableUnifier unifier;
    private final MetricsEngine metricsEngine;
    private final RelationalSource relationalSource;

    /**
     * Creates a pipeline.
     *
     * @param dispatcher source dispatcher
     * @param unifier table unifier
     * @param metricsEngine metrics engine
     * @param relationalSource relational rows supplier
     */
    public IntegrityPipeline(SourceDispatcher dispatcher, TableUnifier unifier,
            MetricsEngine metricsEngine, RelationalSource relationalSource) {
        this.dispatcher = Preconditions.checkNotNull(dispatcher);
        this.unifier = Preconditions.checkNotNull(unifier);
        this.metricsEngine = Preconditions.checkNotNull(metricsEngine);
        this.relationalSource = Preconditions.checkNotNull(relationalSource);
    }

    /**
     * Runs the pipeline.
     *
     * @param sources uploaded sources in arrival order
     * @param includeDatabase whether the relational source is read
     * @return metrics of the unified table
     */
    public Metrics run(List<Source> sources, boolean includeDatabase) {
        Preconditions.checkNotNull(sources, "sources must not be null");
        log.info("Pipeline started: sources={}, includeDatabase={}", sources.size(),
                includeDatabase);

        List<Table> tables = new ArrayList<>();
        if (includeDatabase) {
            tables.addAll(relationalSource.fetchTables());
        }
        tables.addAll(dispatcher.dispatch(sources));

        Metrics metrics = metricsEngine.score(unifier.unify(tables));
        log.info("Pipeline completed: tables={}, records={}", tables.size(),
                metrics.getTotalRecords());
        return metrics;
    }
}
