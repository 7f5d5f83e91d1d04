package io.github.yok.flexintegrity.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that holds settings related to source ingestion.
 *
 * <p>
 * You can specify the following properties in {@code application.yml} or
 * {@code application.properties}.
 * </p>
 * <ul>
 * <li>{@code ingest.delimiter}: field delimiter of {@code .csv} sources (default {@code ,}).
 * {@code .tsv} sources always use a tab.</li>
 * <li>{@code ingest.parallelism}: number of worker threads used to parse sources of one run
 * (default {@code 1}, i.e. sequential parsing)</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "ingest")
@Getter
@Setter
@NoArgsConstructor
public class IngestConfig {

    /**
     * Field delimiter for CSV sources.
     */
    private char delimiter = ',';

    /**
     * Worker threads used by the dispatcher; values below 1 are treated as 1.
     */
    private int parallelism = 1;
}
