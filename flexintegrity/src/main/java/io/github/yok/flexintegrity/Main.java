package io.github.yok.flexintegrity;

import io.github.yok.flexintegrity.config.ConnectionConfig;
import io.github.yok.flexintegrity.config.IngestConfig;
import io.github.yok.flexintegrity.core.ErrorChannel;
import io.github.yok.flexintegrity.core.IntegrityPipeline;
import io.github.yok.flexintegrity.core.LoggingErrorChannel;
import io.github.yok.flexintegrity.core.MetricsEngine;
import io.github.yok.flexintegrity.core.SourceDispatcher;
import io.github.yok.flexintegrity.core.TableUnifier;
import io.github.yok.flexintegrity.db.DbUnitRelationalSource;
import io.github.yok.flexintegrity.model.Metrics;
import io.github.yok.flexintegrity.model.Source;
import io.github.yok.flexintegrity.parser.SourceParserFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Provides the application entry point.
 *
 * <p>
 * Reads the files named on the command line, optionally the configured relational sources, and
 * logs the integrity metrics of their combined rows.
 * </p>
 *
 * <p>
 * Argument specification:
 * </p>
 * <ul>
 * <li>{@code --file [path,…]} or {@code -f [path,…]} adds input files (may be repeated). The
 * format is chosen by extension: {@code csv}/{@code tsv}, {@code xlsx}/{@code xls},
 * {@code pdf}/{@code txt}; other files are ignored.</li>
 * <li>{@code --database} or {@code -d} also reads the sources under {@code connections} in
 * {@code application.yml}.</li>
 * </ul>
 *
 * <p>
 * Spring Boot automatically loads {@link IngestConfig} and {@link ConnectionConfig}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see IntegrityPipeline
 */
@Slf4j
@SpringBootApplication
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    private final IngestConfig ingestConfig;
    private final ConnectionConfig connectionConfig;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.run(args);
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        execute(args);
    }

    /**
     * Parses the arguments, runs the pipeline once and logs the summary.
     *
     * @param args command-line arguments array
     * @return metrics of this run
     */
    Metrics execute(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        // Parse CLI arguments
        List<Path> files = new ArrayList<>();
        boolean includeDatabase = false;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--file":
                case "-f":
                    if (i + 1 < args.length) {
                        Arrays.stream(args[++i].split(",")).map(String::trim)
                                .filter(StringUtils::isNotEmpty).map(Paths::get)
                                .forEach(files::add);
                    }
                    break;
                case "--database":
                case "-d":
                    includeDatabase = true;
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }
        log.info("Input files: {}, Include database: {}", files, includeDatabase);

        LoggingErrorChannel errorChannel = new LoggingErrorChannel();
        List<Source> sources = readSources(files, errorChannel);

        Metrics metrics = createPipeline(errorChannel).run(sources, includeDatabase);
        logMetricsSummary(metrics, errorChannel.getReportedCount());
        return metrics;
    }

    /**
     * Builds the pipeline from the loaded configuration.
     *
     * @param errorChannel sink for failed sources
     * @return pipeline
     */
    IntegrityPipeline createPipeline(ErrorChannel errorChannel) {
        SourceDispatcher dispatcher = new SourceDispatcher(new SourceParserFactory(ingestConfig),
                errorChannel, ingestConfig.getParallelism());
        return new IntegrityPipeline(dispatcher, new TableUnifier(), new MetricsEngine(),
                new DbUnitRelationalSource(connectionConfig, errorChannel));
    }

    /**
     * Reads every file into a {@link Source}. Unreadable files are reported and skipped.
     *
     * @param files input files in command-line order
     * @param errorChannel sink for unreadable files
     * @return sources in the same order
     */
    static List<Source> readSources(List<Path> files, ErrorChannel errorChannel) {
        List<Source> sources = new ArrayList<>(files.size());
        for (Path file : files) {
            String name = file.getFileName() == null ? file.toString()
                    : file.getFileName().toString();
            try {
                sources.add(Source.ofFile(name, Files.readAllBytes(file)));
            } catch (IOException e) {
                Source probe = Source.ofFile(name, new byte[0]);
                errorChannel.report(name, probe.resolveKind().orElse(null),
                        "unreadable file: " + e.getMessage());
            }
        }
        return sources;
    }

    private static void logMetricsSummary(Metrics metrics, int skipped) {
        String fmt = "  %-18s : %s";
        List<String> lines = Arrays.asList(
                String.format(fmt, "Overall integrity", metrics.getOverallIntegrity() + " %"),
                String.format(fmt, "Completeness", metrics.getCompleteness() + " %"),
                String.format(fmt, "Consistency", metrics.getConsistency() + " %"),
                String.format(fmt, "Valid records", metrics.getValidRecords()),
                String.format(fmt, "Invalid records", metrics.getInvalidRecords()),
                String.format(fmt, "Skipped sources", skipped));
        log.info("===== Integrity Summary =====\n{}",
                lines.stream().collect(Collectors.joining("\n")));
    }
}
