package io.github.yok.flexintegrity.db;

import com.google.common.base.Preconditions;
import io.github.yok.flexintegrity.config.ConnectionConfig;
import io.github.yok.flexintegrity.core.ErrorChannel;
import io.github.yok.flexintegrity.model.CellValue;
import io.github.yok.flexintegrity.model.Table;
import io.github.yok.flexintegrity.parser.SourceKind;
import java.sql.Connection;
import java.sql.DriverManager;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.dbunit.database.DatabaseConnection;
import org.dbunit.database.IDatabaseConnection;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.ITable;

/**
 * {@link RelationalSource} that runs the configured query of every {@link ConnectionConfig}
 * entry through DBUnit and converts the result into a {@link Table}.
 *
 * <p>
 * <strong>Value mapping:</strong>
 * </p>
 * <ul>
 * <li>SQL {@code NULL} → null</li>
 * <li>{@link Number} → number, {@link Boolean} → boolean</li>
 * <li>{@code byte[]} → upper-case hex string</li>
 * <li>anything else (dates, text, ...) → its {@code toString()} text</li>
 * </ul>
 *
 * <p>
 * A connection that cannot be opened or queried is reported to the {@link ErrorChannel} with kind
 * {@link SourceKind#RELATIONAL_ROWS} and skipped; no exception leaves this class.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DbUnitRelationalSource implements RelationalSource {

    /**
     * Opens a DBUnit connection for one configured entry (replaceable in tests).
     */
    @FunctionalInterface
    interface ConnectionOpener {

        /**
         * Opens the connection.
         *
         * @param entry connection settings
         * @return DBUnit connection; closed by the caller
         * @throws Exception on driver, connectivity or DBUnit failure
         */
        IDatabaseConnection open(ConnectionConfig.Entry entry) throws Exception;
    }

    private final ConnectionConfig connectionConfig;
    private final ErrorChannel errorChannel;
    private final ConnectionOpener opener;

    /**
     * Creates a source that connects through {@link DriverManager}.
     *
     * @param connectionConfig relational source settings
     * @param errorChannel sink for failed sources
     */
    public DbUnitRelationalSource(ConnectionConfig connectionConfig, ErrorChannel errorChannel) {
        this(connectionConfig, errorChannel, DbUnitRelationalSource::openWithDriverManager);
    }

    /**
     * Creates a source with a custom connection opener.
     *
     * @param connectionConfig relational source settings
     * @param errorChannel sink for failed sources
     * @param opener connection opener
     */
    DbUnitRelationalSource(ConnectionConfig connectionConfig, ErrorChannel errorChannel,
            ConnectionOpener opener) {
        this.connectionConfig = Preconditions.checkNotNull(connectionConfig);
        this.errorChannel = Preconditions.checkNotNull(errorChannel);
        this.opener = Preconditions.checkNotNull(opener);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public List<Table> fetchTables() {
        List<Table> tables = new ArrayList<>();
        List<ConnectionConfig.Entry> entries = connectionConfig.getConnections();
        if (entries == null || entries.isEmpty()) {
            log.info("No relational source configured");
            return tables;
        }
        for (ConnectionConfig.Entry entry : entries) {
            String id = entry.getId();
            if (StringUtils.isBlank(entry.getQuery())) {
                log.warn("[{}] Skipped: no query configured", id);
                continue;
            }
            log.info("[{}] === Relational fetch started ===", id);
            try {
                Table table = fetch(entry);
                log.info("[{}] === Relational fetch completed: rows={} ===", id,
                        table.getRowCount());
                tables.add(table);
            } catch (Exception e) {
                log.debug("[{}] Relational fetch failed\n{}", id, ExceptionUtils.getStackTrace(e));
                errorChannel.report(id, SourceKind.RELATIONAL_ROWS,
                        "database error: " + ExceptionUtils.getRootCauseMessage(e));
            }
        }
        return tables;
    }

    private Table fetch(ConnectionConfig.Entry entry) throws Exception {
        IDatabaseConnection connection = opener.open(entry);
        try {
            ITable result = connection.createQueryTable(entry.getId(), entry.getQuery());
            return toTable(entry.getId(), result);
        } finally {
            connection.close();
        }
    }

    /**
     * Converts a DBUnit table into a {@link Table}, keeping the result column order.
     *
     * @param name table name
     * @param result DBUnit table
     * @return converted table
     * @throws DataSetException on DBUnit read error
     */
    static Table toTable(String name, ITable result) throws DataSetException {
        Column[] columns = result.getTableMetaData().getColumns();
        Table table = new Table(name);
        for (Column column : columns) {
            table.addColumn(column.getColumnName());
        }
        for (int r = 0; r < result.getRowCount(); r++) {
            Map<String, CellValue> row = new LinkedHashMap<>();
            for (Column column : columns) {
                row.put(column.getColumnName(),
                        toCellValue(result.getValue(r, column.getColumnName())));
            }
            table.addRow(row);
        }
        return table;
    }

    private static CellValue toCellValue(Object raw) {
        if (raw instanceof byte[]) {
            return CellValue.ofString(Hex.encodeHexString((byte[]) raw).toUpperCase());
        }
        return CellValue.of(raw);
    }

    private static IDatabaseConnection openWithDriverManager(ConnectionConfig.Entry entry)
            throws Exception {
        // Blank driver class: rely on JDBC 4 service loading
        if (StringUtils.isNotBlank(entry.getDriverClass())) {
            Class.forName(entry.getDriverClass().trim());
        }
        Connection conn =
                DriverManager.getConnection(entry.getUrl(), entry.getUser(), entry.getPassword());
        try {
            return new DatabaseConnection(conn);
        } catch (Exception e) {
            conn.close();
            throw e;
        }
    }
}
