package io.github.yok.flexintegrity.config;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that manages the relational sources loaded from {@code application.yml}.
 * Each entry names a JDBC connection and the query whose result rows are ingested.
 *
 * <pre>
 * connections:
 *   - id: db1
 *     url: jdbc:mysql://localhost:3306/your_database
 *     user: username
 *     password: password
 *     driverClass: com.mysql.cj.jdbc.Driver
 *     query: SELECT * FROM your_table_name
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties
@Data
public class ConnectionConfig {

    /**
     * List of connection entries, queried in this order.
     */
    private List<Entry> connections = ImmutableList.of();

    /**
     * Inner class that holds one relational source.
     */
    @Data
    public static class Entry {
        // Logical ID of the source (e.g., "db1"), also used as the table name
        private String id;
        // JDBC connection URL
        private String url;
        // Database user name
        private String user;
        // Database password
        private String password;
        // Fully qualified JDBC driver class name; blank means JDBC 4 auto-loading
        private String driverClass;
        // Query whose result rows are ingested
        private String query;
    }
}
