package io.github.yok.flexintegrity.db;

import io.github.yok.flexintegrity.model.Table;
import java.util.List;

/**
 * Supplier of already materialized relational rows.
 *
 * <p>
 * Implementations must not propagate connectivity failures: a source that cannot be read is
 * reported through the error channel and contributes no table.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface RelationalSource {

    /**
     * Fetches the current rows of every configured relational source.
     *
     * @return one table per readable source, possibly empty; never {@code null}
     */
    List<Table> fetchTables();
}
