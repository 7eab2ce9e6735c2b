package com.example.DmOracle.repository;

import com.example.DmOracle.config.OracleProperties;
import com.example.DmOracle.exception.QueryExecutionException;
import com.example.DmOracle.model.TabularResult;
import com.example.DmOracle.retrieval.FactTableExecutor;
import com.example.DmOracle.util.SqlScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs model-generated SQL against the fact table.
 *
 * A query is accepted only when it is a single SELECT (or WITH ... SELECT),
 * contains no data-changing keyword and reads no table other than the
 * configured fact table. Accepted queries run in a read-only transaction
 * that is always rolled back.
 */
@Repository
public class JdbcFactTableExecutor implements FactTableExecutor {

    private static final Logger log = LoggerFactory.getLogger(JdbcFactTableExecutor.class);

    private static final Pattern READ_ONLY = Pattern.compile("^(select|with)\\b");

    /**
     * Statements and clauses that write, plus database functions that touch files or other servers.
     */
    private static final Pattern DATA_CHANGE = Pattern.compile(
            "\\b(insert|update|delete|merge|upsert|into|drop|alter|truncate|create|grant|revoke|"
                    + "call|copy|execute|lock|vacuum|file_write|file_read|csvwrite|csvread|link_schema|"
                    + "runscript|script|dblink\\w*|lo_import|lo_export)\\b"
    );

    private static final Pattern SYSTEM_CATALOG = Pattern.compile("\\b(information_schema|pg_catalog|pg_\\w+)\\b");

    private static final Set<String> SYSTEM_SCHEMAS = Set.of("information_schema", "pg_catalog");

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate readOnlyTransaction;
    private final String factTable;
    private volatile Set<String> knownTables;

    public JdbcFactTableExecutor(DataSource dataSource, OracleProperties props) {
        // Dedicated template: the timeout and row cap apply to generated SQL only
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.jdbcTemplate.setQueryTimeout((int) Math.max(1, props.structured().queryTimeout().toSeconds()));
        this.jdbcTemplate.setMaxRows(props.structured().maxRows());

        this.readOnlyTransaction = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.readOnlyTransaction.setReadOnly(true);

        this.factTable = props.structured().table().toLowerCase(Locale.ROOT);
    }

    @Override
    public TabularResult execute(String queryText) {
        String sql = queryText == null ? "" : queryText.trim();
        String normalized = SqlScanner.normalize(sql);
        if (normalized.isEmpty()) {
            throw new QueryExecutionException("Query text is empty");
        }
        if (!READ_ONLY.matcher(normalized).find()) {
            throw new QueryExecutionException("Only SELECT queries are allowed against the fact table");
        }
        if (normalized.indexOf(';') >= 0) {
            throw new QueryExecutionException("Multiple statements are not allowed");
        }
        Matcher dataChange = DATA_CHANGE.matcher(normalized);
        if (dataChange.find()) {
            throw new QueryExecutionException("Data-changing keyword not allowed: " + dataChange.group(1).toUpperCase(Locale.ROOT));
        }
        if (SYSTEM_CATALOG.matcher(normalized).find()) {
            throw new QueryExecutionException("System catalogs may not be queried");
        }

        try {
            for (String table : knownTables()) {
                if (!table.equals(factTable)
                        && Pattern.compile("\\b" + Pattern.quote(table) + "\\b").matcher(normalized).find()) {
                    throw new QueryExecutionException("Only the " + factTable + " table may be queried, found: " + table);
                }
            }

            TabularResult result = readOnlyTransaction.execute(status -> {
                status.setRollbackOnly();
                return jdbcTemplate.query(sql, new TabularResultExtractor());
            });
            log.debug("Fact table query returned {} row(s)", result == null ? 0 : result.rows().size());
            return result;
        } catch (DataAccessException e) {
            Throwable cause = e.getMostSpecificCause();
            throw new QueryExecutionException(cause.getMessage() != null ? cause.getMessage() : e.getMessage(), e);
        } catch (TransactionException e) {
            throw new QueryExecutionException("Read-only transaction failed: " + e.getMessage(), e);
        }
    }

    /**
     * Lower-cased names of every table and view outside the system schemas, loaded on first use.
     */
    private Set<String> knownTables() {
        Set<String> tables = knownTables;
        if (tables == null) {
            tables = jdbcTemplate.execute((ConnectionCallback<Set<String>>) connection -> {
                Set<String> names = new HashSet<>();
                try (ResultSet rs = connection.getMetaData().getTables(null, null, "%", null)) {
                    while (rs.next()) {
                        String schema = rs.getString("TABLE_SCHEM");
                        if (schema != null && SYSTEM_SCHEMAS.contains(schema.toLowerCase(Locale.ROOT))) {
                            continue;
                        }
                        names.add(rs.getString("TABLE_NAME").toLowerCase(Locale.ROOT));
                    }
                }
                return Set.copyOf(names);
            });
            knownTables = tables;
            log.debug("Fact table guard knows {} table(s)", tables.size());
        }
        return tables;
    }

    private static class TabularResultExtractor implements ResultSetExtractor<TabularResult> {
        @Override
        public TabularResult extractData(ResultSet rs) throws SQLException {
            ResultSetMetaData md = rs.getMetaData();
            int count = md.getColumnCount();
            List<String> columns = new ArrayList<>(count);
            for (int i = 1; i <= count; i++) {
                columns.add(md.getColumnLabel(i));
            }

            List<Map<String, Object>> rows = new ArrayList<>();
            while (rs.next()) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 1; i <= count; i++) {
                    row.put(columns.get(i - 1), rs.getObject(i));
                }
                rows.add(row);
            }
            return new TabularResult(columns, rows);
        }
    }
}
