/* (C)2026 */
package com.ammann.logquery.query;

import com.ammann.logquery.dto.LogQueryRequestDTO;
import com.ammann.logquery.dto.PageRequestDTO;
import com.ammann.logquery.dto.SortRequestDTO;
import com.ammann.logquery.enumeration.StatementKind;
import com.ammann.logquery.registry.ColumnRegistry;
import com.ammann.logquery.registry.LogColumn;
import com.ammann.logquery.registry.LogTable;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the row, count, group and breakdown statements from one shared predicate.
 *
 * <p>All variants use the same join and the same WHERE clause with the same parameter vector.
 * Pagination parameters are appended after the shared ones and belong to the row statement
 * only.
 */
@ApplicationScoped
public class QueryVariantBuilder {

    static final String FROM_CLAUSE =
            " FROM " + LogTable.LOG_INFO.fromItem()
                    + " JOIN " + LogTable.START_LOG_INFO.fromItem()
                    + " ON " + ColumnRegistry.JOIN_KEY.qualifiedName()
                    + " = " + LogTable.START_LOG_INFO.alias() + "."
                    + ColumnRegistry.JOIN_KEY.columnName();

    /**
     * Build every statement a faceted request needs.
     *
     * @param request validated request
     * @param predicate predicate compiled from {@code request}
     * @return rows and count, plus group and breakdown when requested
     */
    public QueryVariants build(LogQueryRequestDTO request, CompiledPredicate predicate) {
        return new QueryVariants(
                predicate,
                buildRowQuery(predicate, request.sort(), request.pagination()),
                buildCountQuery(predicate),
                request.groupColumn().map(c -> buildGroupQuery(predicate, c)).orElse(null),
                request.breakdownColumn().map(c -> buildBreakdownQuery(predicate, c)).orElse(null));
    }

    public SqlStatement buildRowQuery(
            CompiledPredicate predicate, SortRequestDTO sort, PageRequestDTO page) {
        String sql = "SELECT " + ColumnRegistry.projection()
                + FROM_CLAUSE
                + predicate.whereClause()
                + " ORDER BY " + sort.buildOrderByClause()
                + " LIMIT ? OFFSET ?";

        List<Object> parameters = new ArrayList<>(predicate.parameters());
        parameters.add(page.getLimit());
        parameters.add(page.getOffset());
        return new SqlStatement(StatementKind.ROWS, sql, parameters);
    }

    /**
     * Row statement of the simple query: no offset, capped at {@code maxRows}.
     */
    public SqlStatement buildSimpleRowQuery(
            CompiledPredicate predicate, SortRequestDTO sort, int maxRows) {
        String sql = "SELECT " + ColumnRegistry.projection()
                + FROM_CLAUSE
                + predicate.whereClause()
                + " ORDER BY " + sort.buildOrderByClause()
                + " LIMIT ?";

        List<Object> parameters = new ArrayList<>(predicate.parameters());
        parameters.add(maxRows);
        return new SqlStatement(StatementKind.ROWS, sql, parameters);
    }

    public SqlStatement buildCountQuery(CompiledPredicate predicate) {
        String sql = "SELECT COUNT(*) AS total_count" + FROM_CLAUSE + predicate.whereClause();
        return new SqlStatement(StatementKind.COUNT, sql, predicate.parameters());
    }

    public SqlStatement buildGroupQuery(CompiledPredicate predicate, LogColumn column) {
        String qualified = column.qualifiedName();
        String sql = "SELECT " + qualified + " AS group_key, COUNT(*) AS group_count"
                + FROM_CLAUSE
                + predicate.whereClause()
                + " GROUP BY " + qualified
                + " ORDER BY group_count DESC, group_key ASC";
        return new SqlStatement(StatementKind.GROUP, sql, predicate.parameters());
    }

    /**
     * Hourly (UTC) buckets of the primary timestamp, each split by {@code column}.
     *
     * <p>Per bucket the statement returns the bucket start as ISO-8601 text, the bucket total,
     * and a JSON array of {@code [category, count]} pairs ordered by count descending. A null
     * category stays a JSON null so it cannot collide with a stored value.
     */
    public SqlStatement buildBreakdownQuery(CompiledPredicate predicate, LogColumn column) {
        String bucket = "date_trunc('hour', "
                + ColumnRegistry.TIMESTAMP.qualifiedName() + " AT TIME ZONE 'UTC')";
        String category = "CAST(" + column.qualifiedName() + " AS TEXT)";

        String sql = "WITH bucketed AS (SELECT " + bucket + " AS bucket, "
                + category + " AS category, COUNT(*) AS category_count"
                + FROM_CLAUSE
                + predicate.whereClause()
                + " GROUP BY 1, 2)"
                + " SELECT to_char(bucket, 'YYYY-MM-DD\"T\"HH24:MI:SS\"Z\"') AS bucket_timestamp,"
                + " SUM(category_count) AS total_count,"
                + " CAST(json_agg(json_build_array(category, category_count)"
                + " ORDER BY category_count DESC) AS TEXT) AS breakdown"
                + " FROM bucketed GROUP BY bucket ORDER BY bucket ASC";
        return new SqlStatement(StatementKind.BREAKDOWN, sql, predicate.parameters());
    }
}
