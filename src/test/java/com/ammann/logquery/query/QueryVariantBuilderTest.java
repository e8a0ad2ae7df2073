/* (C)2026 */
package com.ammann.logquery.query;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.logquery.dto.LogQueryRequestDTO;
import com.ammann.logquery.dto.PageRequestDTO;
import com.ammann.logquery.dto.SortRequestDTO;
import com.ammann.logquery.dto.TimeWindowDTO;
import com.ammann.logquery.enumeration.SortDirection;
import com.ammann.logquery.enumeration.StatementKind;
import com.ammann.logquery.registry.LogColumn;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class QueryVariantBuilderTest {

    private final PredicateCompiler compiler = new PredicateCompiler();
    private final QueryVariantBuilder builder = new QueryVariantBuilder();

    private QueryVariants build(LogQueryRequestDTO request) {
        return builder.build(request, compiler.compile(request));
    }

    @Test
    void rowQueryAppendsLimitAndOffsetAfterSharedParameters() {
        LogQueryRequestDTO request = new LogQueryRequestDTO(
                TimeWindowDTO.relative("24 hours"),
                Map.of(LogColumn.USER_ID, "alice"),
                null,
                new PageRequestDTO(2, 50),
                null,
                null);

        SqlStatement rows = build(request).rows();

        assertThat(rows.kind()).isEqualTo(StatementKind.ROWS);
        assertThat(rows.sql())
                .startsWith("SELECT ali.log_date_time, asli.host_name")
                .contains(" FROM as_log_info ali JOIN as_start_log_info asli"
                        + " ON ali.as_instance_id = asli.as_instance_id")
                .endsWith(" ORDER BY ali.log_date_time DESC LIMIT ? OFFSET ?");
        assertThat(rows.parameters()).containsExactly("24 hours", "alice%", 50, 50L);
    }

    @Test
    void everyVariantSharesPredicateAndParameters() {
        LogQueryRequestDTO request = new LogQueryRequestDTO(
                TimeWindowDTO.relative("1 hour"),
                Map.of(LogColumn.HOST_NAME, "app"),
                null,
                null,
                LogColumn.USER_ID,
                LogColumn.ERROR_NUMBER);

        QueryVariants variants = build(request);
        String where = variants.predicate().whereClause();
        List<Object> shared = variants.predicate().parameters();

        assertThat(variants.statements())
                .extracting(SqlStatement::kind)
                .containsExactly(StatementKind.ROWS, StatementKind.COUNT, StatementKind.GROUP,
                        StatementKind.BREAKDOWN);
        for (SqlStatement statement : variants.statements()) {
            assertThat(statement.sql()).contains(where);
            assertThat(statement.parameters().subList(0, shared.size())).isEqualTo(shared);
        }
        assertThat(variants.count().parameters()).isEqualTo(shared);
        assertThat(variants.group().parameters()).isEqualTo(shared);
        assertThat(variants.breakdown().parameters()).isEqualTo(shared);
    }

    @Test
    void unfilteredRequestHasNoWhereClause() {
        QueryVariants variants = build(new LogQueryRequestDTO(null, null, null, null, null, null));

        assertThat(variants.statements()).hasSize(2);
        assertThat(variants.count().sql())
                .isEqualTo("SELECT COUNT(*) AS total_count FROM as_log_info ali JOIN as_start_log_info asli"
                        + " ON ali.as_instance_id = asli.as_instance_id");
        assertThat(variants.rows().sql()).doesNotContain("WHERE");
        assertThat(variants.rows().parameters()).containsExactly(100, 0L);
        assertThat(variants.groupStatement()).isEmpty();
        assertThat(variants.breakdownStatement()).isEmpty();
    }

    @Test
    void groupQueryOrdersByCountDescending() {
        SqlStatement group =
                builder.buildGroupQuery(new CompiledPredicate(List.of(), List.of()), LogColumn.HOST_NAME);

        assertThat(group.sql())
                .startsWith("SELECT asli.host_name AS group_key, COUNT(*) AS group_count")
                .endsWith(" GROUP BY asli.host_name ORDER BY group_count DESC, group_key ASC");
    }

    @Test
    void breakdownQueryBucketsHourlyInUtc() {
        SqlStatement breakdown = builder.buildBreakdownQuery(
                new CompiledPredicate(List.of("ali.user_id LIKE ?"), List.of("a%")), LogColumn.ERROR_NUMBER);

        assertThat(breakdown.kind()).isEqualTo(StatementKind.BREAKDOWN);
        assertThat(breakdown.sql())
                .contains("date_trunc('hour', ali.log_date_time AT TIME ZONE 'UTC')")
                .contains("CAST(ali.error_number AS TEXT) AS category")
                .doesNotContain("COALESCE")
                .contains("WHERE ali.user_id LIKE ?")
                .contains("json_agg(json_build_array(category, category_count) ORDER BY category_count DESC)")
                .endsWith("ORDER BY bucket ASC");
        assertThat(breakdown.parameters()).containsExactly("a%");
    }

    @Test
    void simpleRowQueryCapsRowsWithoutOffset() {
        SqlStatement rows = builder.buildSimpleRowQuery(
                new CompiledPredicate(List.of("ali.log_date_time > NOW() - CAST(? AS INTERVAL)"), List.of("2 hours")),
                new SortRequestDTO(LogColumn.USER_ID, SortDirection.ASCENDING),
                10000);

        assertThat(rows.sql()).endsWith(" ORDER BY ali.user_id ASC LIMIT ?").doesNotContain("OFFSET");
        assertThat(rows.parameters()).containsExactly("2 hours", 10000);
    }
}
