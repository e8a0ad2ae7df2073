/* (C)2026 */
package com.ammann.logquery.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.logquery.exception.UnknownColumnException;
import com.ammann.logquery.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ColumnRegistryTest {

    @Nested
    @DisplayName("Lookup")
    class LookupTests {

        @Test
        void resolvesRegisteredColumn() {
            assertThat(ColumnRegistry.lookup("user_id")).contains(LogColumn.USER_ID);
        }

        @Test
        void lookupIsCaseSensitive() {
            assertThat(ColumnRegistry.lookup("USER_ID")).isEmpty();
        }

        @Test
        void unknownAndNullNamesAreEmpty() {
            assertThat(ColumnRegistry.lookup("password")).isEmpty();
            assertThat(ColumnRegistry.lookup(null)).isEmpty();
            assertThat(ColumnRegistry.lookup("user_id; DROP TABLE as_log_info")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Capabilities")
    class CapabilityTests {

        @Test
        void logMessageIsFilterableAndSortableButNotGroupable() {
            assertThat(ColumnRegistry.isFilterable("log_message")).isTrue();
            assertThat(ColumnRegistry.isSortable("log_message")).isTrue();
            assertThat(ColumnRegistry.isGroupable("log_message")).isFalse();
        }

        @Test
        void timestampsAreSortableOnly() {
            assertThat(ColumnRegistry.isFilterable("log_date_time")).isFalse();
            assertThat(ColumnRegistry.isSortable("log_date_time")).isTrue();
            assertThat(ColumnRegistry.isGroupable("as_start_date_time")).isFalse();
        }

        @Test
        void serverConfigIsFilterableOnly() {
            assertThat(ColumnRegistry.isFilterable("as_server_config")).isTrue();
            assertThat(ColumnRegistry.isSortable("as_server_config")).isFalse();
            assertThat(ColumnRegistry.isGroupable("as_server_config")).isFalse();
        }

        @Test
        void unknownColumnHasNoCapabilities() {
            assertThat(ColumnRegistry.isFilterable("nope")).isFalse();
            assertThat(ColumnRegistry.isSortable("nope")).isFalse();
            assertThat(ColumnRegistry.isGroupable("nope")).isFalse();
        }
    }

    @Nested
    @DisplayName("Qualification")
    class QualificationTests {

        @Test
        void qualifiesByOwningTable() {
            assertThat(ColumnRegistry.qualify("user_id")).isEqualTo("ali.user_id");
            assertThat(ColumnRegistry.qualify("host_name")).isEqualTo("asli.host_name");
        }

        @Test
        void joinKeyIsQualifiedWithPrimaryTable() {
            assertThat(ColumnRegistry.qualify("as_instance_id")).isEqualTo("ali.as_instance_id");
        }

        @Test
        void unknownColumnIsRejected() {
            assertThatThrownBy(() -> ColumnRegistry.qualify("secret"))
                    .isInstanceOf(UnknownColumnException.class)
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("secret")
                    .satisfies(e -> assertThat(((UnknownColumnException) e).getColumn()).isEqualTo("secret"));
        }

        @Test
        void everyColumnBelongsToExactlyOneTable() {
            assertThat(ColumnRegistry.columnsOf(LogTable.LOG_INFO))
                    .doesNotContainAnyElementsOf(ColumnRegistry.columnsOf(LogTable.START_LOG_INFO));
            assertThat(ColumnRegistry.columnsOf(LogTable.LOG_INFO).size()
                            + ColumnRegistry.columnsOf(LogTable.START_LOG_INFO).size())
                    .isEqualTo(LogColumn.values().length);
        }
    }

    @Test
    void projectionListsEveryColumnQualifiedInCanonicalOrder() {
        String projection = ColumnRegistry.projection();

        assertThat(projection).startsWith("ali.log_date_time, asli.host_name");
        assertThat(projection).endsWith("ali.log_message, ali.as_instance_id");
        assertThat(projection.split(", ")).hasSize(LogColumn.values().length);
    }
}
