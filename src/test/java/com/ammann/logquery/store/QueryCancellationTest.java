/* (C)2026 */
package com.ammann.logquery.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.sql.SQLException;
import java.sql.Statement;
import org.junit.jupiter.api.Test;

class QueryCancellationTest
{
    @Test
    void cancelAbortsTheRegisteredStatement() throws SQLException
    {
        Statement statement = mock(Statement.class);
        QueryCancellation cancellation = new QueryCancellation();
        cancellation.register(statement);

        cancellation.cancel();

        verify(statement).cancel();
        assertThat(cancellation.isCancelled()).isTrue();
    }

    @Test
    void clearedStatementIsNotCancelled() throws SQLException
    {
        Statement statement = mock(Statement.class);
        QueryCancellation cancellation = new QueryCancellation();
        cancellation.register(statement);
        cancellation.clear();

        cancellation.cancel();

        verify(statement, never()).cancel();
    }

    @Test
    void registrationAfterCancelIsRejected()
    {
        QueryCancellation cancellation = new QueryCancellation();
        cancellation.cancel();

        assertThatThrownBy(() -> cancellation.register(mock(Statement.class)))
                .isInstanceOf(SQLException.class)
                .hasMessageContaining("cancelled");
    }

    @Test
    void driverFailureOnCancelDoesNotEscape() throws SQLException
    {
        Statement statement = mock(Statement.class);
        doThrow(new SQLException("connection closed")).when(statement).cancel();
        QueryCancellation cancellation = new QueryCancellation();
        cancellation.register(statement);

        assertThatCode(cancellation::cancel).doesNotThrowAnyException();
        assertThat(cancellation.isCancelled()).isTrue();
    }
}
