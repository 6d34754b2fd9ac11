package com.queryroute.catalog;

import com.queryroute.connector.SourceSession;
import com.queryroute.model.ColumnDescriptor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("SchemaIntrospector")
class SchemaIntrospectorTest {
    private final SchemaIntrospector introspector = new SchemaIntrospector(3, 1);
    private final SourceSession session = mock(SourceSession.class);

    @Test
    @DisplayName("transient failures are retried")
    void retries() {
        when(session.listTables())
                .thenThrow(new SchemaIntrospectionException("timeout"))
                .thenThrow(new SchemaIntrospectionException("timeout"))
                .thenReturn(List.of("orders"));

        assertThat(introspector.listTables(session)).containsExactly("orders");
        verify(session, times(3)).listTables();
    }

    @Test
    @DisplayName("listing gives up after the last attempt")
    void listGivesUp() {
        when(session.listTables()).thenThrow(new SchemaIntrospectionException("down"));

        assertThatThrownBy(() -> introspector.listTables(session))
                .isInstanceOf(SchemaIntrospectionException.class)
                .hasMessage("down");
        verify(session, times(3)).listTables();
    }

    @Test
    @DisplayName("a table that cannot be described has no columns")
    void describeGivesUp() {
        when(session.describeTable("orders")).thenThrow(new SchemaIntrospectionException("locked"));

        assertThat(introspector.describeOrEmpty(session, "orders")).isEmpty();
        verify(session, times(3)).describeTable("orders");
    }

    @Test
    @DisplayName("other errors are not retried")
    void otherErrors() {
        when(session.describeTable("orders")).thenThrow(new IllegalStateException("bug"));

        assertThatThrownBy(() -> introspector.describeOrEmpty(session, "orders")).isInstanceOf(IllegalStateException.class);
        verify(session, times(1)).describeTable("orders");
    }

    @Test
    @DisplayName("a successful call runs once")
    void once() {
        when(session.describeTable("orders")).thenReturn(List.of(ColumnDescriptor.of("id", "bigint")));

        assertThat(new SchemaIntrospector(1, 0).describeOrEmpty(session, "orders")).hasSize(1);
        verify(session, times(1)).describeTable("orders");
    }

    @Test
    @DisplayName("at least one attempt is required")
    void invalidAttempts() {
        assertThatThrownBy(() -> new SchemaIntrospector(0, 10)).isInstanceOf(IllegalArgumentException.class);
    }
}
