import io.github.flameyossnowy.universal.aggregates.api.dialect.DialectActions;
import io.github.flameyossnowy.universal.aggregates.api.dialect.DialectDispatcher;
import io.github.flameyossnowy.universal.aggregates.api.dialect.DialectFunctions;
import io.github.flameyossnowy.universal.aggregates.api.dialect.SQLType;
import io.github.flameyossnowy.universal.aggregates.api.exceptions.DialectUnsupportedOperationException;
import org.junit.jupiter.api.Test;

import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DialectDispatcherTest {

    @Test
    void run_invokes_only_the_matching_handler() {
        Runnable postgres = mock(Runnable.class);
        Runnable mysql = mock(Runnable.class);
        Runnable fallback = mock(Runnable.class);

        new DialectDispatcher(SQLType.MYSQL).run(DialectActions.builder()
            .postgres(postgres)
            .mysql(mysql)
            .orElse(fallback)
            .build());

        verify(mysql, times(1)).run();
        verifyNoInteractions(postgres, fallback);
    }

    @Test
    void run_falls_back_to_default_handler() {
        Runnable postgres = mock(Runnable.class);
        Runnable fallback = mock(Runnable.class);

        new DialectDispatcher(SQLType.SQLITE).run(DialectActions.builder()
            .postgres(postgres)
            .orElse(fallback)
            .build());

        verify(fallback, times(1)).run();
        verifyNoInteractions(postgres);
    }

    @Test
    void run_without_match_or_default_is_a_no_op() {
        Runnable postgres = mock(Runnable.class);

        assertDoesNotThrow(() -> new DialectDispatcher(SQLType.ORACLE).run(DialectActions.builder()
            .postgres(postgres)
            .build()));

        verifyNoInteractions(postgres);
    }

    @Test
    @SuppressWarnings("unchecked")
    void apply_returns_value_of_matching_handler() {
        Supplier<String> sqlite = mock(Supplier.class);
        Supplier<String> fallback = mock(Supplier.class);
        when(sqlite.get()).thenReturn("GROUP_CONCAT");

        String name = new DialectDispatcher(SQLType.SQLITE).apply(DialectFunctions.<String>builder()
            .sqlite(sqlite)
            .orElse(fallback)
            .build());

        assertEquals("GROUP_CONCAT", name);
        verifyNoInteractions(fallback);
    }

    @Test
    void apply_without_handler_fails_with_dialect_unsupported() {
        DialectDispatcher dispatcher = new DialectDispatcher(SQLType.SQL_SERVER);
        DialectFunctions<String> functions = DialectFunctions.<String>builder()
            .postgres(() -> "STRING_AGG")
            .build();

        DialectUnsupportedOperationException error =
            assertThrows(DialectUnsupportedOperationException.class, () -> dispatcher.apply(functions));
        assertEquals(SQLType.SQL_SERVER, error.getSqlType());
        assertTrue(error.getMessage().contains("dialect=SQL Server"));
    }

    @Test
    void on_registers_handler_for_any_dialect() {
        String result = new DialectDispatcher(SQLType.ORACLE).apply(DialectFunctions.<String>builder()
            .on(SQLType.ORACLE, () -> "LISTAGG")
            .orElse(() -> "other")
            .build());

        assertEquals("LISTAGG", result);
    }

    @Test
    void sql_type_resolves_common_aliases() {
        assertEquals(SQLType.POSTGRESQL, SQLType.fromName("postgres"));
        assertEquals(SQLType.POSTGRESQL, SQLType.fromName("PostgreSQL"));
        assertEquals(SQLType.MYSQL, SQLType.fromName("MariaDB"));
        assertEquals(SQLType.SQLITE, SQLType.fromName("sqlite3"));
        assertEquals(SQLType.SQL_SERVER, SQLType.fromName("sql-server"));
        assertThrows(IllegalArgumentException.class, () -> SQLType.fromName("db2"));
    }

    @Test
    void only_postgres_and_sqlite_support_filter_clause() {
        assertTrue(SQLType.POSTGRESQL.supportsFilterClause());
        assertTrue(SQLType.SQLITE.supportsFilterClause());
        assertFalse(SQLType.MYSQL.supportsFilterClause());
        assertFalse(SQLType.ORACLE.supportsFilterClause());
        assertFalse(SQLType.SQL_SERVER.supportsFilterClause());
    }
}
