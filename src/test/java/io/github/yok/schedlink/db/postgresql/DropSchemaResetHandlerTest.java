package io.github.yok.schedlink.db.postgresql;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class DropSchemaResetHandlerTest {

    @Test
    void reset_正常ケース_実行する_publicスキーマが削除後に再作成されること() throws Exception {
        Connection conn = mock(Connection.class);
        Statement st = mock(Statement.class);
        when(conn.createStatement()).thenReturn(st);

        new DropSchemaResetHandler().reset(conn);

        InOrder order = inOrder(st);
        order.verify(st).execute("DROP SCHEMA IF EXISTS public CASCADE");
        order.verify(st).execute("CREATE SCHEMA public");
        order.verify(st).execute("GRANT ALL ON SCHEMA public TO PUBLIC");
        order.verify(st).close();
    }

    @Test
    void reset_異常ケース_削除が失敗する_SQLExceptionが伝播し再作成されないこと() throws Exception {
        Connection conn = mock(Connection.class);
        Statement st = mock(Statement.class);
        when(conn.createStatement()).thenReturn(st);
        when(st.execute("DROP SCHEMA IF EXISTS public CASCADE"))
                .thenThrow(new SQLException("must be owner of schema public"));

        assertThrows(SQLException.class, () -> new DropSchemaResetHandler().reset(conn));

        verify(st, never()).execute("CREATE SCHEMA public");
        verify(st).close();
    }
}
