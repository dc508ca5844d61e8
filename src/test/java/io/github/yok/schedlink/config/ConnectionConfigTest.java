package io.github.yok.schedlink.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import org.junit.jupiter.api.Test;

class ConnectionConfigTest {

    @Test
    void requireSource_正常ケース_URLが設定されている_接続情報が返ること() {
        ConnectionConfig config = new ConnectionConfig();
        ConnectionConfig.Entry entry = new ConnectionConfig.Entry();
        entry.setUrl("jdbc:sqlserver://his:1433;databaseName=HIS");
        config.setSource(entry);

        assertSame(entry, config.requireSource());
    }

    @Test
    void requireSource_異常ケース_未設定である_IllegalStateExceptionが送出されること() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new ConnectionConfig().requireSource());
        assertEquals("connections.source.url is not configured. Please set it in application.yml.",
                ex.getMessage());
    }

    @Test
    void requireDestination_異常ケース_URLが空白である_IllegalStateExceptionが送出されること() {
        ConnectionConfig config = new ConnectionConfig();
        ConnectionConfig.Entry entry = new ConnectionConfig.Entry();
        entry.setUrl("  ");
        config.setDestination(entry);

        assertThrows(IllegalStateException.class, config::requireDestination);
    }
}
