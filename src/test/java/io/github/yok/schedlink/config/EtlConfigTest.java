package io.github.yok.schedlink.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

class EtlConfigTest {

    @Test
    void constructor_正常ケース_既定値で生成する_安全側の既定値になること() {
        EtlConfig config = new EtlConfig();

        assertTrue(config.isConfirmBeforeLoad());
        assertEquals(SchemaResetMode.SCHEMA, config.getResetMode());
        assertEquals("sql/extract-appointments.sql", config.getExtractQueryLocation());
        assertEquals("names/first-names.csv", config.getNameDictionaryLocation());
        assertEquals("PY", config.getNameInferenceCountry());
        assertEquals(500, config.getProgressInterval());
    }
}
