package io.github.yok.schedlink.config;

/**
 * Enumerates the strategies used to wipe the destination before each load.
 *
 * <ul>
 * <li>SCHEMA: drop and recreate the {@code public} schema (PostgreSQL)</li>
 * <li>TABLES: drop only the tables owned by this tool, child tables first</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public enum SchemaResetMode {
    // DROP SCHEMA public CASCADE, then CREATE SCHEMA public
    SCHEMA,
    // DROP TABLE IF EXISTS ... CASCADE for each destination table
    TABLES
}
