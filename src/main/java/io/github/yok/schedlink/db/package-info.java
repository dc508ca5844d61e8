/**
 * Destination database structure: table DDL and the strategies used to wipe the destination
 * before a load.
 */
package io.github.yok.schedlink.db;
