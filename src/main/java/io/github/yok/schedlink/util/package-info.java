/**
 * Utilities shared by the load pipeline: error reporting, log masking, JDBC connection opening and
 * name normalization.
 */
package io.github.yok.schedlink.util;
