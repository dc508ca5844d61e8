/**
 * SchedLink: loads HIS appointment records into a normalized analysis database.
 */
package io.github.yok.schedlink;
