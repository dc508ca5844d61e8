/**
 * Appointment ETL pipeline.
 *
 * <p>
 * Extracts the denormalized appointment rows from the HIS, rebuilds the destination tables and
 * loads patients, services, appointments and appointment/service links in one transaction.
 * </p>
 *
 * <p>
 * Destination DDL and reset strategies live in {@code db}; name inference in {@code infer}.
 * </p>
 */
package io.github.yok.schedlink.core;
