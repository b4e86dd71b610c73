/**
 * {@code JdbcTemplate} implementations of the storage ports. SQL is kept portable; H2 is the
 * bundled engine and the schema lives in {@code schema.sql}.
 */
package com.phillippitts.dictavault.repository.jdbc;
