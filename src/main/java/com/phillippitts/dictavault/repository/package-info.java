/**
 * Storage ports. Services depend only on these interfaces; {@code repository.jdbc} provides
 * the {@code JdbcTemplate} implementations against {@code schema.sql}.
 */
package com.phillippitts.dictavault.repository;
