/**
 * Spring configuration: executors, HTTP client for the classifier, vault crypto beans.
 *
 * <p>Typed properties live in {@code config.properties}. Storage needs no explicit
 * configuration: Spring Boot provides the {@code DataSource}, {@code JdbcTemplate} and
 * {@code TransactionTemplate} from {@code spring.datasource.*}.
 */
package com.phillippitts.dictavault.config;
