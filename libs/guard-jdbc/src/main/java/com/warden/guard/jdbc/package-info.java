/**
 * JDBC-backed {@link com.warden.guard.ResourceSource} built on Spring's
 * {@link org.springframework.jdbc.core.JdbcTemplate}. Each ownership probe is one
 * {@code SELECT CASE WHEN ...} round trip; cancellation cancels the running statement.
 */
package com.warden.guard.jdbc;
