/**
 * JDBC connection sources for {@link io.courier.jdbc.session.SessionManager}.
 *
 * @see io.courier.jdbc.DataSourceConnectionProvider
 */
package io.courier.jdbc;
