/**
 * Scoped database sessions.
 *
 * <p>{@link io.courier.jdbc.session.SessionManager#withSession} opens one
 * {@link io.courier.jdbc.session.Session} per unit of work, commits or rolls it back and
 * always closes it.
 */
package io.courier.jdbc.session;
