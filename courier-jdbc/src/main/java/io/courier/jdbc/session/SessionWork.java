package io.courier.jdbc.session;

/**
 * A unit of database work run inside {@link SessionManager#withSession(SessionWork)}.
 *
 * @param <R> result type
 * @param <E> exception type the work may throw; rethrown unchanged after rollback
 */
@FunctionalInterface
public interface SessionWork<R, E extends Exception> {

    R execute(Session session) throws E;
}
