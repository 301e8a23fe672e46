package org.simpleweather.interfaces;

/**
 * Answers whether this runtime instance may mutate the shared record.
 * Evaluated on every call; callers must not cache the answer.
 */
@FunctionalInterface
public interface AuthorityGate {

    boolean isAuthoritative();
}
