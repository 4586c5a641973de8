package org.treqs.domain.interfaces;

import org.treqs.domain.SessionIdException;

public interface ISessionIdSource {
    /**
     * @return a fresh, non-guessable hex identifier
     * @throws SessionIdException if the random source cannot deliver
     */
    String next();
}
