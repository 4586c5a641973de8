package org.treqs.infrastructure.impl;

import org.treqs.domain.SessionIdException;
import org.treqs.domain.interfaces.ISessionIdSource;

import java.security.SecureRandom;
import java.util.HexFormat;

/** 32 bytes from {@link SecureRandom}, hex encoded (64 chars). */
public final class SecureRandomSessionIds implements ISessionIdSource {
    static final int ID_BYTES = 32;

    private final SecureRandom random;

    public SecureRandomSessionIds() {
        this(new SecureRandom());
    }

    public SecureRandomSessionIds(SecureRandom random) {
        this.random = random;
    }

    @Override
    public String next() {
        byte[] b = new byte[ID_BYTES];
        try {
            random.nextBytes(b);
        } catch (RuntimeException e) {
            throw new SessionIdException("secure random source failed", e);
        }
        return HexFormat.of().formatHex(b);
    }
}
