package com.mike.contactcardfinder.service.behavior;

import com.mike.contactcardfinder.exception.ConfigInvalidException;

public record IdentityConfig(boolean rotate, int poolSize, String preferPlatform) {

    public IdentityConfig {
        if (poolSize <= 0) throw new ConfigInvalidException("identity poolSize must be > 0, got " + poolSize);
    }

    public static IdentityConfig defaults() {
        return new IdentityConfig(true, 10, null);
    }
}
