package com.clinical.phenotype.cache;

import com.clinical.phenotype.core.PhenotypeException;

/**
 * The cache store failed. Never fatal: callers log a warning and recompute.
 */
public class CacheException extends PhenotypeException {

    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
