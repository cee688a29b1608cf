/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.kitten.finset;

import java.util.NoSuchElementException;

/**
 * Thrown when a finite function is evaluated at an element outside of
 * its domain.
 */
@SuppressWarnings("serial")
public class KeyNotFoundException extends NoSuchElementException {
    private final transient Object key;

    public KeyNotFoundException(Object key, FinSet<?> domain) {
        super(key + " is not an element of the domain " + domain);
        this.key = key;
    }

    /**
     * Returns the element that was not found.
     */
    public Object getKey() {
        return key;
    }
}
