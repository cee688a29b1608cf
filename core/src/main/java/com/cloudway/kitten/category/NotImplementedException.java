/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.kitten.category;

/**
 * Thrown when a category or functor operation is invoked on a value that
 * was never given an implementation of it.
 */
@SuppressWarnings("serial")
public class NotImplementedException extends UnsupportedOperationException {
    private final String operation;

    public NotImplementedException(String operation, Object owner) {
        super(operation + " is not implemented by " + owner);
        this.operation = operation;
    }

    /**
     * Returns the name of the missing operation.
     */
    public String getOperation() {
        return operation;
    }
}
