/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.kitten.category;

/**
 * Thrown when two functors are composed but the target category of the
 * first functor is not the source category of the second.
 */
@SuppressWarnings("serial")
public class CompositionMismatchException extends DomainMismatchException {
    public CompositionMismatchException(Category<?,?> target, Category<?,?> source) {
        super("Cannot compose functors: target category " + target +
              " does not match source category " + source,
              target, source);
    }
}
