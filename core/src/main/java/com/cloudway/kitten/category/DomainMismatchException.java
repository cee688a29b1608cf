/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.kitten.category;

/**
 * Thrown when two morphisms are composed but the codomain of the first
 * morphism is not the domain of the second.
 */
@SuppressWarnings("serial")
public class DomainMismatchException extends IllegalArgumentException {
    private final transient Object codomain;
    private final transient Object domain;

    public DomainMismatchException(Object codomain, Object domain) {
        this("Cannot compose morphisms: codomain " + codomain + " does not match domain " + domain,
             codomain, domain);
    }

    protected DomainMismatchException(String message, Object codomain, Object domain) {
        super(message);
        this.codomain = codomain;
        this.domain = domain;
    }

    /**
     * Returns the codomain of the first morphism.
     */
    public Object getCodomain() {
        return codomain;
    }

    /**
     * Returns the domain of the second morphism.
     */
    public Object getDomain() {
        return domain;
    }
}
