/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.kitten.laws;

/**
 * Thrown by a fail-fast law check on the first violation.
 */
@SuppressWarnings("serial")
public class LawViolationException extends IllegalStateException {
    private final transient LawViolation violation;

    public LawViolationException(LawViolation violation) {
        super("Law violated: " + violation);
        this.violation = violation;
    }

    public LawViolation getViolation() {
        return violation;
    }
}
