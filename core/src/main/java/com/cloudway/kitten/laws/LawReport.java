/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.kitten.laws;

import com.google.common.collect.ImmutableList;

/**
 * The outcome of checking the laws of a category or functor on a sample
 * of objects and morphisms.
 */
public final class LawReport {
    private final String subject;
    private final int checks;
    private final ImmutableList<LawViolation> violations;

    LawReport(String subject, int checks, ImmutableList<LawViolation> violations) {
        this.subject = subject;
        this.checks = checks;
        this.violations = violations;
    }

    /**
     * Returns the category or functor that was checked.
     */
    public String subject() {
        return subject;
    }

    /**
     * Returns the number of law instances checked.
     */
    public int checks() {
        return checks;
    }

    public ImmutableList<LawViolation> violations() {
        return violations;
    }

    /**
     * Returns {@code true} if no law instance was violated.
     */
    public boolean isLawful() {
        return violations.isEmpty();
    }

    @Override
    public String toString() {
        return subject + ": " + checks + " checks, " + violations.size() + " violations";
    }
}
