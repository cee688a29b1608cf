/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.kitten.laws;

import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableList;

import com.cloudway.kitten.category.DomainMismatchException;
import com.cloudway.kitten.util.Config;

/**
 * Collects law violations for a single subject.
 */
final class LawChecker {
    private static final Logger logger = Logger.getLogger(LawChecker.class.getName());

    static final String FAIL_FAST_KEY = "kitten.laws.failFast";

    private final String subject;
    private final boolean failFast;
    private final ImmutableList.Builder<LawViolation> violations = ImmutableList.builder();
    private int checks;

    LawChecker(Object subject, boolean failFast) {
        this.subject = String.valueOf(subject);
        this.failFast = failFast;
    }

    static boolean defaultFailFast() {
        return Config.getDefault().getBoolean(FAIL_FAST_KEY, false);
    }

    void expectEqual(String law, Object expected, Object actual, Object... witnesses) {
        checks++;
        if (!Objects.equals(expected, actual)) {
            violate(new LawViolation(law, ImmutableList.copyOf(witnesses), expected, actual));
        }
    }

    /**
     * Compare two compositions. A composition that fails with a domain
     * mismatch violates the law.
     */
    <T> void expectComposite(String law, Supplier<T> expected, Supplier<T> actual, Object... witnesses) {
        T e, a;
        try {
            e = expected.get();
            a = actual.get();
        } catch (DomainMismatchException ex) {
            reject(law, ex.getMessage(), witnesses);
            return;
        }
        expectEqual(law, e, a, witnesses);
    }

    void reject(String law, Object reason, Object... witnesses) {
        checks++;
        violate(new LawViolation(law, ImmutableList.copyOf(witnesses), null, reason));
    }

    private void violate(LawViolation violation) {
        logger.fine(() -> subject + ": " + violation);
        if (failFast) {
            throw new LawViolationException(violation);
        }
        violations.add(violation);
    }

    LawReport report() {
        LawReport report = new LawReport(subject, checks, violations.build());
        logger.log(report.isLawful() ? Level.INFO : Level.WARNING, report.toString());
        return report;
    }
}
