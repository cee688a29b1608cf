/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.kitten.lectures;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import static com.google.common.base.Preconditions.checkArgument;

import com.cloudway.kitten.util.Config;

/**
 * An ordered sequence of named declarations, evaluated one after another
 * the way the code blocks of a lecture are. A cell can refer to the values
 * of the cells declared before it.
 */
public final class Notebook {
    private static final Logger logger = Logger.getLogger(Notebook.class.getName());

    static final String CONTINUE_ON_ERROR_KEY = "kitten.notebook.continueOnError";

    /**
     * The values of the cells evaluated so far.
     */
    public static final class Bindings {
        private final Map<String, Object> values = new HashMap<>();

        /**
         * Returns the value of an evaluated cell.
         *
         * @throws NoSuchElementException if no cell with the given name has
         *         been evaluated successfully
         */
        @SuppressWarnings("unchecked")
        public <T> T get(String name) {
            if (!values.containsKey(name)) {
                throw new NoSuchElementException("Undefined cell: " + name);
            }
            return (T)values.get(name);
        }
    }

    private static final class Cell {
        final String name;
        final Function<Bindings, ?> body;

        Cell(String name, Function<Bindings, ?> body) {
            this.name = name;
            this.body = body;
        }
    }

    /**
     * The outcome of evaluating a single cell.
     */
    public static final class Outcome {
        private final String name;
        private final Object value;
        private final RuntimeException failure;

        Outcome(String name, Object value, RuntimeException failure) {
            this.name = name;
            this.value = value;
            this.failure = failure;
        }

        public String name() {
            return name;
        }

        public Object value() {
            return value;
        }

        public Optional<RuntimeException> failure() {
            return Optional.ofNullable(failure);
        }

        public boolean succeeded() {
            return failure == null;
        }

        @Override
        public String toString() {
            return name + " = " + (failure == null ? value : "<" + failure + ">");
        }
    }

    /**
     * The outcomes of a notebook run, in evaluation order.
     */
    public static final class Result {
        private final ImmutableList<Outcome> outcomes;
        private final int declared;

        Result(ImmutableList<Outcome> outcomes, int declared) {
            this.outcomes = outcomes;
            this.declared = declared;
        }

        public ImmutableList<Outcome> outcomes() {
            return outcomes;
        }

        /**
         * Returns {@code true} if every declared cell was evaluated
         * successfully.
         */
        public boolean succeeded() {
            return outcomes.size() == declared && outcomes.stream().allMatch(Outcome::succeeded);
        }

        /**
         * Rethrows the failure of the first failed cell, if any.
         */
        public Result throwIfFailed() {
            for (Outcome o : outcomes) {
                if (o.failure != null) {
                    throw o.failure;
                }
            }
            return this;
        }
    }

    private final String title;
    private final ImmutableList<Cell> cells;

    private Notebook(String title, ImmutableList<Cell> cells) {
        this.title = title;
        this.cells = cells;
    }

    public static Builder builder(String title) {
        return new Builder(requireNonNull(title));
    }

    public String title() {
        return title;
    }

    /**
     * Returns the names of the cells in declaration order.
     */
    public ImmutableList<String> cellNames() {
        return cells.stream().map(c -> c.name).collect(ImmutableList.toImmutableList());
    }

    /**
     * Evaluate the cells in order. Whether evaluation goes on after a failed
     * cell is taken from the {@code kitten.notebook.continueOnError}
     * configuration property.
     */
    public Result run() {
        return run(Config.getDefault().getBoolean(CONTINUE_ON_ERROR_KEY, false));
    }

    /**
     * Evaluate the cells in order.
     *
     * @param continueOnError evaluate the remaining cells after a cell fails
     */
    public Result run(boolean continueOnError) {
        logger.info(() -> "Evaluating " + title + " (" + cells.size() + " cells)");

        Bindings bindings = new Bindings();
        ImmutableList.Builder<Outcome> outcomes = ImmutableList.builder();

        for (Cell cell : cells) {
            Outcome outcome;
            try {
                Object value = cell.body.apply(bindings);
                bindings.values.put(cell.name, value);
                outcome = new Outcome(cell.name, value, null);
                logger.info(outcome::toString);
            } catch (RuntimeException ex) {
                outcome = new Outcome(cell.name, null, ex);
                logger.log(Level.WARNING, "Cell " + cell.name + " failed", ex);
            }

            outcomes.add(outcome);
            if (!outcome.succeeded() && !continueOnError) {
                break;
            }
        }

        return new Result(outcomes.build(), cells.size());
    }

    public static final class Builder {
        private final String title;
        private final ImmutableList.Builder<Cell> cells = ImmutableList.builder();
        private final Set<String> names = new HashSet<>();

        Builder(String title) {
            this.title = title;
        }

        /**
         * Declare a cell. The body receives the values of the cells
         * evaluated before it. Cell names are unique within a notebook.
         */
        public Builder cell(String name, Function<Bindings, ?> body) {
            requireNonNull(name);
            requireNonNull(body);
            checkArgument(names.add(name), "duplicate cell: %s", name);
            cells.add(new Cell(name, body));
            return this;
        }

        public Notebook build() {
            return new Notebook(title, cells.build());
        }
    }
}
