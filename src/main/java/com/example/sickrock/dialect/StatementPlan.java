package com.example.sickrock.dialect;

import java.util.List;

/**
 * Ordered statements realising one abstract schema operation.
 *
 * @param statements   executed in order
 * @param atomic       whether the database applies the whole plan atomically on its own; plans that
 *                     are not must run inside a single transaction
 * @param compensation statements that undo an applied plan, used where DDL auto-commits; may be empty
 */
public record StatementPlan(List<String> statements, boolean atomic, List<String> compensation) {
    public StatementPlan {
        if (statements == null || statements.isEmpty()) {
            throw new IllegalArgumentException("A statement plan needs at least one statement");
        }
        statements = List.copyOf(statements);
        compensation = compensation == null ? List.of() : List.copyOf(compensation);
    }

    public static StatementPlan single(String statement) {
        return new StatementPlan(List.of(statement), true, List.of());
    }

    public static StatementPlan single(String statement, String compensation) {
        return new StatementPlan(List.of(statement), true, List.of(compensation));
    }

    public static StatementPlan sequence(List<String> statements) {
        return new StatementPlan(statements, false, List.of());
    }
}
