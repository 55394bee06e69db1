package com.vtb.traffic.heuristics;

import com.vtb.traffic.models.FindingCategory;
import com.vtb.traffic.models.Severity;
import com.vtb.traffic.models.Transaction;

import java.util.Optional;
import java.util.function.Function;

final class SimpleRule implements HeuristicRule {

    private final String id;
    private final FindingCategory category;
    private final Severity severity;
    private final Function<Transaction, Optional<String>> check;

    SimpleRule(String id, FindingCategory category, Severity severity,
               Function<Transaction, Optional<String>> check) {
        this.id = id;
        this.category = category;
        this.severity = severity;
        this.check = check;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public FindingCategory getCategory() {
        return category;
    }

    @Override
    public Severity getSeverity() {
        return severity;
    }

    @Override
    public Optional<String> evaluate(Transaction transaction) {
        return check.apply(transaction);
    }

    @Override
    public String toString() {
        return id + "(" + category.getCode() + ", " + severity + ")";
    }
}
