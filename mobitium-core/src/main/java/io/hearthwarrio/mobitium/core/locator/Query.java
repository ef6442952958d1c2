package io.hearthwarrio.mobitium.core.locator;

import java.util.Objects;

/**
 * One concrete element query: a strategy plus the expression for it.
 */
public final class Query {

    private final QueryStrategy strategy;
    private final String expression;

    public Query(QueryStrategy strategy, String expression) {
        this.strategy = Objects.requireNonNull(strategy, "strategy must not be null");
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
    }

    public QueryStrategy getStrategy() {
        return strategy;
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Query)) {
            return false;
        }
        Query other = (Query) o;
        return strategy == other.strategy && expression.equals(other.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(strategy, expression);
    }

    @Override
    public String toString() {
        return strategy.using() + ": " + expression;
    }
}
