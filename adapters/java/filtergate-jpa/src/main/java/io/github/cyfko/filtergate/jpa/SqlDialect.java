package io.github.cyfko.filtergate.jpa;

/**
 * SQL syntax differences between the supported relational backends.
 *
 * @since 1.0.0
 */
public enum SqlDialect {
    POSTGRESQL("EXPLAIN (FORMAT JSON) "),
    MYSQL("EXPLAIN FORMAT=JSON "),
    SQLITE("EXPLAIN QUERY PLAN ");

    private final String explainPrefix;

    SqlDialect(String explainPrefix) {
        this.explainPrefix = explainPrefix;
    }

    public String explainPrefix() {
        return explainPrefix;
    }

    /**
     * Renders the limit/offset clause, or an empty string when neither is set.
     * MySQL and SQLite do not accept an OFFSET without a LIMIT.
     *
     * @param limit  row limit, {@code null} for none
     * @param offset rows skipped
     * @return the clause with a leading space, or {@code ""}
     */
    public String limitClause(Integer limit, int offset) {
        StringBuilder sb = new StringBuilder();
        if (limit != null) {
            sb.append(" LIMIT ").append(limit);
        } else if (offset > 0) {
            switch (this) {
                case MYSQL -> sb.append(" LIMIT 18446744073709551615");
                case SQLITE -> sb.append(" LIMIT -1");
                case POSTGRESQL -> {
                    // PostgreSQL accepts OFFSET alone
                }
            }
        }
        if (offset > 0) {
            sb.append(" OFFSET ").append(offset);
        }
        return sb.toString();
    }
}
