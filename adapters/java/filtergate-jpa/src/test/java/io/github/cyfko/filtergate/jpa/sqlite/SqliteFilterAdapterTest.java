package io.github.cyfko.filtergate.jpa.sqlite;

import io.github.cyfko.filtergate.core.api.ArrayOperator;
import io.github.cyfko.filtergate.core.api.FilterExpression;
import io.github.cyfko.filtergate.core.api.GeoOperator;
import io.github.cyfko.filtergate.core.api.JsonOperator;
import io.github.cyfko.filtergate.core.api.Operator;
import io.github.cyfko.filtergate.core.api.ScalarOperator;
import io.github.cyfko.filtergate.core.compile.QueryBuilder;
import io.github.cyfko.filtergate.core.exception.UnsupportedOperatorException;
import io.github.cyfko.filtergate.core.model.AuthorizedFieldSet;
import io.github.cyfko.filtergate.core.model.FieldCatalog;
import io.github.cyfko.filtergate.jpa.DatabaseVersion;
import io.github.cyfko.filtergate.jpa.SqlCondition;
import io.github.cyfko.filtergate.jpa.SqlDialect;
import io.github.cyfko.filtergate.jpa.SqlTestCatalogs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SqliteFilterAdapter Tests")
class SqliteFilterAdapterTest {

    private final QueryBuilder builder = new QueryBuilder();
    private final FieldCatalog catalog = SqlTestCatalogs.products();
    private final SqliteFilterAdapter adapter = new SqliteFilterAdapter(
            SqliteCapabilityDetector.capabilities(DatabaseVersion.parse("3.45.1"), true, true, true));

    private SqlCondition compile(SqliteFilterAdapter target, String field, Operator operator, Object value) {
        return builder.compile(FilterExpression.leaf(field, operator, value), catalog, AuthorizedFieldSet.all(), target);
    }

    private SqlCondition compile(String field, Operator operator, Object value) {
        return compile(adapter, field, operator, value);
    }

    @Test
    @DisplayName("Identity and dialect")
    void identity() {
        assertEquals("sqlite", adapter.id());
        assertEquals(SqlDialect.SQLITE, adapter.dialect());
    }

    @Test
    @DisplayName("Scalar operators use the shared rendering")
    void scalars() {
        assertEquals(SqlCondition.of("price > ?", new BigDecimal("5")), compile("price", ScalarOperator.GT, 5));
        assertEquals(SqlCondition.of("LOWER(name) NOT LIKE LOWER(?)", "%x%"),
                compile("name", ScalarOperator.NILIKE, "%x%"));
    }

    @Test
    @DisplayName("Element membership queries json_each with a typed parameter")
    void membership() {
        assertEquals(SqlCondition.of("EXISTS (SELECT 1 FROM json_each(tags) WHERE json_each.value = ?)", "sale"),
                compile("tags", ArrayOperator.INCLUDES, "sale"));
        assertEquals(SqlCondition.of("NOT EXISTS (SELECT 1 FROM json_each(sizes) WHERE json_each.value = ?)", 40L),
                compile("sizes", ArrayOperator.EXCLUDES, 40));
    }

    @Test
    @DisplayName("Emptiness and nullity")
    void emptiness() {
        assertEquals(SqlCondition.of("COALESCE(json_array_length(tags), 0) = 0"),
                compile("tags", ArrayOperator.IS_EMPTY, true));
        assertEquals(SqlCondition.of("tags IS NULL"), compile("tags", ArrayOperator.IS_NULL, true));
    }

    @Test
    @DisplayName("Multi-element, document, search and geo operators are not offered")
    void unsupported() {
        assertThrows(UnsupportedOperatorException.class,
                () -> compile("tags", ArrayOperator.INCLUDES_ANY, List.of("a")));
        assertThrows(UnsupportedOperatorException.class,
                () -> compile("attributes", JsonOperator.HAS_KEY, "size"));
        assertThrows(UnsupportedOperatorException.class,
                () -> compile("name", ScalarOperator.SEARCH, "shoe"));
        assertThrows(UnsupportedOperatorException.class,
                () -> compile("warehouse", GeoOperator.ST_DWITHIN, Map.of("lat", 1, "lon", 2, "distance", 3)));
    }

    @Test
    @DisplayName("Without JSON1 only nullity is offered on arrays")
    void withoutJson1() {
        SqliteFilterAdapter bare = new SqliteFilterAdapter(
                SqliteCapabilityDetector.capabilities(DatabaseVersion.UNKNOWN, false, false, false));

        assertThrows(UnsupportedOperatorException.class, () -> compile(bare, "tags", ArrayOperator.INCLUDES, "a"));
        assertEquals(SqlCondition.of("tags IS NOT NULL"), compile(bare, "tags", ArrayOperator.IS_NULL, false));
    }
}
