package io.github.cyfko.filtergate.jpa;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SqlCondition Tests")
class SqlConditionTest {

    private static final SqlCondition ADULT = SqlCondition.of("age >= ?", 18);
    private static final SqlCondition ACTIVE = SqlCondition.of("status = ?", "active");

    @Test
    @DisplayName("Conjunction wraps each operand and keeps parameter order")
    void and() {
        SqlCondition both = ADULT.and(ACTIVE.not());

        assertEquals("(age >= ?) AND (NOT (status = ?))", both.sql());
        assertEquals(List.of(18, "active"), both.params());
    }

    @Test
    @DisplayName("Complement keeps rows where the condition is NULL")
    void complement() {
        SqlCondition notAdult = ADULT.complement();

        assertEquals("(age >= ?) IS NOT TRUE", notAdult.sql());
        assertEquals(List.of(18), notAdult.params());
    }

    @Test
    @DisplayName("A single operand is returned as is")
    void singleOperand() {
        assertSame(ADULT, SqlCondition.allOf(List.of(ADULT)));
        assertSame(ACTIVE, SqlCondition.anyOf(List.of(ACTIVE)));
    }

    @Test
    @DisplayName("Disjunction of three operands")
    void anyOf() {
        SqlCondition any = SqlCondition.anyOf(List.of(ADULT, ACTIVE, SqlCondition.TRUE));

        assertEquals("(age >= ?) OR (status = ?) OR (1 = 1)", any.sql());
        assertEquals(2, any.params().size());
    }

    @Test
    @DisplayName("Placeholders must match parameters, ignoring quoted question marks")
    void placeholderCount() {
        assertThrows(IllegalArgumentException.class, () -> SqlCondition.of("a = ? AND b = ?", 1));
        assertDoesNotThrow(() -> SqlCondition.of("a = ? AND b = '?'", 1));
        assertEquals(0, SqlCondition.placeholderCount("note = 'why?'"));
    }

    @Test
    @DisplayName("Parameters are copied and immutable")
    void immutable() {
        List<Object> params = new ArrayList<>(List.of(1));
        SqlCondition condition = new SqlCondition("a = ?", params);

        params.add(2);

        assertEquals(List.of(1), condition.params());
        assertThrows(UnsupportedOperationException.class, () -> condition.params().add(3));
    }

    @Test
    @DisplayName("Null parameters are allowed")
    void nullParameter() {
        SqlCondition condition = SqlCondition.of("a = ?", (Object) null);

        assertNull(condition.params().get(0));
    }
}
