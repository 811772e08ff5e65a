package io.github.cyfko.filtergate.elasticsearch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.cyfko.filtergate.core.api.ArrayOperator;
import io.github.cyfko.filtergate.core.api.FilterExpression;
import io.github.cyfko.filtergate.core.api.GeoOperator;
import io.github.cyfko.filtergate.core.api.Operator;
import io.github.cyfko.filtergate.core.api.ScalarOperator;
import io.github.cyfko.filtergate.core.capability.CapabilityRegistry;
import io.github.cyfko.filtergate.core.capability.ConnectionDescriptor;
import io.github.cyfko.filtergate.core.capability.Feature;
import io.github.cyfko.filtergate.core.compile.QueryBuilder;
import io.github.cyfko.filtergate.core.complexity.QueryWindow;
import io.github.cyfko.filtergate.core.complexity.SortField;
import io.github.cyfko.filtergate.core.exception.MissingCapabilityException;
import io.github.cyfko.filtergate.core.exception.UnsupportedOperatorException;
import io.github.cyfko.filtergate.core.model.AuthorizedFieldSet;
import io.github.cyfko.filtergate.core.model.FieldCatalog;
import io.github.cyfko.filtergate.core.model.FieldDescriptor;
import io.github.cyfko.filtergate.core.model.FieldKind;
import io.github.cyfko.filtergate.core.model.FieldType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ElasticsearchAdapter Tests")
class ElasticsearchAdapterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ElasticsearchAdapter adapter = new ElasticsearchAdapter();
    private final QueryBuilder builder = new QueryBuilder();
    private final FieldCatalog catalog = FieldCatalog.builder("articles")
            .field(FieldDescriptor.of("title", FieldType.scalar(FieldKind.STRING)))
            .field(FieldDescriptor.of("views", FieldType.scalar(FieldKind.INTEGER)))
            .field(FieldDescriptor.of("tags", FieldType.array(FieldKind.STRING)))
            .field(FieldDescriptor.of("location", FieldType.geo()))
            .field(FieldDescriptor.builder("authorName", FieldType.scalar(FieldKind.STRING))
                    .association("author").column("name").build())
            .build();

    private ObjectNode compile(FilterExpression expression) {
        return builder.compile(expression, catalog, AuthorizedFieldSet.all(), adapter);
    }

    private ObjectNode compile(String field, Operator operator, Object value) {
        return compile(FilterExpression.leaf(field, operator, value));
    }

    private static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text.replace('\'', '"'));
        } catch (Exception e) {
            throw new IllegalArgumentException(text, e);
        }
    }

    // ============================================================================
    // Scalar operators
    // ============================================================================

    @Nested
    @DisplayName("Scalar operators")
    class Scalars {

        @Test
        @DisplayName("Equality and ranges")
        void termsAndRanges() {
            assertEquals(json("{'term': {'title': 'Intro'}}"), compile("title", ScalarOperator.EQ, "Intro"));
            assertEquals(json("{'range': {'views': {'gte': 100}}}"), compile("views", ScalarOperator.GTE, 100));
            assertEquals(json("{'terms': {'views': [1, 2]}}"), compile("views", ScalarOperator.IN, List.of(1, 2)));
        }

        @Test
        @DisplayName("Negative operators require the field to exist")
        void negatives() {
            assertEquals(json("{'bool': {'must': [{'exists': {'field': 'title'}}],"
                            + " 'must_not': [{'term': {'title': 'Intro'}}]}}"),
                    compile("title", ScalarOperator.NEQ, "Intro"));
        }

        @Test
        @DisplayName("Null checks use exists")
        void nullChecks() {
            assertEquals(json("{'bool': {'must_not': [{'exists': {'field': 'title'}}]}}"),
                    compile("title", ScalarOperator.IS_NULL, true));
            assertEquals(json("{'exists': {'field': 'title'}}"), compile("title", ScalarOperator.IS_NULL, false));
        }

        @Test
        @DisplayName("Patterns become wildcard and prefix queries")
        void patterns() {
            assertEquals(json("{'wildcard': {'title': {'value': 'a*b?c'}}}"),
                    compile("title", ScalarOperator.LIKE, "a%b_c"));
            assertEquals(json("{'wildcard': {'title': {'value': '*x\\\\*y*', 'case_insensitive': true}}}"),
                    compile("title", ScalarOperator.ICONTAINS, "x*y"));
            assertEquals(json("{'prefix': {'title': {'value': 'Int'}}}"),
                    compile("title", ScalarOperator.STARTS_WITH, "Int"));
        }

        @Test
        @DisplayName("Search and fuzzy matching")
        void textSearch() {
            assertEquals(json("{'match': {'title': {'query': 'filter gate'}}}"),
                    compile("title", ScalarOperator.SEARCH, "filter gate"));
            assertEquals(json("{'fuzzy': {'title': {'value': 'gaet', 'fuzziness': 'AUTO'}}}"),
                    compile("title", ScalarOperator.FUZZY, "gaet"));
        }

        @Test
        @DisplayName("Similarity is not offered")
        void noSimilarity() {
            assertThrows(UnsupportedOperatorException.class, () -> compile("title", ScalarOperator.SIMILAR, "x"));
        }

        @Test
        @DisplayName("Associated fields use their dotted path")
        void associatedField() {
            assertEquals(json("{'term': {'author.name': 'Ada'}}"), compile("authorName", ScalarOperator.EQ, "Ada"));
        }
    }

    // ============================================================================
    // Array and geo operators
    // ============================================================================

    @Nested
    @DisplayName("Array and geo operators")
    class ArraysAndGeo {

        @Test
        @DisplayName("Containment of every element is a conjunction of terms")
        void includesAll() {
            assertEquals(json("{'bool': {'must': [{'term': {'tags': 'a'}}, {'term': {'tags': 'b'}}]}}"),
                    compile("tags", ArrayOperator.INCLUDES_ALL, List.of("a", "b")));
            assertEquals(json("{'bool': {'must_not': [{'terms': {'tags': ['a', 'b']}}]}}"),
                    compile("tags", ArrayOperator.EXCLUDES_ALL, List.of("a", "b")));
        }

        @Test
        @DisplayName("Empty and missing arrays are the same")
        void emptiness() {
            assertEquals(compile("tags", ArrayOperator.IS_NULL, true), compile("tags", ArrayOperator.IS_EMPTY, true));
        }

        @Test
        @DisplayName("Distance filters use geo_distance in meters")
        void geo() {
            assertEquals(json("{'geo_distance': {'distance': '250.0m', 'location': {'lat': 48.85, 'lon': 2.35}}}"),
                    compile("location", GeoOperator.ST_DWITHIN, Map.of("lat", 48.85, "lon", 2.35, "distance", 250)));
        }
    }

    // ============================================================================
    // Structure
    // ============================================================================

    @Test
    @DisplayName("Combinators become bool queries")
    void combinators() {
        // Given
        FilterExpression expression = FilterExpression.and(
                FilterExpression.leaf("views", ScalarOperator.GT, 10),
                FilterExpression.or(
                        FilterExpression.leaf("title", ScalarOperator.EQ, "A"),
                        FilterExpression.leaf("title", ScalarOperator.EQ, "B")));

        // When
        ObjectNode query = compile(expression);

        // Then
        assertEquals(json("{'bool': {'must': [{'range': {'views': {'gt': 10}}},"
                + " {'bool': {'should': [{'term': {'title': 'A'}}, {'term': {'title': 'B'}}],"
                + " 'minimum_should_match': 1}}]}}"), query);
        assertEquals(json("{'match_none': {}}"), compile(new FilterExpression.Or(List.of())));
        assertEquals(json("{'match_all': {}}"), compile(new FilterExpression.And(List.of())));
    }

    @Test
    @DisplayName("Search bodies carry paging and sort")
    void searchBody() {
        // Given
        ObjectNode query = compile("views", ScalarOperator.GT, 10);

        // When
        ObjectNode body = adapter.toSearchBody(query, QueryWindow.of(20, 40, SortField.desc("views")));
        ObjectNode unbounded = adapter.toSearchBody(query, QueryWindow.unbounded());

        // Then
        assertEquals(json("{'query': {'range': {'views': {'gt': 10}}}, 'from': 40, 'size': 20,"
                + " 'sort': [{'views': {'order': 'desc'}}]}"), body);
        assertFalse(unbounded.has("size"));
        assertFalse(unbounded.has("from"));
    }

    @Test
    @DisplayName("Like patterns escape wildcard metacharacters")
    void fromLike() {
        assertEquals("100\\*\\?*", ElasticsearchAdapter.fromLike("100*?%"));
        assertEquals("a\\\\b", ElasticsearchAdapter.escapeWildcard("a\\b"));
    }

    @Test
    @DisplayName("The registration routes search connectors without probing")
    void registration() {
        // Given
        CapabilityRegistry registry = new CapabilityRegistry(new ConcurrentHashMap<>(), null);
        registry.register(ElasticsearchAdapter.registration());

        // When
        Object selected = registry.select(ConnectionDescriptor.unprobed("search", "opensearch"));

        // Then
        ElasticsearchAdapter es = assertInstanceOf(ElasticsearchAdapter.class, selected);
        assertEquals(ElasticsearchAdapter.MAX_TERMS, es.capabilities().maxInItems());
        assertThrows(MissingCapabilityException.class, () -> es.capabilities().require(Feature.QUERY_EXPLAIN));
    }
}
