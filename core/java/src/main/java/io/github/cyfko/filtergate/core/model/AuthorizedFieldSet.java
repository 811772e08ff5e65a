package io.github.cyfko.filtergate.core.model;

import java.util.Objects;
import java.util.Set;

/**
 * Fields a caller may filter on, as resolved by the authorization layer for one request.
 * <p>
 * Either the sentinel {@link #all()} or an explicit set of field names.
 * </p>
 *
 * @since 1.0.0
 */
public sealed interface AuthorizedFieldSet permits AuthorizedFieldSet.All, AuthorizedFieldSet.Only {

    boolean permits(String field);

    static AuthorizedFieldSet all() {
        return All.INSTANCE;
    }

    static AuthorizedFieldSet only(Set<String> fields) {
        return new Only(fields);
    }

    static AuthorizedFieldSet only(String... fields) {
        return new Only(Set.of(fields));
    }

    final class All implements AuthorizedFieldSet {
        private static final All INSTANCE = new All();

        private All() {
        }

        @Override
        public boolean permits(String field) {
            return true;
        }

        @Override
        public String toString() {
            return "AuthorizedFieldSet[all]";
        }
    }

    record Only(Set<String> fields) implements AuthorizedFieldSet {
        public Only {
            fields = Set.copyOf(Objects.requireNonNull(fields, "fields"));
        }

        @Override
        public boolean permits(String field) {
            return fields.contains(field);
        }
    }
}
