package io.github.cyfko.filtergate.core;

import io.github.cyfko.filtergate.core.model.EnumDefinition;
import io.github.cyfko.filtergate.core.model.FieldCatalog;
import io.github.cyfko.filtergate.core.model.FieldDescriptor;
import io.github.cyfko.filtergate.core.model.FieldKind;
import io.github.cyfko.filtergate.core.model.FieldType;

import java.util.Map;

/**
 * Catalogs shared by the core tests.
 */
public final class TestCatalogs {

    private TestCatalogs() {
    }

    /**
     * {@code users}: id, name, age, score (decimal), active, birthday (date), tags (string[]),
     * status (enum, external lower-case), roles (enum[]), meta (json), location (geo),
     * authorName (through the {@code author} association) and a custom {@code fullText} field.
     */
    public static FieldCatalog users() {
        return FieldCatalog.builder("users")
                .enumDefinition(new EnumDefinition("Status", Map.of("active", "ACTIVE", "inactive", "INACTIVE")))
                .enumDefinition(EnumDefinition.identity("Role", "ADMIN", "EDITOR", "VIEWER"))
                .field(FieldDescriptor.of("id", FieldType.scalar(FieldKind.ID)))
                .field(FieldDescriptor.of("name", FieldType.scalar(FieldKind.STRING)))
                .field(FieldDescriptor.of("age", FieldType.scalar(FieldKind.INTEGER)))
                .field(FieldDescriptor.of("score", FieldType.scalar(FieldKind.DECIMAL)))
                .field(FieldDescriptor.of("active", FieldType.scalar(FieldKind.BOOLEAN)))
                .field(FieldDescriptor.of("birthday", FieldType.scalar(FieldKind.DATE)))
                .field(FieldDescriptor.of("tags", FieldType.array(FieldKind.STRING)))
                .field(FieldDescriptor.of("status", FieldType.enumType("Status")))
                .field(FieldDescriptor.of("roles", FieldType.arrayOfEnum("Role")))
                .field(FieldDescriptor.of("meta", FieldType.json()))
                .field(FieldDescriptor.of("location", FieldType.geo()))
                .field(FieldDescriptor.builder("authorName", FieldType.scalar(FieldKind.STRING))
                        .association("author").column("name").build())
                .field(FieldDescriptor.custom("fullText", FieldType.scalar(FieldKind.STRING)))
                .build();
    }
}
