package io.github.cyfko.filtergate.jpa;

import io.github.cyfko.filtergate.core.model.FieldCatalog;
import io.github.cyfko.filtergate.core.model.FieldDescriptor;
import io.github.cyfko.filtergate.core.model.FieldKind;
import io.github.cyfko.filtergate.core.model.FieldType;

/**
 * Catalog shared by the relational adapter tests.
 */
public final class SqlTestCatalogs {

    private SqlTestCatalogs() {
    }

    /**
     * {@code products}: name, price (decimal), stock (integer), released (date),
     * updatedAt (datetime, column {@code updated_at}), tags (string[]), sizes (integer[]),
     * attributes (json), warehouse (geo) and vendorName through the {@code vendor} association.
     */
    public static FieldCatalog products() {
        return FieldCatalog.builder("products")
                .field(FieldDescriptor.of("name", FieldType.scalar(FieldKind.STRING)))
                .field(FieldDescriptor.of("price", FieldType.scalar(FieldKind.DECIMAL)))
                .field(FieldDescriptor.of("stock", FieldType.scalar(FieldKind.INTEGER)))
                .field(FieldDescriptor.of("released", FieldType.scalar(FieldKind.DATE)))
                .field(FieldDescriptor.builder("updatedAt", FieldType.scalar(FieldKind.DATETIME))
                        .column("updated_at").build())
                .field(FieldDescriptor.of("tags", FieldType.array(FieldKind.STRING)))
                .field(FieldDescriptor.of("sizes", FieldType.array(FieldKind.INTEGER)))
                .field(FieldDescriptor.of("attributes", FieldType.json()))
                .field(FieldDescriptor.of("warehouse", FieldType.geo()))
                .field(FieldDescriptor.builder("vendorName", FieldType.scalar(FieldKind.STRING))
                        .association("vendor").column("name").build())
                .build();
    }
}
