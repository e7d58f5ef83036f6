package com.e2eq.odata;

import com.e2eq.odata.memory.InMemoryDataEngine;
import com.e2eq.odata.memory.InMemoryMetadataRegistry;
import com.e2eq.odata.spi.FieldMetadata;
import com.e2eq.odata.spi.ObjectMetadata;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Companies, Customers, Orders and Products with a few records each.
 */
public final class SampleCatalog {

    private SampleCatalog() {
    }

    public static InMemoryMetadataRegistry registry() {
        return new InMemoryMetadataRegistry()
                .register(object("Companies")
                        .addField(field("name", "text"))
                        .addField(lookup("parent", "Companies")))
                .register(object("Customers")
                        .addField(field("name", "text"))
                        .addField(field("email", "email"))
                        .addField(lookup("company", "Companies")))
                .register(object("Orders")
                        .addField(field("number", "text"))
                        .addField(field("amount", "currency"))
                        .addField(lookup("customer", "Customers"))
                        .addField(field("status", "select")))
                .register(object("Products")
                        .addField(field("name", "text"))
                        .addField(field("price", "number"))
                        .addField(field("active", "boolean"))
                        .addField(field("category", "select")));
    }

    public static InMemoryDataEngine seed(InMemoryDataEngine engine) {
        engine.create("Companies", record("_id", "co1", "name", "Acme Holdings", "parent", "co2"));
        engine.create("Companies", record("_id", "co2", "name", "Acme Group", "parent", "co3"));
        engine.create("Companies", record("_id", "co3", "name", "Acme Global", "parent", null));

        engine.create("Customers", record("_id", "c1", "name", "Alice", "email", "alice@example.com", "company", "co1"));
        engine.create("Customers", record("_id", "c2", "name", "Bob", "email", "bob@example.org", "company", "co2"));

        engine.create("Orders", record("_id", "o1", "number", "SO-1", "amount", 120.5, "customer", "c1", "status", "open"));
        engine.create("Orders", record("_id", "o2", "number", "SO-2", "amount", 80, "customer", "c2", "status", "closed"));
        engine.create("Orders", record("_id", "o3", "number", "SO-3", "amount", 300, "customer", "c1", "status", "open"));
        engine.create("Orders", record("_id", "o4", "number", "SO-4", "amount", 15, "customer", null, "status", "draft"));

        engine.create("Products", record("_id", "p1", "name", "Widget", "price", 25, "active", true, "category", "tools"));
        engine.create("Products", record("_id", "p2", "name", "Gadget", "price", 150, "active", true, "category", "tools"));
        engine.create("Products", record("_id", "p3", "name", "Doohickey", "price", 99.99, "active", false, "category", "misc"));
        engine.create("Products", record("_id", "p4", "name", "Gizmo", "price", null, "active", true, "category", "misc"));
        return engine;
    }

    public static Map<String, Object> record(Object... keyValues) {
        Map<String, Object> record = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            record.put((String) keyValues[i], keyValues[i + 1]);
        }
        return record;
    }

    public static ObjectMetadata object(String name) {
        return ObjectMetadata.builder().name(name).label(name).build();
    }

    public static FieldMetadata field(String name, String type) {
        return FieldMetadata.builder().name(name).type(type).build();
    }

    public static FieldMetadata lookup(String name, String reference) {
        return FieldMetadata.builder().name(name).type(FieldMetadata.TYPE_LOOKUP).reference(reference).build();
    }
}
