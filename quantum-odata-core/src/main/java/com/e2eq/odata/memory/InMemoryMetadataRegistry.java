package com.e2eq.odata.memory;

import com.e2eq.odata.spi.MetadataRegistry;
import com.e2eq.odata.spi.ObjectMetadata;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Metadata registry backed by a map. Types are listed in registration order.
 */
public class InMemoryMetadataRegistry implements MetadataRegistry {
    private final Map<String, ObjectMetadata> types = new ConcurrentHashMap<>();
    private final List<String> order = new CopyOnWriteArrayList<>();

    public InMemoryMetadataRegistry register(ObjectMetadata metadata) {
        if (metadata == null || metadata.getName() == null) {
            throw new IllegalArgumentException("Object metadata must have a name");
        }
        if (types.put(metadata.getName(), metadata) == null) {
            order.add(metadata.getName());
        }
        return this;
    }

    @Override
    public List<String> listObjectTypes() {
        return new ArrayList<>(order);
    }

    @Override
    public Optional<ObjectMetadata> getObjectMetadata(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(types.get(name));
    }
}
