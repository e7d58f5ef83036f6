package com.e2eq.odata.spi;

import java.util.List;
import java.util.Optional;

/**
 * Source of object type metadata. Drives EDMX generation, entity set resolution and relationship
 * detection during {@code $expand}.
 */
public interface MetadataRegistry {
    List<String> listObjectTypes();

    Optional<ObjectMetadata> getObjectMetadata(String name);

    default boolean isKnownType(String name) {
        return getObjectMetadata(name).isPresent();
    }
}
