package com.lyshra.open.flow.core.engine.store.artifact;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Contents of an artifact's {@code .artifact.json}. An artifact whose metadata is not
 * committed is incomplete and ignored by readers.
 */
@Data
@Builder(toBuilder = true)
public class ArtifactMetadata {

    private final String name;
    private final String namespace;
    private final String valueType;
    private final String serializer;
    private final boolean committed;
    private final Instant createdAt;
    private final Instant updatedAt;
    @Singular
    private final List<String> files;
    @Singular("attribute")
    private final Map<String, Object> attributes;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("namespace", namespace);
        map.put("value_type", valueType);
        map.put("serializer", serializer);
        map.put("committed", committed);
        map.put("created_at", createdAt == null ? null : createdAt.toString());
        map.put("updated_at", updatedAt == null ? null : updatedAt.toString());
        map.put("files", files);
        if (!attributes.isEmpty()) {
            map.put("attributes", attributes);
        }
        return map;
    }

    @SuppressWarnings("unchecked")
    public static ArtifactMetadata fromMap(Map<String, Object> map) {
        String createdAt = (String) map.get("created_at");
        String updatedAt = (String) map.get("updated_at");
        List<String> files = (List<String>) map.getOrDefault("files", List.of());
        Map<String, Object> attributes = (Map<String, Object>) map.getOrDefault("attributes", Map.of());
        return ArtifactMetadata.builder()
                .name((String) map.get("name"))
                .namespace((String) map.get("namespace"))
                .valueType((String) map.get("value_type"))
                .serializer((String) map.get("serializer"))
                .committed(Boolean.TRUE.equals(map.get("committed")))
                .createdAt(createdAt == null ? null : Instant.parse(createdAt))
                .updatedAt(updatedAt == null ? null : Instant.parse(updatedAt))
                .files(new ArrayList<>(files))
                .attributes(new LinkedHashMap<>(attributes))
                .build();
    }
}
