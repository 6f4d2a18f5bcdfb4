package com.lyshra.open.flow.core.engine.store.artifact;

import com.lyshra.open.flow.integration.constant.LyshraOpenFlowConstants;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Scoped write to one artifact. Files go to a private staging directory; {@link #commit()}
 * moves them into the artifact and then replaces the metadata, so the previous committed
 * artifact stays readable until the new one lands. Closing an uncommitted session discards the
 * staged files; an artifact that was never committed is left flagged uncommitted.
 *
 * <p>The session holds the artifact's write lock until it is committed or closed.</p>
 */
@Slf4j
public class ArtifactWriteSession implements AutoCloseable {

    private final FileSystemArtifactRepository repository;
    private final Path directory;
    private final Path stagingDir;
    private final String namespace;
    private final String name;
    private final Instant createdAt;
    private final Runnable release;
    private final Set<String> files = new LinkedHashSet<>();
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private String valueType;
    private String serializer;
    private boolean committed;
    private boolean closed;

    ArtifactWriteSession(FileSystemArtifactRepository repository, Path directory, Path stagingDir, String namespace,
                         String name, Instant createdAt, Runnable release) {
        this.repository = repository;
        this.directory = directory;
        this.stagingDir = stagingDir;
        this.namespace = namespace;
        this.name = name;
        this.createdAt = createdAt;
        this.release = release;
    }

    public ArtifactWriteSession writeFile(String fileName, byte[] content) {
        ensureOpen();
        FileSystemArtifactRepository.requireValidFileName(fileName);
        Path staged = stagingDir.resolve(fileName);
        try {
            Files.write(staged, content);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write artifact file " + staged, e);
        }
        files.add(fileName);
        return this;
    }

    public ArtifactWriteSession valueType(String valueType) {
        this.valueType = valueType;
        return this;
    }

    public ArtifactWriteSession serializer(String serializer) {
        this.serializer = serializer;
        return this;
    }

    public ArtifactWriteSession attribute(String key, Object value) {
        attributes.put(key, value);
        return this;
    }

    public ArtifactMetadata commit() {
        ensureOpen();
        try {
            for (String file : files) {
                FileSystemArtifactRepository.moveReplacing(stagingDir.resolve(file), directory.resolve(file));
            }
            ArtifactMetadata metadata = metadata(true);
            repository.writeMetadata(directory, metadata);
            committed = true;
            log.debug("Committed artifact [{}/{}] with files {}", namespace, name, files);
            return metadata;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to commit artifact " + namespace + "/" + name, e);
        } finally {
            finish();
        }
    }

    public boolean isCommitted() {
        return committed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        try {
            if (!Files.exists(directory.resolve(LyshraOpenFlowConstants.ARTIFACT_METADATA_FILE))) {
                repository.writeMetadata(directory, metadata(false));
            }
            log.warn("Artifact [{}/{}] abandoned before commit; staged files discarded", namespace, name);
        } finally {
            finish();
        }
    }

    private void finish() {
        closed = true;
        try {
            repository.deleteRecursively(stagingDir);
        } finally {
            release.run();
        }
    }

    private ArtifactMetadata metadata(boolean committedFlag) {
        return ArtifactMetadata.builder()
                .name(name)
                .namespace(namespace)
                .valueType(valueType)
                .serializer(serializer)
                .committed(committedFlag)
                .createdAt(createdAt)
                .updatedAt(Instant.now())
                .files(files)
                .attributes(attributes)
                .build();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("artifact write session for [" + namespace + "/" + name + "] is closed");
        }
    }
}
