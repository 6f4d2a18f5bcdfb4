package com.lyshra.open.flow.core.engine.store.artifact;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.lyshra.open.flow.integration.constant.LyshraOpenFlowConstants;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Durable, namespace-scoped artifact storage on the local file system.
 *
 * <h2>Storage Structure</h2>
 * <pre>
 * {baseDir}/
 *   └── {namespace}/
 *       └── {artifact}/
 *           ├── .artifact.json
 *           ├── .session-{id}/      (files of a write session before commit)
 *           └── value.bin
 * </pre>
 *
 * <h2>Locking</h2>
 * <p>Each artifact owns a read/write lock. A write session holds the write side from
 * {@link #openSession} until it is committed or closed; readers take the read side, so they see
 * either the previous committed artifact or the new one, never a mix. Each namespace also owns a
 * read/write lock: every per-artifact operation shares its read side and {@link #clear} takes
 * the write side.</p>
 */
@Slf4j
public class FileSystemArtifactRepository {

    private static final Pattern NAME_PATTERN = Pattern.compile(LyshraOpenFlowConstants.ARTIFACT_NAME_PATTERN);
    private static final Pattern FILE_NAME_PATTERN = Pattern.compile("[A-Za-z0-9_.-]+");
    private static final String SESSION_DIR_PREFIX = ".session-";

    @Getter
    private final Path baseDir;
    private final ObjectMapper objectMapper;
    private final Map<String, ReadWriteLock> namespaceLocks = new ConcurrentHashMap<>();
    private final Map<String, ReadWriteLock> artifactLocks = new ConcurrentHashMap<>();

    public FileSystemArtifactRepository(Path baseDir) {
        this.baseDir = baseDir;
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /** Metadata and one file of a committed artifact, read under the same lock. */
    public record CommittedFile(ArtifactMetadata metadata, byte[] content) {
    }

    /**
     * Runs {@code body} in a write session, committing when it returns normally and abandoning
     * the session when it throws.
     */
    public ArtifactMetadata write(String namespace, String name, Consumer<ArtifactWriteSession> body) {
        try (ArtifactWriteSession session = openSession(namespace, name)) {
            body.accept(session);
            return session.commit();
        }
    }

    /**
     * Opens a write session holding the artifact's write lock until the session is committed or
     * closed. The session must be closed by the thread that opened it.
     */
    public ArtifactWriteSession openSession(String namespace, String name) {
        requireValidName("namespace", namespace);
        requireValidName("artifact name", name);
        Lock namespaceLock = namespaceLock(namespace).readLock();
        Lock artifactLock = artifactLock(namespace, name).writeLock();
        namespaceLock.lock();
        artifactLock.lock();
        try {
            Path directory = artifactDir(namespace, name);
            Instant createdAt = loadMetadata(namespace, name)
                    .map(ArtifactMetadata::getCreatedAt)
                    .orElseGet(Instant::now);
            Path stagingDir = directory.resolve(SESSION_DIR_PREFIX + UUID.randomUUID());
            Files.createDirectories(stagingDir);
            return new ArtifactWriteSession(this, directory, stagingDir, namespace, name, createdAt, () -> {
                artifactLock.unlock();
                namespaceLock.unlock();
            });
        } catch (IOException e) {
            artifactLock.unlock();
            namespaceLock.unlock();
            throw new UncheckedIOException("Failed to open write session for artifact " + namespace + "/" + name, e);
        } catch (RuntimeException e) {
            artifactLock.unlock();
            namespaceLock.unlock();
            throw e;
        }
    }

    public Optional<ArtifactMetadata> readMetadata(String namespace, String name) {
        requireValidName("namespace", namespace);
        requireValidName("artifact name", name);
        return shared(namespace, name, () -> loadMetadata(namespace, name));
    }

    /** Metadata of the artifact when it exists and was committed. */
    public Optional<ArtifactMetadata> findCommitted(String namespace, String name) {
        requireValidName("namespace", namespace);
        requireValidName("artifact name", name);
        return shared(namespace, name, () -> loadCommitted(namespace, name));
    }

    /** The committed metadata together with {@code fileName}, or empty when nothing is committed. */
    public Optional<CommittedFile> readCommittedFile(String namespace, String name, String fileName) {
        requireValidName("namespace", namespace);
        requireValidName("artifact name", name);
        requireValidFileName(fileName);
        return shared(namespace, name, () -> loadCommitted(namespace, name)
                .map(metadata -> new CommittedFile(metadata, loadFile(namespace, name, fileName))));
    }

    public byte[] readFile(String namespace, String name, String fileName) {
        requireValidName("namespace", namespace);
        requireValidName("artifact name", name);
        requireValidFileName(fileName);
        return shared(namespace, name, () -> loadFile(namespace, name, fileName));
    }

    public boolean delete(String namespace, String name) {
        requireValidName("namespace", namespace);
        requireValidName("artifact name", name);
        Lock namespaceLock = namespaceLock(namespace).readLock();
        Lock artifactLock = artifactLock(namespace, name).writeLock();
        namespaceLock.lock();
        artifactLock.lock();
        try {
            return deleteRecursively(artifactDir(namespace, name));
        } finally {
            artifactLock.unlock();
            namespaceLock.unlock();
        }
    }

    /** Names of committed artifacts in the namespace, sorted. */
    public List<String> list(String namespace) {
        requireValidName("namespace", namespace);
        Lock namespaceLock = namespaceLock(namespace).readLock();
        namespaceLock.lock();
        try {
            return committedNames(namespace, true);
        } finally {
            namespaceLock.unlock();
        }
    }

    /** Deletes every artifact in the namespace; returns how many committed artifacts were removed. */
    public int clear(String namespace) {
        requireValidName("namespace", namespace);
        Lock namespaceLock = namespaceLock(namespace).writeLock();
        namespaceLock.lock();
        try {
            List<String> committed = committedNames(namespace, false);
            deleteRecursively(baseDir.resolve(namespace));
            log.debug("Cleared {} artifacts from namespace [{}]", committed.size(), namespace);
            return committed.size();
        } finally {
            namespaceLock.unlock();
        }
    }

    /** Replaces {@code .artifact.json} through a uniquely named temp file and an atomic move. */
    void writeMetadata(Path directory, ArtifactMetadata metadata) {
        Path metadataFile = directory.resolve(LyshraOpenFlowConstants.ARTIFACT_METADATA_FILE);
        Path temp = directory.resolve(LyshraOpenFlowConstants.ARTIFACT_METADATA_FILE + "." + UUID.randomUUID() + ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), metadata.toMap());
            moveReplacing(temp, metadataFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write artifact metadata " + metadataFile, e);
        } finally {
            deleteQuietly(temp);
        }
    }

    static void moveReplacing(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    boolean deleteRecursively(Path root) {
        if (!Files.exists(root)) {
            return false;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
            return true;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete " + root, e);
        }
    }

    static void requireValidFileName(String fileName) {
        if (fileName == null || !FILE_NAME_PATTERN.matcher(fileName).matches() || fileName.startsWith(".")) {
            throw new IllegalArgumentException("Invalid artifact file name: " + fileName);
        }
    }

    private List<String> committedNames(String namespace, boolean lockEach) {
        Path namespaceDir = baseDir.resolve(namespace);
        if (!Files.isDirectory(namespaceDir)) {
            return List.of();
        }
        try (Stream<Path> children = Files.list(namespaceDir)) {
            return children.filter(Files::isDirectory)
                    .map(path -> path.getFileName().toString())
                    .filter(name -> NAME_PATTERN.matcher(name).matches())
                    .filter(name -> lockEach
                            ? readCommittedLocked(namespace, name)
                            : loadCommitted(namespace, name).isPresent())
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list artifacts of namespace " + namespace, e);
        }
    }

    private boolean readCommittedLocked(String namespace, String name) {
        Lock lock = artifactLock(namespace, name).readLock();
        lock.lock();
        try {
            return loadCommitted(namespace, name).isPresent();
        } finally {
            lock.unlock();
        }
    }

    private Optional<ArtifactMetadata> loadCommitted(String namespace, String name) {
        Optional<ArtifactMetadata> metadata = loadMetadata(namespace, name);
        if (metadata.isPresent() && !metadata.get().isCommitted()) {
            log.debug("Ignoring uncommitted artifact [{}/{}]", namespace, name);
            return Optional.empty();
        }
        return metadata;
    }

    @SuppressWarnings("unchecked")
    private Optional<ArtifactMetadata> loadMetadata(String namespace, String name) {
        Path metadataFile = artifactDir(namespace, name).resolve(LyshraOpenFlowConstants.ARTIFACT_METADATA_FILE);
        if (!Files.exists(metadataFile)) {
            return Optional.empty();
        }
        try {
            Map<String, Object> map = objectMapper.readValue(metadataFile.toFile(), Map.class);
            return Optional.of(ArtifactMetadata.fromMap(map));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read artifact metadata " + metadataFile, e);
        }
    }

    private byte[] loadFile(String namespace, String name, String fileName) {
        Path file = artifactDir(namespace, name).resolve(fileName);
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read artifact file " + file, e);
        }
    }

    private <T> T shared(String namespace, String name, Supplier<T> operation) {
        Lock namespaceLock = namespaceLock(namespace).readLock();
        Lock artifactLock = artifactLock(namespace, name).readLock();
        namespaceLock.lock();
        artifactLock.lock();
        try {
            return operation.get();
        } finally {
            artifactLock.unlock();
            namespaceLock.unlock();
        }
    }

    private ReadWriteLock namespaceLock(String namespace) {
        return namespaceLocks.computeIfAbsent(namespace, ignored -> new ReentrantReadWriteLock());
    }

    private ReadWriteLock artifactLock(String namespace, String name) {
        return artifactLocks.computeIfAbsent(namespace + "/" + name, ignored -> new ReentrantReadWriteLock());
    }

    private static void requireValidName(String what, String value) {
        if (value == null || !NAME_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(what + " [" + value + "] may only contain letters, digits, '_' and '-'");
        }
    }

    private Path artifactDir(String namespace, String name) {
        return baseDir.resolve(namespace).resolve(name);
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}", path, e);
        }
    }
}
