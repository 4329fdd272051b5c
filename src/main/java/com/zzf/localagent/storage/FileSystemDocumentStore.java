package com.zzf.localagent.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.localagent.exception.StorageException;
import com.zzf.localagent.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link DocumentStore} laid out as plain files under a root directory.
 * <p>
 * A per-file read/write lock serialises operations on the same document within this
 * process, so appended lines never interleave. Nothing is locked across processes.
 */
@Slf4j
public class FileSystemDocumentStore implements DocumentStore {

    private static final String TMP_SUFFIX = ".tmp";

    private final Path root;
    private final ObjectMapper objectMapper;
    private final ConcurrentHashMap<String, ReadWriteLock> locks = new ConcurrentHashMap<>();

    public FileSystemDocumentStore(Path root, ObjectMapper objectMapper) {
        this.root = root.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean exists(List<String> key) {
        return Files.exists(resolve(key));
    }

    @Override
    public boolean isDirectory(List<String> key) {
        return Files.isDirectory(resolve(key));
    }

    @Override
    public Optional<String> readText(List<String> key) {
        Path target = resolve(key);
        if (!Files.isRegularFile(target)) {
            return Optional.empty();
        }
        ReadWriteLock lock = getLock(target);
        lock.readLock().lock();
        try {
            return Optional.of(Files.readString(target, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("Failed to read " + target, e);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void writeText(List<String> key, String content) {
        Path target = resolve(key);
        ReadWriteLock lock = getLock(target);
        lock.writeLock().lock();
        try {
            atomicWrite(target, content == null ? "" : content);
        } catch (IOException e) {
            throw new StorageException("Failed to write " + target, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public <T> Optional<T> readJson(List<String> key, Class<T> type) {
        return readText(key)
                .filter(s -> !s.trim().isEmpty())
                .flatMap(s -> parse(key, () -> objectMapper.readValue(s, type)));
    }

    @Override
    public <T> Optional<T> readJson(List<String> key, TypeReference<T> type) {
        return readText(key)
                .filter(s -> !s.trim().isEmpty())
                .flatMap(s -> parse(key, () -> objectMapper.readValue(s, type)));
    }

    @Override
    public void writeJson(List<String> key, Object value) {
        String json;
        try {
            json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (IOException e) {
            throw new StorageException("Failed to serialise document " + String.join("/", key), e);
        }
        writeText(key, json);
    }

    @Override
    public void appendLine(List<String> key, String line) {
        Path target = resolve(key);
        ReadWriteLock lock = getLock(target);
        lock.writeLock().lock();
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, line + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new StorageException("Failed to append to " + target, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<String> readLines(List<String> key) {
        return readText(key)
                .map(text -> text.lines()
                        .filter(l -> !l.trim().isEmpty())
                        .collect(Collectors.toList()))
                .orElseGet(ArrayList::new);
    }

    @Override
    public void createDirectories(List<String> key) {
        Path target = resolve(key);
        try {
            Files.createDirectories(target);
        } catch (IOException e) {
            throw new StorageException("Failed to create directory " + target, e);
        }
    }

    @Override
    public void touch(List<String> key) {
        Path target = resolve(key);
        ReadWriteLock lock = getLock(target);
        lock.writeLock().lock();
        try {
            if (!Files.exists(target)) {
                Files.createDirectories(target.getParent());
                Files.createFile(target);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to create " + target, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<String> list(List<String> prefix) {
        Path dir = resolve(prefix);
        if (!Files.isDirectory(dir)) {
            return new ArrayList<>();
        }
        try (Stream<Path> children = Files.list(dir)) {
            return children.map(p -> p.getFileName().toString())
                    .filter(name -> !name.endsWith(TMP_SUFFIX))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new StorageException("Failed to list " + dir, e);
        }
    }

    @Override
    public void copy(List<String> from, List<String> to) {
        Path source = resolve(from);
        Path target = resolve(to);
        ReadWriteLock lock = getLock(target);
        lock.writeLock().lock();
        try {
            byte[] data = Files.readAllBytes(source);
            Files.createDirectories(target.getParent());
            Path tmp = target.resolveSibling(target.getFileName() + TMP_SUFFIX);
            Files.write(tmp, data);
            move(tmp, target);
        } catch (IOException e) {
            throw new StorageException("Failed to copy " + source + " to " + target, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void delete(List<String> key) {
        Path target = resolve(key);
        if (target.equals(root) || !Files.exists(target)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(target)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.deleteIfExists(p);
            }
        } catch (IOException | UncheckedIOException e) {
            IOException cause = e instanceof IOException ? (IOException) e : ((UncheckedIOException) e).getCause();
            throw new StorageException("Failed to delete " + target, cause);
        }
    }

    private void atomicWrite(Path target, String content) throws IOException {
        Files.createDirectories(target.getParent());
        Path tmp = target.resolveSibling(target.getFileName() + TMP_SUFFIX);
        Files.writeString(tmp, content, StandardCharsets.UTF_8);
        move(tmp, target);
    }

    private static void move(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private <T> Optional<T> parse(List<String> key, JsonReader<T> reader) {
        try {
            return Optional.ofNullable(reader.read());
        } catch (IOException e) {
            log.warn("storage.read.invalid_json key={} err={}", String.join("/", key), e.toString());
            return Optional.empty();
        }
    }

    private ReadWriteLock getLock(Path path) {
        return locks.computeIfAbsent(path.toString(), k -> new ReentrantReadWriteLock());
    }

    private Path resolve(List<String> key) {
        Path path = root;
        for (String part : key) {
            if (part == null || part.isEmpty() || ".".equals(part) || "..".equals(part)
                    || part.indexOf('/') >= 0 || part.indexOf('\\') >= 0) {
                throw new ValidationException("Invalid storage key segment: " + part);
            }
            path = path.resolve(part);
        }
        return path;
    }

    @FunctionalInterface
    private interface JsonReader<T> {
        T read() throws IOException;
    }
}
