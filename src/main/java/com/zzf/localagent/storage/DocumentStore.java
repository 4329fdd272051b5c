package com.zzf.localagent.storage;

import com.fasterxml.jackson.core.type.TypeReference;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Key-directory storage used for branches, snapshots and task records. A key is the list of
 * path segments below the store root, the last one naming the document (extension included).
 * <p>
 * Whole-document writes are atomic: readers see either the previous or the new content.
 * There is no locking across documents, so read-modify-write sequences are last-write-wins.
 */
public interface DocumentStore {

    static List<String> key(String... segments) {
        return Arrays.asList(segments);
    }

    boolean exists(List<String> key);

    boolean isDirectory(List<String> key);

    Optional<String> readText(List<String> key);

    void writeText(List<String> key, String content);

    /**
     * Empty when the document is missing, blank or not valid JSON for {@code type}.
     */
    <T> Optional<T> readJson(List<String> key, Class<T> type);

    <T> Optional<T> readJson(List<String> key, TypeReference<T> type);

    void writeJson(List<String> key, Object value);

    /**
     * Appends one line (a trailing newline is added) to an append-only document.
     */
    void appendLine(List<String> key, String line);

    List<String> readLines(List<String> key);

    void createDirectories(List<String> key);

    /**
     * Creates an empty document when none exists; existing content is kept.
     */
    void touch(List<String> key);

    /**
     * Sorted names of the direct children under {@code prefix}; empty when it is not a directory.
     */
    List<String> list(List<String> prefix);

    void copy(List<String> from, List<String> to);

    /**
     * Removes a document or a whole directory tree. Missing keys are ignored.
     */
    void delete(List<String> key);
}
