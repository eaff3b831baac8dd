package win.ixuni.cloudbulk.core.util;

import win.ixuni.cloudbulk.core.exception.InvalidObjectKeyException;

import java.nio.file.Path;
import java.util.StringJoiner;

/**
 * Mapping between local paths and object keys
 * <p>
 * Keys always use '/' as separator. A storage directory is a key prefix without leading or
 * trailing slashes; the empty string denotes the bucket root.
 */
public final class StoragePaths {

    public static final String SEPARATOR = "/";

    private StoragePaths() {
    }

    /**
     * Normalize a storage directory: backslashes become '/', leading and trailing '/' are removed
     */
    public static String normalizeDirectory(String storageDir) {
        if (storageDir == null) {
            return "";
        }
        String normalized = storageDir.replace('\\', '/').trim();
        int start = 0;
        int end = normalized.length();
        while (start < end && normalized.charAt(start) == '/') {
            start++;
        }
        while (end > start && normalized.charAt(end - 1) == '/') {
            end--;
        }
        return normalized.substring(start, end);
    }

    /**
     * Listing prefix of a storage directory: "dir/" or "" for the root
     */
    public static String directoryPrefix(String storageDir) {
        String normalized = normalizeDirectory(storageDir);
        return normalized.isEmpty() ? "" : normalized + SEPARATOR;
    }

    /**
     * Join key segments with '/', skipping empty ones
     */
    public static String join(String... segments) {
        StringJoiner joiner = new StringJoiner(SEPARATOR);
        for (String segment : segments) {
            String normalized = normalizeDirectory(segment);
            if (!normalized.isEmpty()) {
                joiner.add(normalized);
            }
        }
        return joiner.toString();
    }

    /**
     * Key of a file found under {@code baseDir} when the tree is uploaded to {@code storageDir}
     */
    public static String toKey(Path baseDir, Path file, String storageDir) {
        Path relative = baseDir.toAbsolutePath().normalize()
                .relativize(file.toAbsolutePath().normalize());
        StringJoiner joiner = new StringJoiner(SEPARATOR);
        for (Path name : relative) {
            joiner.add(name.toString());
        }
        return join(storageDir, joiner.toString());
    }

    /**
     * Local destination of {@code key} when the directory behind {@code prefix} is downloaded into
     * {@code localDir}
     *
     * @throws InvalidObjectKeyException when the key does not start with the prefix or would resolve
     *                                   outside {@code localDir}
     */
    public static Path toLocalPath(Path localDir, String key, String prefix) {
        if (!key.startsWith(prefix)) {
            throw new InvalidObjectKeyException(key, "not under prefix '" + prefix + "'");
        }
        Path base = localDir.toAbsolutePath().normalize();
        Path target = base;
        for (String segment : key.substring(prefix.length()).split(SEPARATOR)) {
            if (!segment.isEmpty()) {
                target = target.resolve(segment);
            }
        }
        target = target.normalize();
        if (!target.startsWith(base) || target.equals(base)) {
            throw new InvalidObjectKeyException(key, "resolves outside of " + localDir);
        }
        return target;
    }

    /**
     * Whether the key is a "directory marker" (zero-length placeholder ending in '/')
     */
    public static boolean isDirectoryMarker(String key) {
        return key.endsWith(SEPARATOR);
    }
}
