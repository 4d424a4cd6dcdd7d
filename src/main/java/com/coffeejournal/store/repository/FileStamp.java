package com.coffeejournal.store.repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.Optional;

/**
 * Identity of a file's content as far as the cache is concerned. Any rewrite by the atomic
 * rename changes at least the file key, so an equal stamp means the cached content is current.
 */
public record FileStamp(FileTime lastModified, long size, Object fileKey) {

    /** @return the stamp of the file, or empty if it does not exist */
    public static Optional<FileStamp> of(Path file) {
        try {
            BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
            return Optional.of(new FileStamp(attrs.lastModifiedTime(), attrs.size(), attrs.fileKey()));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("Failed to stat " + file, e);
        }
    }
}
