package com.simmodel.catalog.catalog.service;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds model store files under a directory tree.
 *
 * Result is sorted by path: when the same model exists in several stores the first path wins,
 * which in the usual layout is the same as sorting by model name.
 */
public class ModelStoreDiscoveryService {

    private static final Logger log = LoggerFactory.getLogger(ModelStoreDiscoveryService.class);

    private final String storeExtension;

    public ModelStoreDiscoveryService(String storeExtension) {
        Objects.requireNonNull(storeExtension, "storeExtension");
        this.storeExtension = storeExtension.startsWith(".") ? storeExtension : "." + storeExtension;
    }

    /**
     * Walk {@code rootDir} recursively and return store files, sorted by path.
     * Failures below the root are logged and skipped, a failure at the root is rethrown.
     */
    public List<Path> discoverStoreFiles(Path rootDir) throws IOException {
        Objects.requireNonNull(rootDir, "rootDir");

        StoreFileVisitor visitor = new StoreFileVisitor(rootDir);
        Files.walkFileTree(rootDir, visitor);

        List<Path> found = visitor.getFound();
        found.sort(Comparator.comparing(Path::toString));
        log.debug("Found {} model store file(s) under {}", found.size(), rootDir);
        return found;
    }

    boolean isStoreFile(Path path) {
        Path name = path.getFileName();
        if (name == null) {
            return false;
        }
        String fileName = name.toString();
        int dot = fileName.lastIndexOf('.');
        return dot >= 0 && fileName.substring(dot).equalsIgnoreCase(storeExtension);
    }

    public String getStoreExtension() {
        return storeExtension;
    }

    /**
     * Collects store files, rethrows failures at the walk root only.
     */
    class StoreFileVisitor extends SimpleFileVisitor<Path> {

        private final Path rootDir;
        private final List<Path> found = new ArrayList<>();

        StoreFileVisitor(Path rootDir) {
            this.rootDir = rootDir;
        }

        List<Path> getFound() {
            return found;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isRegularFile() && isStoreFile(file)) {
                found.add(file);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
            if (file.equals(rootDir)) {
                throw exc;
            }
            log.error("Error at refresh model catalog, path: {} : {}", file, exc.getMessage());
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
            if (exc != null) {
                if (dir.equals(rootDir)) {
                    throw exc;
                }
                log.error("Error at refresh model catalog, path: {} : {}", dir, exc.getMessage());
            }
            return FileVisitResult.CONTINUE;
        }
    }
}
