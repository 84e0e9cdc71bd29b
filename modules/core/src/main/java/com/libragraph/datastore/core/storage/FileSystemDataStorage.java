package com.libragraph.datastore.core.storage;

import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Filesystem-backed DataStorage for local disks and mounted object store caches.
 *
 * <p>Sources are plain filesystem paths, typically produced by
 * {@code S3PathFactory} in mount form.
 */
@ApplicationScoped
@IfBuildProperty(name = "datastore.storage.type", stringValue = "filesystem")
public class FileSystemDataStorage implements DataStorage {

    private static final Logger log = Logger.getLogger(FileSystemDataStorage.class);

    /**
     * Copies {@code source} to {@code destinationDirectory/<file name>}, replacing any
     * file already there.
     */
    @Override
    public Path fetchFile(String source, Path destinationDirectory) {
        Path sourcePath = Path.of(source);
        if (!Files.isRegularFile(sourcePath)) {
            throw new ObjectNotFoundException(source);
        }
        Path destination = destinationDirectory.resolve(sourcePath.getFileName());
        try {
            Files.createDirectories(destinationDirectory);
            Files.copy(sourcePath, destination, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new StorageException("Failed to copy " + source + " to " + destination, e);
        }
        log.debugf("Copied %s to %s", source, destination);
        return destination;
    }
}
