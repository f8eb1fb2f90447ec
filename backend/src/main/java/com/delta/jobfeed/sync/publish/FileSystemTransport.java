package com.delta.jobfeed.sync.publish;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Publishes the feed by copying it into a directory, typically a mounted upload area.
 */
public class FileSystemTransport implements Transport {
    private static final Logger log = LoggerFactory.getLogger(FileSystemTransport.class);

    private final Path targetDirectory;
    private final String fileName;

    public FileSystemTransport(Path targetDirectory, String fileName) {
        this.targetDirectory = targetDirectory;
        this.fileName = fileName;
    }

    @Override
    public boolean publish(byte[] artifact) {
        if (targetDirectory == null) {
            log.warn("No publish target directory configured; feed not published");
            return false;
        }
        Path target = targetDirectory.resolve(fileName);
        Path temp = targetDirectory.resolve(fileName + ".uploading");
        try {
            Files.createDirectories(targetDirectory);
            Files.write(temp, artifact);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("Published feed ({} bytes) to {}", artifact.length, target);
            return true;
        } catch (IOException e) {
            log.warn("Publishing feed to {} failed", target, e);
            return false;
        }
    }
}
