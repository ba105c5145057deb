package com.tapas.txnwh.common.partition;

import com.tapas.txnwh.common.error.PartitionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Date-partitioned file store. A partition lives in {@code <base>/YYYY/MM/DD/} and is
 * complete once that directory exists with a {@value #SUCCESS_MARKER} marker inside.
 * <p>
 * Publishing writes into a hidden sibling directory and renames it into place, so readers
 * see either the previous complete partition or the new one, never a partial write.
 */
public class PartitionStore<T> {

    private static final Logger log = LoggerFactory.getLogger(PartitionStore.class);

    public static final String SUCCESS_MARKER = "_SUCCESS";
    private static final String IN_PROGRESS = ".inprogress-";
    private static final String RETIRED = ".retired-";

    private final String name;
    private final Path baseDir;
    private final String fileName;
    private final PartitionCodec<T> codec;

    public PartitionStore(String name, Path baseDir, String fileName, PartitionCodec<T> codec) {
        this.name = name;
        this.baseDir = baseDir;
        this.fileName = fileName;
        this.codec = codec;
    }

    public String getName() {
        return name;
    }

    public Path partitionDir(LocalDate date) {
        return baseDir
                .resolve(String.format("%04d", date.getYear()))
                .resolve(String.format("%02d", date.getMonthValue()))
                .resolve(String.format("%02d", date.getDayOfMonth()));
    }

    public Path dataFile(LocalDate date) {
        return partitionDir(date).resolve(fileName);
    }

    public boolean isComplete(LocalDate date) {
        return Files.isRegularFile(partitionDir(date).resolve(SUCCESS_MARKER));
    }

    /**
     * Writes the partition for {@code date}, replacing any previous version as a whole.
     *
     * @return the published data file
     * @throws IOException if the store cannot be written; nothing is left behind in that case
     */
    public Path publish(LocalDate date, List<T> records) throws IOException {
        Path target = partitionDir(date);
        Path parent = target.getParent();
        Files.createDirectories(parent);
        purgeLeftovers(parent, target.getFileName() + IN_PROGRESS);
        recoverRetired(target);

        Path staging = parent.resolve("." + target.getFileName() + IN_PROGRESS + UUID.randomUUID());
        try {
            Files.createDirectory(staging);
            codec.write(staging.resolve(fileName), records);
            Files.createFile(staging.resolve(SUCCESS_MARKER));
            moveIntoPlace(staging, target);
        } catch (IOException | RuntimeException e) {
            try {
                deleteRecursively(staging);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }

        log.info("Published {} partition | date={} records={} path={}", name, date, records.size(), target);
        return target.resolve(fileName);
    }

    public List<T> read(LocalDate date) throws IOException {
        if (!isComplete(date)) {
            throw new PartitionNotFoundException(
                    "No complete " + name + " partition for " + date + " at " + partitionDir(date));
        }
        return codec.read(dataFile(date));
    }

    private void moveIntoPlace(Path staging, Path target) throws IOException {
        if (!Files.exists(target)) {
            Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE);
            return;
        }
        Path retired = target.resolveSibling("." + target.getFileName() + RETIRED + UUID.randomUUID());
        Files.move(target, retired, StandardCopyOption.ATOMIC_MOVE);
        try {
            Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            try {
                Files.move(retired, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException restore) {
                e.addSuppressed(restore);
            }
            throw e;
        }
        deleteRecursively(retired);
        log.info("Replaced existing {} partition at {}", name, target);
    }

    /**
     * Removes staging directories left by a process that died mid-write.
     */
    private void purgeLeftovers(Path parent, String prefix) throws IOException {
        try (DirectoryStream<Path> stale = Files.newDirectoryStream(parent, "." + prefix + "*")) {
            for (Path dir : stale) {
                log.warn("Removing abandoned {} staging directory {}", name, dir);
                deleteRecursively(dir);
            }
        }
    }

    /**
     * Handles partitions retired by a replace that never finished. If the process died
     * between the two renames the retired copy is the only complete one and is moved back.
     */
    private void recoverRetired(Path target) throws IOException {
        List<Path> retired;
        try (Stream<Path> siblings = Files.list(target.getParent())) {
            retired = siblings
                    .filter(p -> p.getFileName().toString().startsWith("." + target.getFileName() + RETIRED))
                    .toList();
        }
        for (Path dir : retired) {
            if (!Files.exists(target) && Files.isRegularFile(dir.resolve(SUCCESS_MARKER))) {
                log.warn("Restoring {} partition from interrupted replace {}", name, dir);
                Files.move(dir, target, StandardCopyOption.ATOMIC_MOVE);
            } else {
                log.warn("Removing retired {} partition directory {}", name, dir);
                deleteRecursively(dir);
            }
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            for (Path p : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(p);
            }
        }
    }
}
