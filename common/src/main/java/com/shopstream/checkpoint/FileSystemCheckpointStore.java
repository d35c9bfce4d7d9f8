package com.shopstream.checkpoint;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checkpoint store on a local (or mounted) directory.
 *
 * <pre>
 * checkpoints/
 *   checkpoint-00000000000000000007.ckpt
 *   checkpoint-00000000000000000008.ckpt
 *   LATEST                               (contains "8")
 * </pre>
 *
 * <p>Payloads and the pointer are written to a temp file, synced, then renamed into
 * place, so readers only ever see complete files.</p>
 */
@Slf4j
public class FileSystemCheckpointStore implements CheckpointStore {

    static final String LATEST = "LATEST";
    private static final Pattern PAYLOAD = Pattern.compile("checkpoint-(\\d+)\\.ckpt");

    private final Path directory;

    public FileSystemCheckpointStore(Path directory) {
        this.directory = directory;
    }

    @Override
    public void write(long version, byte[] payload) throws IOException {
        Files.createDirectories(directory);
        writeAtomically(payloadPath(version), payload);
        writeAtomically(directory.resolve(LATEST), Long.toString(version).getBytes(StandardCharsets.UTF_8));
        log.debug("Published checkpoint version={} in {}", version, directory);
    }

    @Override
    public OptionalLong latestVersion() throws IOException {
        Path pointer = directory.resolve(LATEST);
        if (!Files.exists(pointer)) {
            return OptionalLong.empty();
        }
        String content = Files.readString(pointer, StandardCharsets.UTF_8).trim();
        try {
            return OptionalLong.of(Long.parseLong(content));
        } catch (NumberFormatException e) {
            log.warn("Ignoring unreadable checkpoint pointer {}: '{}'", pointer, content);
            return OptionalLong.empty();
        }
    }

    @Override
    public List<Long> listVersions() throws IOException {
        List<Long> versions = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return versions;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "checkpoint-*.ckpt")) {
            for (Path path : stream) {
                Matcher matcher = PAYLOAD.matcher(path.getFileName().toString());
                if (matcher.matches()) {
                    versions.add(Long.parseLong(matcher.group(1)));
                }
            }
        }
        versions.sort(Comparator.reverseOrder());
        return versions;
    }

    @Override
    public byte[] read(long version) throws IOException {
        return Files.readAllBytes(payloadPath(version));
    }

    @Override
    public void delete(long version) throws IOException {
        try {
            Files.delete(payloadPath(version));
        } catch (NoSuchFileException e) {
            log.debug("Checkpoint version={} already gone", version);
        }
    }

    Path payloadPath(long version) {
        return directory.resolve(String.format(Locale.ROOT, "checkpoint-%020d.ckpt", version));
    }

    private void writeAtomically(Path target, byte[] content) throws IOException {
        Path temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
        try {
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(content);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic rename not supported in {}, falling back to plain replace", directory);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
