package com.leaderboard.hosted.repository.impl;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * One directory of JSON documents, one file per key. Writes go to a temporary
 * file that is forced to disk and then moved over the target, so a reader or a
 * restart sees either the old or the new document.
 */
public class JsonFileStorage {

    private static final Pattern SAFE_KEY = Pattern.compile("[A-Za-z0-9_-][A-Za-z0-9._-]{0,127}");

    private final Path directory;
    private final ObjectMapper objectMapper;

    public JsonFileStorage(String directory) {
        this.directory = Paths.get(directory);
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        initializeDirectory();
    }

    private void initializeDirectory() {
        try {
            if (!Files.exists(directory)) {
                Files.createDirectories(directory);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create data directory: " + directory, e);
        }
    }

    public static boolean isSafeKey(String key) {
        return key != null && SAFE_KEY.matcher(key).matches();
    }

    public Path getDirectory() {
        return directory;
    }

    public boolean exists(String key) {
        return isSafeKey(key) && Files.exists(fileFor(key));
    }

    public <T> Optional<T> read(String key, Class<T> type) throws IOException {
        if (!exists(key)) {
            return Optional.empty();
        }
        return Optional.of(objectMapper.readValue(fileFor(key).toFile(), type));
    }

    public <T> List<T> readList(String key, Class<T> elementType) throws IOException {
        if (!exists(key)) {
            return Collections.emptyList();
        }
        JavaType listType = objectMapper.getTypeFactory().constructCollectionType(List.class, elementType);
        List<T> values = objectMapper.readValue(fileFor(key).toFile(), listType);
        return values != null ? values : Collections.emptyList();
    }

    public List<String> keys() throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files
                .map(p -> p.getFileName().toString())
                .filter(name -> name.endsWith(".json"))
                .map(name -> name.substring(0, name.length() - ".json".length()))
                .filter(JsonFileStorage::isSafeKey)
                .toList();
        }
    }

    public void write(String key, Object value) throws IOException {
        if (!isSafeKey(key)) {
            throw new IllegalArgumentException("Unsupported storage key: " + key);
        }
        byte[] bytes = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(value);
        Path target = fileFor(key);
        Path temp = Files.createTempFile(directory, key + "-", ".tmp");
        try {
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private Path fileFor(String key) {
        return directory.resolve(key + ".json");
    }
}
