package com.gentoro.codex.storage.file;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.codex.exception.StorageUnavailableException;
import com.gentoro.codex.utility.JacksonUtility;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A directory holding one JSON document per record. File names are the URL-safe Base64 form of
 * the record key, so any key maps to a valid, collision-free file name.
 *
 * <p>Writes go to a temporary sibling first and are then moved into place, so readers never see
 * a half-written document.
 */
final class JsonFileDirectory {
  private static final org.slf4j.Logger log =
      com.gentoro.codex.logging.LoggingService.getLogger(JsonFileDirectory.class);

  private static final String SUFFIX = ".json";
  private static final String TMP_SUFFIX = ".tmp";

  private final Path dir;
  private final ObjectMapper mapper = JacksonUtility.getStorageMapper();

  JsonFileDirectory(Path dir) {
    this.dir = Objects.requireNonNull(dir, "dir");
  }

  Path dir() {
    return dir;
  }

  void create() {
    try {
      Files.createDirectories(dir);
    } catch (IOException e) {
      throw new StorageUnavailableException(
          "Cannot create storage directory " + dir, Map.of("dir", dir.toString()), e);
    }
  }

  <T> List<T> readAll(Class<T> type) {
    List<T> result = new ArrayList<>();
    try (DirectoryStream<Path> files = Files.newDirectoryStream(dir)) {
      for (Path file : files) {
        String name = file.getFileName().toString();
        if (name.endsWith(TMP_SUFFIX)) {
          log.warn("Removing leftover temporary file {}", file);
          Files.deleteIfExists(file);
          continue;
        }
        if (!name.endsWith(SUFFIX)) {
          continue;
        }
        try {
          result.add(mapper.readValue(file.toFile(), type));
        } catch (IOException e) {
          throw new StorageUnavailableException(
              "Unreadable record " + file, Map.of("file", file.toString()), e);
        }
      }
    } catch (IOException e) {
      throw new StorageUnavailableException(
          "Cannot list storage directory " + dir, Map.of("dir", dir.toString()), e);
    }
    return result;
  }

  void write(String key, Object value) {
    Path target = fileFor(key);
    Path tmp = target.resolveSibling(target.getFileName() + TMP_SUFFIX);
    try {
      Files.write(tmp, mapper.writeValueAsString(value).getBytes(StandardCharsets.UTF_8));
      try {
        Files.move(
            tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      throw new StorageUnavailableException(
          "Failed to write record '%s'".formatted(key), Map.of("file", target.toString()), e);
    }
  }

  void delete(String key) {
    Path target = fileFor(key);
    try {
      Files.deleteIfExists(target);
    } catch (IOException e) {
      throw new StorageUnavailableException(
          "Failed to delete record '%s'".formatted(key), Map.of("file", target.toString()), e);
    }
  }

  Path fileFor(String key) {
    String encoded =
        Base64.getUrlEncoder()
            .withoutPadding()
            .encodeToString(key.getBytes(StandardCharsets.UTF_8));
    return dir.resolve(encoded + SUFFIX);
  }
}
