package org.hyphenmon.alert.engine.state;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * A JSON document on disk that is replaced atomically: the new content goes to a temporary file
 * in the same directory which is then moved over the old one.
 */
class JsonStateFile<T> {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private final Path path;
  private final TypeReference<T> type;

  JsonStateFile(Path path, TypeReference<T> type) {
    this.path = path;
    this.type = type;
  }

  Optional<T> read() throws IOException {
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    return Optional.of(OBJECT_MAPPER.readValue(path.toFile(), type));
  }

  void write(T value) throws IOException {
    Path directory = path.toAbsolutePath().getParent();
    Files.createDirectories(directory);
    Path temp = Files.createTempFile(directory, path.getFileName().toString(), ".tmp");
    try {
      OBJECT_MAPPER.writeValue(temp.toFile(), value);
      Files.move(
          temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  Path getPath() {
    return path;
  }
}
