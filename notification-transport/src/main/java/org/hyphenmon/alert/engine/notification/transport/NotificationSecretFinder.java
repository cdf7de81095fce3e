package org.hyphenmon.alert.engine.notification.transport;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Looks up sender credentials. A system property {@code notification.secret.<key>} wins over the
 * secret file mounted under {@code /var/notification/secrets}.
 */
public class NotificationSecretFinder {
  private static final Logger LOG = LoggerFactory.getLogger(NotificationSecretFinder.class);
  private static final String ROOT_PATH = "/var/notification/secrets";
  private static final String SECRET_SYS_PROP_PREFIX = "notification.secret.";

  private NotificationSecretFinder() {}

  public static Optional<String> findSecret(String key) {
    String fromProperty = System.getProperty(SECRET_SYS_PROP_PREFIX + key);
    if (fromProperty != null) {
      return Optional.of(fromProperty);
    }
    return findSecret(new File(ROOT_PATH, key));
  }

  static Optional<String> findSecret(File file) {
    if (!file.exists() || !file.canRead()) {
      LOG.warn("Secret file {} is not readable", file.getPath());
      return Optional.empty();
    }

    try (Stream<String> stream = Files.lines(file.toPath(), StandardCharsets.UTF_8)) {
      StringBuilder value = new StringBuilder();
      stream.forEach(value::append);
      return Optional.of(value.toString().trim());
    } catch (IOException e) {
      LOG.error("Unable to read secret file {}", file.getPath(), e);
      return Optional.empty();
    }
  }
}
