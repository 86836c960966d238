package com.otcdesk.deskapi.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reads a secret from a mounted file when one is configured, else keeps the inline value. */
final class SecretResolver {
  private SecretResolver() {}

  static String resolveOptionalSecret(String value, String filePath, String propertyName) {
    if (filePath == null || filePath.isBlank()) {
      return value;
    }
    try {
      String fromFile = Files.readString(Path.of(filePath), StandardCharsets.UTF_8).trim();
      return fromFile.isBlank() ? value : fromFile;
    } catch (IOException ex) {
      throw new IllegalArgumentException(propertyName + " cannot be read: " + filePath, ex);
    }
  }
}
