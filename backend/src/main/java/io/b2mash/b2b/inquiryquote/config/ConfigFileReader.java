package io.b2mash.b2b.inquiryquote.config;

import io.b2mash.b2b.inquiryquote.exception.CatalogConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Reads JSON configuration files from the configured directory. Files missing from the directory
 * fall back to the bundled copies under {@code classpath:defaults/}. Any unreadable or malformed
 * file is a {@link CatalogConfigurationException}.
 */
@Component
public class ConfigFileReader {

  private static final Logger log = LoggerFactory.getLogger(ConfigFileReader.class);
  private static final String BUNDLED_LOCATION = "defaults/";

  private final ObjectMapper objectMapper;

  public ConfigFileReader(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /** Reads {@code fileName} from {@code configDir}, or the bundled default when it is absent. */
  public <T> T readOrDefault(Path configDir, String fileName, TypeReference<T> type) {
    Path file = configDir.resolve(fileName);
    if (Files.isRegularFile(file)) {
      return readFile(file, type);
    }

    var resource = new ClassPathResource(BUNDLED_LOCATION + fileName);
    if (!resource.exists()) {
      throw new CatalogConfigurationException(
          "No " + fileName + " in " + configDir + " and no bundled default");
    }
    log.info("No {} in {}, using bundled default", fileName, configDir);
    try (InputStream in = resource.getInputStream()) {
      return objectMapper.readValue(in, type);
    } catch (IOException | JacksonException e) {
      throw new CatalogConfigurationException("Failed to read bundled " + fileName, e);
    }
  }

  /** Reads {@code fileName} from {@code configDir} if it exists. There is no bundled fallback. */
  public <T> Optional<T> readIfPresent(Path configDir, String fileName, TypeReference<T> type) {
    Path file = configDir.resolve(fileName);
    if (!Files.isRegularFile(file)) {
      return Optional.empty();
    }
    return Optional.ofNullable(readFile(file, type));
  }

  private <T> T readFile(Path file, TypeReference<T> type) {
    log.info("Loading configuration file {}", file);
    try (InputStream in = Files.newInputStream(file)) {
      return objectMapper.readValue(in, type);
    } catch (IOException | JacksonException e) {
      throw new CatalogConfigurationException("Failed to read " + file, e);
    }
  }
}
