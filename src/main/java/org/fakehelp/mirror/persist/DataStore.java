/* Copyright 2023--2024 The fake.help Developers
 * See LICENSE for licensing information */

package org.fakehelp.mirror.persist;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Stores JSON documents as files {@code <name>.json} below a root
 * directory.
 *
 * <p>A write replaces the previous contents of the file completely. The
 * document is first written to a temporary sibling and then moved into
 * place, so a single overwrite is as atomic as the file system makes a
 * rename. Concurrent writers of the same document are not supported.</p>
 */
public class DataStore {

  private static final Logger logger = LoggerFactory.getLogger(
      DataStore.class);

  public static final String EXTENSION = ".json";

  public static final String TEMPFIX = ".tmp";

  private static final ObjectMapper objectMapper = new ObjectMapper();

  private final Path root;

  /**
   * Create a store writing to the given directory, which is created on the
   * first write if it does not exist yet.
   */
  public DataStore(Path root) {
    this.root = root;
  }

  public Path getRoot() {
    return this.root;
  }

  /** Return the file that holds the document of the given name. */
  public Path pathOf(String name) {
    return this.root.resolve(name + EXTENSION);
  }

  /** Serialize and store the given document under the given name. */
  public void write(String name, Object document) throws StoreException {
    Path target = this.pathOf(name);
    Path tmpPath = this.root.resolve(name + EXTENSION + TEMPFIX);
    try {
      byte[] bytes = objectMapper.writeValueAsBytes(document);
      Files.createDirectories(this.root);
      Files.write(tmpPath, bytes);
      try {
        Files.move(tmpPath, target, StandardCopyOption.REPLACE_EXISTING,
            StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmpPath, target, StandardCopyOption.REPLACE_EXISTING);
      }
      logger.debug("Stored {} ({} bytes).", target, bytes.length);
    } catch (JsonProcessingException e) {
      throw new StoreException(StoreException.Kind.PARSE_ERROR, name,
          "Cannot serialize " + name + ": " + e.getMessage(), e);
    } catch (IOException e) {
      throw new StoreException(StoreException.Kind.IO_ERROR, name,
          "Cannot write " + target + ": " + e.getMessage(), e);
    }
  }

  /** Read and deserialize the document of the given name. */
  public <T> T read(String name, Class<T> clazz) throws StoreException {
    return this.read(name, objectMapper.constructType(clazz));
  }

  /** Read and deserialize the document of the given name. */
  public <T> T read(String name, TypeReference<T> type)
      throws StoreException {
    return this.read(name, objectMapper.constructType(type));
  }

  private <T> T read(String name, JavaType type) throws StoreException {
    Path source = this.pathOf(name);
    try (InputStream in = Files.newInputStream(source)) {
      T document = objectMapper.readValue(in, type);
      if (null == document) {
        throw new StoreException(StoreException.Kind.PARSE_ERROR, name,
            source + " is empty.", null);
      }
      return document;
    } catch (NoSuchFileException e) {
      throw new StoreException(StoreException.Kind.NOT_FOUND, name,
          source + " does not exist.", e);
    } catch (JsonProcessingException e) {
      throw new StoreException(StoreException.Kind.PARSE_ERROR, name,
          "Cannot parse " + source + ": " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new StoreException(StoreException.Kind.IO_ERROR, name,
          "Cannot read " + source + ": " + e.getMessage(), e);
    }
  }

  /** Whether a document of the given name exists. */
  public boolean exists(String name) {
    return Files.exists(this.pathOf(name));
  }
}
