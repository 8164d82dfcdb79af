package tech.yump.ledger.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import tech.yump.ledger.chain.ChainHead;

/**
 * {@link AuditStore} keeping one JSON file per block under {@code <base>/blocks}.
 * <p>
 * File names are the zero-padded block number, so lexical and numeric order agree. A block is
 * written to a temporary file first and then moved into place without replacement, so readers
 * never observe a half-written block and an existing block is never overwritten.
 */
@Slf4j
public class FileSystemAuditStore implements AuditStore {

  private static final String BLOCKS_DIR = "blocks";
  private static final String EXTENSION = ".json";
  private static final Pattern BLOCK_FILE = Pattern.compile("(\\d{20})\\.json");

  private final Path basePath;
  private final Path blocksPath;
  private final ObjectMapper objectMapper;

  public FileSystemAuditStore(final ObjectMapper objectMapper, final String basePath) {
    this.objectMapper = objectMapper;
    this.basePath = Paths.get(basePath).toAbsolutePath().normalize();
    this.blocksPath = this.basePath.resolve(BLOCKS_DIR);
    log.info("FileSystemAuditStore initialized with base path: {}", this.basePath);
  }

  /**
   * Validates (or creates) the block directory.
   */
  @PostConstruct
  public void validateBasePath() {
    try {
      if (Files.exists(blocksPath)) {
        if (!Files.isDirectory(blocksPath)) {
          throw new StoreException("Configured block path exists but is not a directory: " + blocksPath);
        }
        if (!Files.isReadable(blocksPath) || !Files.isWritable(blocksPath)) {
          throw new StoreException("Configured block directory lacks read/write permissions: " + blocksPath);
        }
        log.debug("Block path validation successful: {}", blocksPath);
      } else {
        log.warn("Block directory does not exist, attempting to create: {}", blocksPath);
        Files.createDirectories(blocksPath);
        log.info("Successfully created block directory: {}", blocksPath);
      }
    } catch (IOException e) {
      log.error("Failed to validate or create block path: {}", blocksPath, e);
      throw new StoreException("Failed to initialize audit store path: " + blocksPath, e);
    }
  }

  @Override
  public void insert(StoredAuditEntry entry) throws StoreException {
    if (entry == null || entry.blockNumber() < 1) {
      throw new IllegalArgumentException("Entry cannot be null and its block number must be positive.");
    }
    Path target = resolveBlockFile(entry.blockNumber());
    if (Files.exists(target)) {
      throw new DuplicateBlockException(entry.blockNumber());
    }

    Path temp = null;
    try {
      Files.createDirectories(blocksPath);
      temp = Files.createTempFile(blocksPath, "block-" + entry.blockNumber() + "-", ".tmp");
      try (OutputStream out = Files.newOutputStream(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
        objectMapper.writeValue(out, entry);
      }
      // No REPLACE_EXISTING: an existing block makes the move fail
      Files.move(temp, target);
      temp = null;
      log.debug("Stored block {} at {}", entry.blockNumber(), target);
    } catch (FileAlreadyExistsException e) {
      throw new DuplicateBlockException(entry.blockNumber(), e);
    } catch (IOException e) {
      log.error("Failed to write block {} to {}: {}", entry.blockNumber(), target, e.getMessage(), e);
      throw new StoreException("Failed to write audit block " + entry.blockNumber(), e);
    } finally {
      if (temp != null) {
        deleteQuietly(temp);
      }
    }
  }

  @Override
  public Stream<StoredAuditEntry> queryRange(long startBlock, long endBlock) throws StoreException {
    if (startBlock > endBlock) {
      return Stream.empty();
    }
    List<Long> blockNumbers = listBlockNumbers().stream()
        .filter(n -> n >= startBlock && n <= endBlock)
        .sorted()
        .toList();
    log.debug("Range [{}, {}] resolved to {} stored blocks.", startBlock, endBlock, blockNumbers.size());
    return blockNumbers.stream()
        .map(this::readBlock)
        .flatMap(Optional::stream);
  }

  @Override
  public Optional<ChainHead> getLastBlock() throws StoreException {
    Optional<Long> highest = listBlockNumbers().stream().max(Long::compare);
    if (highest.isEmpty()) {
      log.debug("No blocks found under {}", blocksPath);
      return Optional.empty();
    }
    return readBlock(highest.get())
        .map(entry -> new ChainHead(entry.blockNumber(), entry.hash()));
  }

  Path resolveBlockFile(long blockNumber) {
    return blocksPath.resolve(String.format("%020d", blockNumber) + EXTENSION);
  }

  private Optional<StoredAuditEntry> readBlock(long blockNumber) {
    Path file = resolveBlockFile(blockNumber);
    try (InputStream in = Files.newInputStream(file, StandardOpenOption.READ)) {
      return Optional.of(objectMapper.readValue(in, StoredAuditEntry.class));
    } catch (NoSuchFileException e) {
      log.warn("Block {} disappeared before it could be read: {}", blockNumber, file);
      return Optional.empty();
    } catch (IOException e) {
      log.error("Failed to read block {} from {}: {}", blockNumber, file, e.getMessage(), e);
      throw new StoreException("Failed to read or parse audit block " + blockNumber, e);
    }
  }

  private List<Long> listBlockNumbers() {
    if (!Files.isDirectory(blocksPath)) {
      return List.of();
    }
    try (Stream<Path> files = Files.list(blocksPath)) {
      return files
          .map(p -> BLOCK_FILE.matcher(p.getFileName().toString()))
          .filter(Matcher::matches)
          .map(m -> Long.parseLong(m.group(1)))
          .toList();
    } catch (IOException e) {
      log.error("Failed to list block directory {}: {}", blocksPath, e.getMessage(), e);
      throw new StoreException("Failed to list audit blocks in " + blocksPath, e);
    }
  }

  private static void deleteQuietly(Path temp) {
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      log.warn("Could not remove temporary block file {}: {}", temp, e.getMessage());
    }
  }
}
