package tech.yump.ledger.crypto;

import jakarta.annotation.PostConstruct;
import java.util.Arrays;
import java.util.Base64;
import java.util.concurrent.atomic.AtomicReference;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import tech.yump.ledger.config.LedgerProperties;

/**
 * Holds the ledger's HMAC signing key and AES-256 encryption key.
 * <p>
 * Keys come from the external secret store through configuration; there is no generation,
 * rotation or persistence here. While the ring is empty every crypto operation fails with
 * {@link KeyUnavailableException}, so nothing can be signed with a missing or default key.
 */
@Slf4j
@Service
public class KeyRing {

  static final String AES = "AES";
  static final String HMAC_SHA256 = "HmacSHA256";
  private static final int ENCRYPTION_KEY_LENGTH = 32; // AES-256
  private static final int MIN_SIGNING_KEY_LENGTH = 32; // RFC 2104: at least the digest length

  private final AtomicReference<KeyRingStatus> status = new AtomicReference<>(KeyRingStatus.EMPTY);
  private final AtomicReference<Keys> keys = new AtomicReference<>(null);

  private final String configuredSigningKeyB64;
  private final String configuredEncryptionKeyB64;

  @Autowired
  public KeyRing(LedgerProperties properties) {
    this(properties.keys().signingKeyB64(), properties.keys().encryptionKeyB64());
  }

  public KeyRing(String signingKeyB64, String encryptionKeyB64) {
    this.configuredSigningKeyB64 = signingKeyB64;
    this.configuredEncryptionKeyB64 = encryptionKeyB64;
  }

  /**
   * Loads the configured keys on startup. A bad key is logged and leaves the ring empty
   * instead of failing the host process; appends then fail individually.
   */
  @PostConstruct
  void loadConfiguredKeys() {
    log.info("Initializing KeyRing...");
    try {
      load(configuredSigningKeyB64, configuredEncryptionKeyB64);
    } catch (IllegalArgumentException e) {
      log.error("Loading configured ledger keys failed: {}. KeyRing remains EMPTY.", e.getMessage());
      clear();
    }
  }

  /**
   * Loads both keys from their Base64 encodings.
   *
   * @throws IllegalArgumentException if either key is missing, not Base64, or too short.
   */
  public synchronized void load(String signingKeyB64, String encryptionKeyB64) {
    byte[] signingBytes = decode(signingKeyB64, "signing");
    byte[] encryptionBytes = decode(encryptionKeyB64, "encryption");
    try {
      if (signingBytes.length < MIN_SIGNING_KEY_LENGTH) {
        throw new IllegalArgumentException("Signing key must be at least " + MIN_SIGNING_KEY_LENGTH + " bytes.");
      }
      if (encryptionBytes.length != ENCRYPTION_KEY_LENGTH) {
        throw new IllegalArgumentException("Encryption key must be exactly " + ENCRYPTION_KEY_LENGTH + " bytes for AES-256.");
      }
      keys.set(new Keys(new SecretKeySpec(signingBytes, HMAC_SHA256), new SecretKeySpec(encryptionBytes, AES)));
      status.set(KeyRingStatus.LOADED);
      log.info("KeyRing LOADED (signing key {} bytes, encryption key {} bytes).", signingBytes.length, encryptionBytes.length);
    } finally {
      // SecretKeySpec keeps its own copy
      Arrays.fill(signingBytes, (byte) 0);
      Arrays.fill(encryptionBytes, (byte) 0);
    }
  }

  /**
   * Drops both keys from memory.
   */
  public synchronized void clear() {
    if (status.get() == KeyRingStatus.EMPTY) {
      log.debug("KeyRing is already empty.");
      return;
    }
    log.warn("Clearing ledger keys from memory.");
    keys.set(null);
    status.set(KeyRingStatus.EMPTY);
  }

  public KeyRingStatus getStatus() {
    return status.get();
  }

  public SecretKey getSigningKey() throws KeyUnavailableException {
    return current().signing();
  }

  public SecretKey getEncryptionKey() throws KeyUnavailableException {
    return current().encryption();
  }

  private Keys current() {
    Keys current = keys.get();
    if (current == null) {
      log.warn("Attempted to use ledger keys while the KeyRing is EMPTY.");
      throw new KeyUnavailableException("Ledger keys are not loaded. Cannot sign or encrypt audit entries.");
    }
    return current;
  }

  private static byte[] decode(String b64, String name) {
    if (!StringUtils.hasText(b64)) {
      throw new IllegalArgumentException("The " + name + " key is not configured.");
    }
    try {
      return Base64.getDecoder().decode(b64.trim());
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid Base64 encoding for the " + name + " key.", e);
    }
  }

  private record Keys(SecretKey signing, SecretKey encryption) {}
}
