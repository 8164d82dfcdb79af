package tech.yump.ledger.crypto;

import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.Security;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.springframework.stereotype.Service;

/**
 * AES-256-GCM encryption of audit log bodies at rest.
 * <p>
 * Every call draws a fresh 96-bit nonce from {@link SecureRandom}; the nonce travels with the
 * ciphertext in {@link EncryptedData}. The GCM tag makes any modification of the stored
 * ciphertext fail decryption, and of the associated data when one is given.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EncryptionService {

  static {
    if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
      Security.addProvider(new BouncyCastleProvider());
    }
  }

  private static final String ALGORITHM = "AES/GCM/NoPadding";
  private static final int TAG_LENGTH_BIT = 128;
  static final int NONCE_LENGTH_BYTE = 12;

  private final KeyRing keyRing;
  private final SecureRandom secureRandom = new SecureRandom();

  /**
   * Encrypts with the ledger's encryption key.
   *
   * @throws KeyUnavailableException if the key ring is empty.
   * @throws CryptoException         on any cipher failure.
   */
  public EncryptedData encrypt(byte[] plaintext) {
    return encrypt(plaintext, (byte[]) null);
  }

  /**
   * Encrypts with the ledger's encryption key, authenticating {@code associatedData} alongside
   * the ciphertext. The same bytes must be supplied to decrypt.
   */
  public EncryptedData encrypt(byte[] plaintext, byte[] associatedData) {
    if (plaintext == null) {
      throw new CryptoException("Plaintext cannot be null.");
    }
    return encrypt(plaintext, keyRing.getEncryptionKey(), associatedData);
  }

  /**
   * Encrypts with an explicit key, e.g. a caller-supplied archive access key.
   */
  public EncryptedData encrypt(byte[] plaintext, SecretKey key) {
    return encrypt(plaintext, key, null);
  }

  private EncryptedData encrypt(byte[] plaintext, SecretKey key, byte[] associatedData) {
    if (plaintext == null) {
      throw new CryptoException("Plaintext cannot be null.");
    }
    log.debug("Encrypting {} bytes.", plaintext.length);

    byte[] nonce = new byte[NONCE_LENGTH_BYTE];
    secureRandom.nextBytes(nonce);

    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BIT, nonce));
      if (associatedData != null) {
        cipher.updateAAD(associatedData);
      }
      byte[] ciphertext = cipher.doFinal(plaintext);
      log.trace("Encryption successful, ciphertext length: {} bytes.", ciphertext.length);
      return new EncryptedData(nonce, ciphertext);
    } catch (GeneralSecurityException e) {
      log.error("Encryption failed: {}", e.getMessage(), e);
      throw new CryptoException("Failed to encrypt data.", e);
    }
  }

  /**
   * Decrypts with the ledger's encryption key, verifying the GCM tag.
   */
  public byte[] decrypt(EncryptedData data) {
    return decrypt(data, (byte[]) null);
  }

  public byte[] decrypt(EncryptedData data, byte[] associatedData) {
    validate(data);
    return decrypt(data, keyRing.getEncryptionKey(), associatedData);
  }

  public byte[] decrypt(EncryptedData data, SecretKey key) {
    return decrypt(data, key, null);
  }

  private byte[] decrypt(EncryptedData data, SecretKey key, byte[] associatedData) {
    validate(data);
    byte[] nonce;
    byte[] ciphertext;
    try {
      nonce = data.getNonceBytes();
      ciphertext = data.getCiphertextBytes();
    } catch (IllegalArgumentException e) {
      throw new CryptoException("Invalid input: nonce or ciphertext is not valid Base64.", e);
    }
    if (nonce.length != NONCE_LENGTH_BYTE) {
      throw new CryptoException("Invalid input: nonce must be " + NONCE_LENGTH_BYTE + " bytes but was " + nonce.length + ".");
    }
    log.debug("Decrypting {} bytes of ciphertext.", ciphertext.length);

    try {
      Cipher cipher = Cipher.getInstance(ALGORITHM);
      cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BIT, nonce));
      if (associatedData != null) {
        cipher.updateAAD(associatedData);
      }
      return cipher.doFinal(ciphertext);
    } catch (AEADBadTagException e) {
      // Tampered ciphertext or associated data, wrong key or wrong nonce
      log.error("Decryption failed due to invalid authentication tag: {}", e.getMessage());
      throw new CryptoException("Decryption failed: Invalid authentication tag. Data may be corrupt or tampered with.", e);
    } catch (GeneralSecurityException e) {
      log.error("Decryption failed due to other cryptographic error: {}", e.getMessage(), e);
      throw new CryptoException("Failed to decrypt data.", e);
    }
  }

  private static void validate(EncryptedData data) {
    if (data == null || data.getNonceBase64() == null || data.getCiphertextBase64() == null) {
      throw new CryptoException("Invalid input: encrypted data, nonce or ciphertext is null.");
    }
    if (data.getVersion() != EncryptedData.CURRENT_VERSION) {
      throw new CryptoException("Unsupported encrypted data version: " + data.getVersion());
    }
  }
}
