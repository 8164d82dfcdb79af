package tech.yump.ledger.crypto;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.yump.ledger.support.TestKeys;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntrySignerTest {

  private static final byte[] BODY = "{\"actorId\":\"user-1\"}".getBytes(StandardCharsets.UTF_8);
  private static final String HASH = "a".repeat(64);

  private KeyRing keyRing;
  private EntrySigner entrySigner;

  @BeforeEach
  void setUp() {
    keyRing = new KeyRing(TestKeys.SIGNING_KEY_B64, TestKeys.ENCRYPTION_KEY_B64);
    keyRing.loadConfiguredKeys();
    entrySigner = new EntrySigner(keyRing);
  }

  @Test
  @DisplayName("sign should be deterministic and verify")
  void sign_ThenVerify_Succeeds() {
    String signature = entrySigner.sign(BODY, HASH);

    assertThat(signature).matches("[0-9a-f]{64}");
    assertThat(entrySigner.sign(BODY, HASH)).isEqualTo(signature);
    assertThat(entrySigner.verify(BODY, HASH, signature)).isTrue();
  }

  @Test
  @DisplayName("verify should fail for a changed body, hash or signature")
  void verify_AnyChange_Fails() {
    String signature = entrySigner.sign(BODY, HASH);
    char flipped = signature.charAt(0) == '0' ? '1' : '0';

    assertThat(entrySigner.verify("{\"actorId\":\"user-2\"}".getBytes(StandardCharsets.UTF_8), HASH, signature)).isFalse();
    assertThat(entrySigner.verify(BODY, "b".repeat(64), signature)).isFalse();
    assertThat(entrySigner.verify(BODY, HASH, flipped + signature.substring(1))).isFalse();
    assertThat(entrySigner.verify(BODY, HASH, signature.substring(2))).isFalse();
    assertThat(entrySigner.verify(BODY, HASH, null)).isFalse();
  }

  @Test
  @DisplayName("A signature made with another key should not verify")
  void verify_OtherKey_Fails() {
    String signature = entrySigner.sign(BODY, HASH);
    KeyRing otherRing = new KeyRing(TestKeys.ACCESS_KEY_B64, TestKeys.ENCRYPTION_KEY_B64);
    otherRing.loadConfiguredKeys();

    assertThat(new EntrySigner(otherRing).verify(BODY, HASH, signature)).isFalse();
  }

  @Test
  @DisplayName("sign should refuse to work without a signing key")
  void sign_KeysCleared_ThrowsKeyUnavailable() {
    keyRing.clear();

    assertThatThrownBy(() -> entrySigner.sign(BODY, HASH)).isInstanceOf(KeyUnavailableException.class);
  }
}
