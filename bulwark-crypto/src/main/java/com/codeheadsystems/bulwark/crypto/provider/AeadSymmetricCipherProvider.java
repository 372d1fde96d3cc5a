package com.codeheadsystems.bulwark.crypto.provider;

import com.codeheadsystems.bulwark.common.ByteUtils;
import com.codeheadsystems.bulwark.common.RandomProvider;
import com.codeheadsystems.bulwark.crypto.CryptoException;
import com.codeheadsystems.bulwark.crypto.EncryptionType;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.modes.ChaCha20Poly1305;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * AES-GCM through the JCE and ChaCha20-Poly1305 through the BouncyCastle lightweight API.
 * A fresh 12-byte nonce is drawn for every encryption and prepended to the output.
 */
public class AeadSymmetricCipherProvider implements SymmetricCipherProvider {

  static final int NONCE_LENGTH = 12;
  static final int TAG_LENGTH = 16;

  private final RandomProvider randomProvider;

  /**
   * Instantiates a new Aead symmetric cipher provider.
   *
   * @param randomProvider the random provider
   */
  public AeadSymmetricCipherProvider(RandomProvider randomProvider) {
    this.randomProvider = randomProvider;
  }

  @Override
  public byte[] encrypt(byte[] plaintext, SecretKey key, EncryptionType type) {
    byte[] keyBytes = checkedKey(key, type);
    try {
      byte[] nonce = randomProvider.randomBytes(NONCE_LENGTH);
      byte[] ciphertext = switch (type) {
        case AES_128_GCM, AES_256_GCM -> aesGcm(Cipher.ENCRYPT_MODE, keyBytes, nonce, plaintext);
        case CHACHA20_POLY1305 -> chaCha(true, keyBytes, nonce, plaintext);
        default -> throw new CryptoException("Not a symmetric type: " + type);
      };
      return ByteUtils.concat(nonce, ciphertext);
    } finally {
      ByteUtils.zero(keyBytes);
    }
  }

  @Override
  public byte[] decrypt(byte[] ciphertext, SecretKey key, EncryptionType type) {
    if (ciphertext == null || ciphertext.length < NONCE_LENGTH + TAG_LENGTH) {
      throw new CryptoException("Ciphertext too short");
    }
    byte[] keyBytes = checkedKey(key, type);
    try {
      byte[] nonce = Arrays.copyOfRange(ciphertext, 0, NONCE_LENGTH);
      byte[] body = Arrays.copyOfRange(ciphertext, NONCE_LENGTH, ciphertext.length);
      return switch (type) {
        case AES_128_GCM, AES_256_GCM -> aesGcm(Cipher.DECRYPT_MODE, keyBytes, nonce, body);
        case CHACHA20_POLY1305 -> chaCha(false, keyBytes, nonce, body);
        default -> throw new CryptoException("Not a symmetric type: " + type);
      };
    } finally {
      ByteUtils.zero(keyBytes);
    }
  }

  private byte[] checkedKey(SecretKey key, EncryptionType type) {
    if (!type.isSymmetric()) {
      throw new CryptoException("Not a symmetric type: " + type);
    }
    byte[] keyBytes = key.getEncoded();
    if (keyBytes == null || keyBytes.length != type.keyLengthBytes()) {
      ByteUtils.zero(keyBytes);
      throw new CryptoException("Key length does not match " + type);
    }
    return keyBytes;
  }

  private byte[] aesGcm(int mode, byte[] keyBytes, byte[] nonce, byte[] input) {
    try {
      Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
      cipher.init(mode, new SecretKeySpec(keyBytes, "AES"),
          new GCMParameterSpec(TAG_LENGTH * 8, nonce));
      return cipher.doFinal(input);
    } catch (GeneralSecurityException e) {
      throw new CryptoException(
          mode == Cipher.ENCRYPT_MODE ? "AES-GCM encryption failed" : "AES-GCM authentication failed", e);
    }
  }

  private byte[] chaCha(boolean forEncryption, byte[] keyBytes, byte[] nonce, byte[] input) {
    ChaCha20Poly1305 cipher = new ChaCha20Poly1305();
    cipher.init(forEncryption, new AEADParameters(new KeyParameter(keyBytes), TAG_LENGTH * 8, nonce));
    byte[] out = new byte[cipher.getOutputSize(input.length)];
    int len = cipher.processBytes(input, 0, input.length, out, 0);
    try {
      len += cipher.doFinal(out, len);
    } catch (InvalidCipherTextException e) {
      throw new CryptoException("ChaCha20-Poly1305 authentication failed", e);
    }
    return len == out.length ? out : Arrays.copyOf(out, len);
  }
}
