package com.codeheadsystems.bulwark.crypto.provider;

import com.codeheadsystems.bulwark.crypto.EncryptionType;
import java.security.PrivateKey;
import java.security.PublicKey;

/**
 * Public-key encryption for payloads of any size.
 */
public interface AsymmetricCipherProvider {

  byte[] encrypt(byte[] plaintext, PublicKey recipientKey, EncryptionType type);

  byte[] decrypt(byte[] ciphertext, PrivateKey privateKey, EncryptionType type);
}
