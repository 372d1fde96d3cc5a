package com.codeheadsystems.bulwark.crypto.provider;

import com.codeheadsystems.bulwark.common.RandomProvider;
import com.codeheadsystems.bulwark.crypto.key.HkdfKeyDerivation;
import com.codeheadsystems.bulwark.crypto.key.KeyDerivationFunction;

/**
 * The set of primitives the transport layer depends on.
 *
 * @param symmetric     the symmetric cipher
 * @param asymmetric    the asymmetric cipher
 * @param signatures    the signature provider
 * @param hashes        the hash provider
 * @param keyPairs      the key pair provider
 * @param keyAgreement  the key agreement provider
 * @param keyDerivation the key derivation function
 */
public record CryptoProviders(SymmetricCipherProvider symmetric,
                              AsymmetricCipherProvider asymmetric,
                              SignatureProvider signatures,
                              HashProvider hashes,
                              KeyPairProvider keyPairs,
                              KeyAgreementProvider keyAgreement,
                              KeyDerivationFunction keyDerivation) {

  /**
   * The default JCA/BouncyCastle implementations.
   *
   * @param randomProvider the random provider
   * @return the crypto providers
   */
  public static CryptoProviders defaults(RandomProvider randomProvider) {
    AeadSymmetricCipherProvider symmetric = new AeadSymmetricCipherProvider(randomProvider);
    return new CryptoProviders(
        symmetric,
        new RsaHybridCipherProvider(symmetric, randomProvider),
        new JcaSignatureProvider(randomProvider),
        new DefaultHashProvider(),
        new JcaKeyPairProvider(randomProvider),
        new JcaKeyAgreementProvider(randomProvider),
        new HkdfKeyDerivation());
  }

  /**
   * Copy with a different symmetric cipher.
   *
   * @param replacement the replacement
   * @return the crypto providers
   */
  public CryptoProviders withSymmetric(SymmetricCipherProvider replacement) {
    return new CryptoProviders(replacement, asymmetric, signatures, hashes, keyPairs, keyAgreement, keyDerivation);
  }
}
