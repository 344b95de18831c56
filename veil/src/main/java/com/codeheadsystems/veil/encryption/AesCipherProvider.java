package com.codeheadsystems.veil.encryption;

import com.codeheadsystems.veil.model.ResolvedOptions;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.apache.commons.codec.binary.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Built-in AES provider.
 *
 * <p>Algorithms are named {@code aes-<bits>-<mode>}: aes-128-cbc, aes-192-cbc, aes-256-cbc, aes-128-gcm and
 * aes-256-gcm. Key material that does not match the key size is stretched with SHA-256.</p>
 *
 * <p>Encrypted format: [IV][ciphertext], 16-byte IV for CBC and 12-byte IV for GCM (the GCM tag is part of the
 * ciphertext). The IV is taken from the {@code iv} extra option (bytes or base64 text). Without it the IV is
 * synthetic: HMAC-SHA256 over the algorithm, attribute name and plaintext, keyed with the AES key. Equal plaintext
 * under equal key therefore encrypts to equal ciphertext, which keeps encrypted attributes queryable, while distinct
 * plaintexts never share an IV.</p>
 *
 * <p>GCM binds the attribute name as additional authenticated data.</p>
 */
@Singleton
public class AesCipherProvider implements CipherProvider {

  /**
   * Extra option carrying an explicit IV.
   */
  public static final String IV_OPTION = "iv";

  private static final Logger log = LoggerFactory.getLogger(AesCipherProvider.class);

  private static final Pattern ALGORITHM = Pattern.compile("aes-(128|192|256)-(cbc|gcm)");
  private static final int CBC_IV_LENGTH = 16;
  private static final int GCM_IV_LENGTH = 12; // 96 bits
  private static final int GCM_TAG_LENGTH = 128; // 128 bits
  private static final int MIN_BODY_LENGTH = 16; // one CBC block, or the GCM tag

  /**
   * Instantiates a new AES cipher provider.
   */
  @Inject
  public AesCipherProvider() {
    log.info("AesCipherProvider()");
  }

  @Override
  public Object encrypt(final Object value, final ResolvedOptions options) {
    log.trace("encrypt({}, {})", options.attributeName(), options.algorithm());
    final byte[] plaintext;
    if (value instanceof String) {
      plaintext = ((String) value).getBytes(StandardCharsets.UTF_8);
    } else if (value instanceof byte[]) {
      plaintext = (byte[]) value;
    } else {
      throw new CipherException("Cannot encrypt " + value.getClass().getName()
          + " for attribute " + options.attributeName() + "; enable marshal for structured values");
    }
    final Matcher algorithm = algorithm(options);
    try {
      final byte[] keyBytes = keyMaterial(options, Integer.parseInt(algorithm.group(1)) / 8);
      final boolean gcm = isGcm(algorithm);
      final byte[] iv = iv(options, keyBytes, plaintext, gcm ? GCM_IV_LENGTH : CBC_IV_LENGTH);
      final byte[] ciphertext = cipher(Cipher.ENCRYPT_MODE, options, keyBytes, gcm, iv).doFinal(plaintext);
      return ByteBuffer.allocate(iv.length + ciphertext.length)
          .put(iv)
          .put(ciphertext)
          .array();
    } catch (GeneralSecurityException e) {
      throw new CipherException("Failed to encrypt attribute: " + options.attributeName(), e);
    }
  }

  @Override
  public Object decrypt(final Object value, final ResolvedOptions options) {
    log.trace("decrypt({}, {})", options.attributeName(), options.algorithm());
    if (!(value instanceof byte[])) {
      throw new CipherException("Encrypted value of attribute " + options.attributeName()
          + " must be binary; enable encode to store text");
    }
    final byte[] encrypted = (byte[]) value;
    final Matcher algorithm = algorithm(options);
    final boolean gcm = isGcm(algorithm);
    final int ivLength = gcm ? GCM_IV_LENGTH : CBC_IV_LENGTH;
    if (encrypted.length < ivLength + MIN_BODY_LENGTH) {
      throw new CipherException("Encrypted value of attribute " + options.attributeName() + " is too short");
    }
    try {
      final byte[] keyBytes = keyMaterial(options, Integer.parseInt(algorithm.group(1)) / 8);
      final byte[] iv = Arrays.copyOfRange(encrypted, 0, ivLength);
      final byte[] plaintext = cipher(Cipher.DECRYPT_MODE, options, keyBytes, gcm, iv)
          .doFinal(encrypted, ivLength, encrypted.length - ivLength);
      return new String(plaintext, StandardCharsets.UTF_8);
    } catch (GeneralSecurityException e) {
      throw new CipherException("Failed to decrypt attribute: " + options.attributeName(), e);
    }
  }

  private Matcher algorithm(final ResolvedOptions options) {
    final Matcher matcher = ALGORITHM.matcher(options.algorithm().toLowerCase(Locale.ROOT));
    if (!matcher.matches()) {
      throw new CipherException("Unsupported algorithm: " + options.algorithm());
    }
    return matcher;
  }

  private boolean isGcm(final Matcher algorithm) {
    return "gcm".equals(algorithm.group(2));
  }

  private Cipher cipher(final int mode,
                        final ResolvedOptions options,
                        final byte[] keyBytes,
                        final boolean gcm,
                        final byte[] iv) throws GeneralSecurityException {
    final SecretKey secretKey = new SecretKeySpec(keyBytes, "AES");
    if (gcm) {
      final Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
      cipher.init(mode, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
      cipher.updateAAD(options.attributeName().getBytes(StandardCharsets.UTF_8));
      return cipher;
    }
    final Cipher cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
    cipher.init(mode, secretKey, new IvParameterSpec(iv));
    return cipher;
  }

  private byte[] keyMaterial(final ResolvedOptions options, final int keyLength) throws GeneralSecurityException {
    final Object key = options.key()
        .orElseThrow(() -> new CipherException("No key supplied for attribute " + options.attributeName()));
    final byte[] raw;
    if (key instanceof byte[]) {
      raw = (byte[]) key;
    } else if (key instanceof String) {
      raw = ((String) key).getBytes(StandardCharsets.UTF_8);
    } else {
      throw new CipherException("Key for attribute " + options.attributeName() + " must be a String or bytes");
    }
    if (raw.length == keyLength) {
      return raw;
    }
    return Arrays.copyOf(MessageDigest.getInstance("SHA-256").digest(raw), keyLength);
  }

  private byte[] iv(final ResolvedOptions options,
                    final byte[] keyBytes,
                    final byte[] plaintext,
                    final int length) throws GeneralSecurityException {
    final Object explicit = options.extraOptions().get(IV_OPTION);
    if (explicit != null) {
      final byte[] iv = explicit instanceof byte[]
          ? (byte[]) explicit
          : Base64.decodeBase64(String.valueOf(explicit));
      if (iv.length != length) {
        throw new CipherException("IV for " + options.algorithm() + " must be " + length + " bytes");
      }
      return iv;
    }
    final Mac mac = Mac.getInstance("HmacSHA256");
    mac.init(new SecretKeySpec(keyBytes, "HmacSHA256"));
    mac.update(("iv:" + options.algorithm().toLowerCase(Locale.ROOT) + ":" + options.attributeName() + ":")
        .getBytes(StandardCharsets.UTF_8));
    return Arrays.copyOf(mac.doFinal(plaintext), length);
  }
}
