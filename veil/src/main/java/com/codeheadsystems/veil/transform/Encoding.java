package com.codeheadsystems.veil.transform;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import org.apache.commons.codec.CodecPolicy;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Base64;
import org.apache.commons.codec.binary.Hex;

/**
 * Reversible, text-safe encodings for ciphertext.
 */
public enum Encoding {

  /**
   * RFC 4648 base64 without line breaks.
   */
  BASE64("base64", "m") {
    @Override
    public String encode(final byte[] bytes) {
      return Base64.encodeBase64String(bytes);
    }

    @Override
    public byte[] decode(final String text) {
      return strictBase64(text, false);
    }
  },
  BASE64_URL("base64url") {
    @Override
    public String encode(final byte[] bytes) {
      return Base64.encodeBase64URLSafeString(bytes);
    }

    @Override
    public byte[] decode(final String text) {
      return strictBase64(text, true);
    }
  },
  HEX("hex") {
    @Override
    public String encode(final byte[] bytes) {
      return Hex.encodeHexString(bytes);
    }

    @Override
    public byte[] decode(final String text) {
      try {
        return Hex.decodeHex(text);
      } catch (DecoderException e) {
        throw new IllegalArgumentException("Malformed hex text", e);
      }
    }
  };

  // padding only at the end, and only as much as the final group needs
  private static final Pattern BASE64_TEXT =
      Pattern.compile("(?:[A-Za-z0-9+/]{4})*(?:[A-Za-z0-9+/]{2}==|[A-Za-z0-9+/]{3}=)?");
  private static final Pattern BASE64_URL_TEXT =
      Pattern.compile("(?:[A-Za-z0-9_-]{4})*(?:[A-Za-z0-9_-]{2,3})?");

  private final List<String> formats;

  Encoding(final String... formats) {
    this.formats = List.of(formats);
  }

  /**
   * Looks up an encoding by format name.
   *
   * @param format the format, e.g. "base64"
   * @return the encoding
   * @throws IllegalArgumentException for unknown formats
   */
  public static Encoding forFormat(final String format) {
    return Arrays.stream(values())
        .filter(e -> e.formats.contains(format))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown encode format: " + format));
  }

  private static byte[] strictBase64(final String text, final boolean urlSafe) {
    final Pattern canonical = urlSafe ? BASE64_URL_TEXT : BASE64_TEXT;
    if (!canonical.matcher(text).matches()) {
      throw new IllegalArgumentException("Malformed base64 text");
    }
    return new Base64(0, null, urlSafe, CodecPolicy.STRICT).decode(text);
  }

  /**
   * Encode.
   *
   * @param bytes the bytes
   * @return the text
   */
  public abstract String encode(byte[] bytes);

  /**
   * Decode.
   *
   * @param text the text
   * @return the bytes
   * @throws IllegalArgumentException if the text is not valid for this encoding
   */
  public abstract byte[] decode(String text);
}
