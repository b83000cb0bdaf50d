package com.lendkeeper.executor.chain;

import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Word-level ABI encoding for calls that carry structs or nested dynamic arrays, which web3j's
 * {@code FunctionEncoder} cannot express without generated wrappers.
 */
public final class AbiWords {

  public static final int WORD = 32;

  private AbiWords() {
  }

  public static byte[] selector(String signature) {
    return Numeric.hexStringToByteArray(selectorHex(signature));
  }

  /**
   * First four bytes of keccak256 of the canonical signature, as {@code 0x}-prefixed hex.
   */
  public static String selectorHex(String signature) {
    return Hash.sha3String(signature).substring(0, 10);
  }

  public static byte[] uint(BigInteger v) {
    if (v == null || v.signum() < 0) {
      throw new IllegalArgumentException("uint must be non-negative: " + v);
    }
    return Numeric.toBytesPadded(v, WORD);
  }

  public static byte[] uint(long v) {
    return uint(BigInteger.valueOf(v));
  }

  public static byte[] bool(boolean v) {
    return uint(v ? 1 : 0);
  }

  public static byte[] address(String addressHex) {
    String addr = addressHex == null ? "" : Numeric.cleanHexPrefix(addressHex.trim());
    if (addr.length() != 40) {
      throw new IllegalArgumentException("expected 20-byte address hex, got: " + addressHex);
    }
    byte[] padded = new byte[WORD];
    System.arraycopy(Numeric.hexStringToByteArray(addr), 0, padded, 12, 20);
    return padded;
  }

  /**
   * Length-prefixed, right-padded {@code bytes} tail.
   */
  public static byte[] bytes(byte[] data) {
    int len = data.length;
    int paddedLen = ((len + WORD - 1) / WORD) * WORD;
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.writeBytes(uint(len));
    out.writeBytes(data);
    out.writeBytes(new byte[paddedLen - len]);
    return out.toByteArray();
  }

  /**
   * {@code bytes[]} tail: length, one offset per element, then the elements.
   */
  public static byte[] bytesArray(List<byte[]> elements) {
    List<byte[]> encoded = new ArrayList<>(elements.size());
    for (byte[] e : elements) {
      encoded.add(bytes(e));
    }
    return dynamicArray(encoded);
  }

  /**
   * Array of dynamic elements that are already encoded.
   */
  public static byte[] dynamicArray(List<byte[]> encodedElements) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.writeBytes(uint(encodedElements.size()));
    int running = WORD * encodedElements.size();
    for (byte[] element : encodedElements) {
      out.writeBytes(uint(running));
      running += element.length;
    }
    for (byte[] element : encodedElements) {
      out.writeBytes(element);
    }
    return out.toByteArray();
  }

  /**
   * Array of static tuples: the length word followed by the tuples inline.
   */
  public static byte[] staticArray(List<byte[]> encodedTuples) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.writeBytes(uint(encodedTuples.size()));
    encodedTuples.forEach(out::writeBytes);
    return out.toByteArray();
  }

  public static byte[] concat(byte[]... parts) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    for (byte[] p : parts) {
      out.writeBytes(p);
    }
    return out.toByteArray();
  }

  public static String hex(byte[]... parts) {
    return Numeric.toHexString(concat(parts));
  }
}
