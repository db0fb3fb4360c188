package com.soldexhub.integration.solana.codec;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * Bounds-checked little-endian cursor over borsh-serialized bytes. Every read past the end, and every value
 * the ledger schema cannot hold, raises {@link DecodeException}.
 */
public final class BorshReader {
  public static final int PUBKEY_LENGTH = 32;
  private static final int MAX_STRING_LENGTH = 4096;

  private final byte[] data;
  private int position;

  public BorshReader(byte[] data) {
    this(data, 0);
  }

  public BorshReader(byte[] data, int offset) {
    if (data == null) {
      throw new DecodeException("data must not be null");
    }
    if (offset < 0 || offset > data.length) {
      throw new DecodeException("offset " + offset + " outside payload of " + data.length + " bytes");
    }
    this.data = data;
    this.position = offset;
  }

  public int position() {
    return position;
  }

  public int remaining() {
    return data.length - position;
  }

  public BorshReader skip(int length) {
    require(length);
    position += length;
    return this;
  }

  public byte[] readBytes(int length) {
    require(length);
    byte[] out = Arrays.copyOfRange(data, position, position + length);
    position += length;
    return out;
  }

  public int readU8() {
    require(1);
    return data[position++] & 0xFF;
  }

  public boolean readBool() {
    int value = readU8();
    if (value > 1) {
      throw new DecodeException("Invalid bool byte " + value + " at " + (position - 1));
    }
    return value == 1;
  }

  public int readU16() {
    return (int) readLittleEndian(2);
  }

  public int readI32() {
    return (int) readLittleEndian(4);
  }

  public long readU32() {
    return readLittleEndian(4);
  }

  public long readI64() {
    return readLittleEndian(8);
  }

  /** Unsigned 64-bit value; values above {@link Long#MAX_VALUE} are rejected. */
  public long readU64() {
    int start = position;
    long value = readLittleEndian(8);
    if (value < 0) {
      throw new DecodeException("u64 at " + start + " exceeds signed 64-bit range");
    }
    return value;
  }

  public BigInteger readU128() {
    byte[] little = readBytes(16);
    byte[] big = new byte[little.length];
    for (int i = 0; i < little.length; i++) {
      big[i] = little[little.length - 1 - i];
    }
    return new BigInteger(1, big);
  }

  public String readPubkey() {
    return Base58.encode(readBytes(PUBKEY_LENGTH));
  }

  public String readString() {
    long length = readU32();
    if (length > MAX_STRING_LENGTH) {
      throw new DecodeException("String length " + length + " exceeds " + MAX_STRING_LENGTH);
    }
    return new String(readBytes((int) length), StandardCharsets.UTF_8);
  }

  public static String hex(byte[] bytes) {
    return HexFormat.of().formatHex(bytes);
  }

  public static String pubkeyAt(byte[] data, int offset) {
    return new BorshReader(data, offset).readPubkey();
  }

  public static int u8At(byte[] data, int offset) {
    return new BorshReader(data, offset).readU8();
  }

  public static long u64At(byte[] data, int offset) {
    return new BorshReader(data, offset).readU64();
  }

  private long readLittleEndian(int length) {
    require(length);
    long value = 0L;
    for (int i = length - 1; i >= 0; i--) {
      value = (value << 8) | (data[position + i] & 0xFFL);
    }
    position += length;
    return value;
  }

  private void require(int length) {
    if (length < 0 || length > remaining()) {
      throw new DecodeException(
          "Need " + length + " bytes at " + position + " but only " + remaining() + " remain");
    }
  }
}
