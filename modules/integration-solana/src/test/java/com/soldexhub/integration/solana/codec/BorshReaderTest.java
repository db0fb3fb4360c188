package com.soldexhub.integration.solana.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class BorshReaderTest {
  @Test
  void shouldReadLittleEndianIntegers() {
    ByteBuffer buffer = ByteBuffer.allocate(2 + 4 + 8 + 16).order(ByteOrder.LITTLE_ENDIAN);
    buffer.putShort((short) 50).putInt(-382).putLong(21_600_777_824L);
    buffer.putLong(53_229_981L).putLong(0L);
    BorshReader reader = new BorshReader(buffer.array());

    assertEquals(50, reader.readU16());
    assertEquals(-382, reader.readI32());
    assertEquals(21_600_777_824L, reader.readU64());
    assertEquals(BigInteger.valueOf(53_229_981L), reader.readU128());
    assertEquals(0, reader.remaining());
  }

  @Test
  void shouldRejectU64AboveSignedRange() {
    byte[] max = new byte[8];
    Arrays.fill(max, (byte) 0xFF);

    assertThrows(DecodeException.class, () -> new BorshReader(max).readU64());
  }

  @Test
  void shouldRejectReadPastEnd() {
    BorshReader reader = new BorshReader(new byte[] {1, 2, 3});

    assertThrows(DecodeException.class, reader::readU64);
  }

  @Test
  void shouldReadBoolStrictly() {
    BorshReader reader = new BorshReader(new byte[] {0, 1, 2});

    assertFalse(reader.readBool());
    assertTrue(reader.readBool());
    assertThrows(DecodeException.class, reader::readBool);
  }

  @Test
  void shouldReadLengthPrefixedString() {
    byte[] text = "PEPE".getBytes(StandardCharsets.UTF_8);
    ByteBuffer buffer = ByteBuffer.allocate(4 + text.length).order(ByteOrder.LITTLE_ENDIAN);
    buffer.putInt(text.length).put(text);

    assertEquals("PEPE", new BorshReader(buffer.array()).readString());
  }

  @Test
  void shouldReadPubkeyAtOffset() {
    byte[] data = new byte[40];
    byte[] key = Base58.decode("EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v");
    System.arraycopy(key, 0, data, 8, 32);

    assertEquals("EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v", BorshReader.pubkeyAt(data, 8));
  }
}
