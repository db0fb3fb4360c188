package com.soldexhub.integration.solana.codec;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class Base58Test {
  @Test
  void shouldDecodeNativeMintToThirtyTwoBytes() {
    byte[] decoded = Base58.decode("So11111111111111111111111111111111111111112");

    assertEquals(32, decoded.length);
    assertEquals(0x06, decoded[0] & 0xFF);
    assertEquals(0x01, decoded[31] & 0xFF);
  }

  @Test
  void shouldKeepLeadingZeroBytes() {
    byte[] bytes = {0, 0, 1, 2, (byte) 0xFF};

    assertEquals("11", Base58.encode(new byte[] {0, 0}));
    assertArrayEquals(bytes, Base58.decode(Base58.encode(bytes)));
  }

  @Test
  void shouldEncodeSystemProgramAsOnes() {
    assertEquals("11111111111111111111111111111111", Base58.encode(new byte[32]));
  }

  @Test
  void shouldRejectCharactersOutsideAlphabet() {
    assertThrows(DecodeException.class, () -> Base58.decode("0OIl"));
  }
}
