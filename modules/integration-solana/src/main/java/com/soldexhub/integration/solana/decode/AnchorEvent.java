package com.soldexhub.integration.solana.decode;

import com.soldexhub.integration.solana.codec.BorshReader;
import com.soldexhub.integration.solana.codec.DecodeException;
import java.util.Arrays;

/** An anchor event: 8-byte discriminator followed by the borsh payload. */
public record AnchorEvent(byte[] bytes) {
  public static final int DISCRIMINATOR_LENGTH = 8;

  /** Prefix of self-CPI instruction data that carries an event instead of an instruction. */
  static final byte[] EVENT_IX_TAG = {
    (byte) 0xe4, (byte) 0x45, (byte) 0xa5, (byte) 0x2e, (byte) 0x51, (byte) 0xcb, (byte) 0x9a, (byte) 0x1d
  };

  public AnchorEvent {
    if (bytes == null || bytes.length < DISCRIMINATOR_LENGTH) {
      throw new DecodeException(
          "Event shorter than its discriminator: " + (bytes == null ? 0 : bytes.length) + " bytes");
    }
  }

  public String discriminator() {
    return BorshReader.hex(Arrays.copyOf(bytes, DISCRIMINATOR_LENGTH));
  }

  public BorshReader payload() {
    return new BorshReader(bytes, DISCRIMINATOR_LENGTH);
  }

  static boolean isEventInstruction(byte[] data) {
    if (data.length < EVENT_IX_TAG.length + DISCRIMINATOR_LENGTH) {
      return false;
    }
    return Arrays.equals(data, 0, EVENT_IX_TAG.length, EVENT_IX_TAG, 0, EVENT_IX_TAG.length);
  }

  static AnchorEvent fromEventInstruction(byte[] data) {
    return new AnchorEvent(Arrays.copyOfRange(data, EVENT_IX_TAG.length, data.length));
  }
}
