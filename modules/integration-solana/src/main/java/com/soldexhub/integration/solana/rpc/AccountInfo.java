package com.soldexhub.integration.solana.rpc;

import java.util.Objects;

public record AccountInfo(String address, String owner, long lamports, byte[] data) {
  public AccountInfo {
    Objects.requireNonNull(address, "address must not be null");
    Objects.requireNonNull(owner, "owner must not be null");
    data = data == null ? new byte[0] : data;
  }
}
