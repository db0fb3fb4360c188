package com.soldexhub.integration.solana.decode;

import com.soldexhub.integration.solana.codec.DecodeException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;

/**
 * One instruction execution with the log lines it emitted and the self-CPI events it raised.
 *
 * <p>{@code position} is the zero-based index in the transaction's flattened execution order and becomes
 * the trade {@code idx}.
 */
public record ProgramInvocation(
    int position,
    int stackHeight,
    String programId,
    List<String> accounts,
    byte[] data,
    List<String> logs,
    List<AnchorEvent> cpiEvents) {
  static final String PROGRAM_DATA_PREFIX = "Program data: ";
  static final String PROGRAM_LOG_PREFIX = "Program log: ";

  public ProgramInvocation {
    Objects.requireNonNull(programId, "programId must not be null");
    accounts = accounts == null ? List.of() : List.copyOf(accounts);
    data = data == null ? new byte[0] : data;
    logs = logs == null ? List.of() : List.copyOf(logs);
    cpiEvents = cpiEvents == null ? List.of() : List.copyOf(cpiEvents);
  }

  public String account(int index) {
    return index >= 0 && index < accounts.size() ? accounts.get(index) : null;
  }

  public String lastAccount() {
    return accounts.isEmpty() ? null : accounts.get(accounts.size() - 1);
  }

  /** Self-CPI events when present, otherwise events logged as {@code Program data: <base64>}. */
  public List<AnchorEvent> anchorEvents() {
    if (!cpiEvents.isEmpty()) {
      return cpiEvents;
    }
    List<AnchorEvent> events = new ArrayList<>();
    for (String line : logs) {
      if (!line.startsWith(PROGRAM_DATA_PREFIX)) {
        continue;
      }
      String encoded = line.substring(PROGRAM_DATA_PREFIX.length()).trim();
      try {
        events.add(new AnchorEvent(Base64.getDecoder().decode(encoded)));
      } catch (IllegalArgumentException ex) {
        throw new DecodeException("Invalid base64 in program data log", ex);
      }
    }
    return events;
  }

  /** Payloads of {@code Program log: <prefix><value>} lines. */
  public List<String> programLogs(String prefix) {
    String full = PROGRAM_LOG_PREFIX + prefix;
    List<String> values = new ArrayList<>();
    for (String line : logs) {
      if (line.startsWith(full)) {
        values.add(line.substring(full.length()).trim());
      }
    }
    return values;
  }
}
