package com.soldexhub.integration.solana.decode;

import static com.soldexhub.integration.solana.decode.TestTransactions.tx;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.soldexhub.integration.solana.rpc.SolanaTransaction;
import java.util.List;
import org.junit.jupiter.api.Test;

class InvocationWalkerTest {
  private static final String ROUTER = "JUP6LkbZbjS1jKKwapdHNy74zcZ3tLUZoi5QNyVTaV4";
  private static final String AMM = "pAMMBay6oceH9fJKBRHGP5D4bD4sWpmSwMn52FMfXEA";
  private static final String TOKEN = "TokenkegQfeZyiNwAJbNbGKPFXCWuBvf9Ss623VQ5DA";

  @Test
  void shouldAttributeLogsToNestedInvocations() {
    SolanaTransaction transaction =
        tx("sig-route")
            .outer(ROUTER, List.of("a"), new byte[] {1})
            .inner(2, AMM, List.of("b"), new byte[] {2})
            .inner(3, TOKEN, List.of("c"), new byte[] {3})
            .inner(2, AMM, List.of("d"), new byte[] {4})
            .log(
                "Program " + ROUTER + " invoke [1]",
                "Program log: Instruction: Route",
                "Program " + AMM + " invoke [2]",
                "Program log: first hop",
                "Program " + TOKEN + " invoke [3]",
                "Program log: Instruction: Transfer",
                "Program " + TOKEN + " success",
                "Program log: first hop done",
                "Program " + AMM + " success",
                "Program " + AMM + " invoke [2]",
                "Program log: second hop",
                "Program " + AMM + " success",
                "Program " + ROUTER + " success")
            .build();

    List<ProgramInvocation> invocations = InvocationWalker.walk(transaction);

    assertEquals(4, invocations.size());
    assertEquals(List.of("Program log: Instruction: Route"), invocations.get(0).logs());
    assertEquals(
        List.of("Program log: first hop", "Program log: first hop done"), invocations.get(1).logs());
    assertEquals(List.of("Program log: Instruction: Transfer"), invocations.get(2).logs());
    assertEquals(List.of("Program log: second hop"), invocations.get(3).logs());
    assertEquals(3, invocations.get(3).position());
  }

  @Test
  void shouldAttachSelfCpiEventsToTheirParent() {
    byte[] event = new byte[24];
    System.arraycopy(AnchorEvent.EVENT_IX_TAG, 0, event, 0, 8);
    event[8] = 7;
    SolanaTransaction transaction =
        tx("sig-event")
            .outer(AMM, List.of("pool"), new byte[] {1})
            .inner(2, TOKEN, List.of("vault"), new byte[] {3})
            .inner(2, AMM, List.of("authority"), event)
            .outer(TOKEN, List.of("other"), new byte[] {3})
            .build();

    List<ProgramInvocation> invocations = InvocationWalker.walk(transaction);

    assertEquals(3, invocations.size());
    assertEquals(1, invocations.get(0).cpiEvents().size());
    assertEquals("0700000000000000", invocations.get(0).cpiEvents().get(0).discriminator());
    assertEquals(List.of(0, 1, 3), invocations.stream().map(ProgramInvocation::position).toList());
  }

  @Test
  void shouldStopAttributingAtTruncatedLogs() {
    SolanaTransaction transaction =
        tx("sig-truncated")
            .outer(AMM, List.of("pool"), new byte[] {1})
            .outer(AMM, List.of("pool"), new byte[] {1})
            .log(
                "Program " + AMM + " invoke [1]",
                "Program data: AAAA",
                "Program " + AMM + " success",
                "Log truncated",
                "Program " + AMM + " invoke [1]",
                "Program data: BBBB")
            .build();

    List<ProgramInvocation> invocations = InvocationWalker.walk(transaction);

    assertEquals(List.of("Program data: AAAA"), invocations.get(0).logs());
    assertTrue(invocations.get(1).logs().isEmpty());
  }

  @Test
  void shouldNotTreatLoggedSuccessWordAsResult() {
    SolanaTransaction transaction =
        tx("sig-success-word")
            .outer(AMM, List.of("pool"), new byte[] {1})
            .log(
                "Program " + AMM + " invoke [1]",
                "Program log: success",
                "Program " + AMM + " success")
            .build();

    assertEquals(List.of("Program log: success"), InvocationWalker.walk(transaction).get(0).logs());
  }
}
