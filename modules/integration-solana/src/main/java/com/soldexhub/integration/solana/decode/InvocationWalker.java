package com.soldexhub.integration.solana.decode;

import com.soldexhub.integration.solana.rpc.SolanaTransaction;
import com.soldexhub.integration.solana.rpc.TransactionInstruction;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rebuilds the invocation tree of a transaction from its flattened instructions and log lines.
 *
 * <p>The n-th {@code Program X invoke [h]} log line belongs to the n-th flattened instruction. Lines between
 * an invoke and its matching {@code success}/{@code failed} line belong to the invocation on top of the
 * stack. Attribution stops at the first mismatch or at a truncated log.
 */
final class InvocationWalker {
  private static final Pattern INVOKE = Pattern.compile("^Program (\\S+) invoke \\[(\\d+)]$");
  private static final Pattern RESULT = Pattern.compile("^Program (\\S+) (success|failed.*)$");
  private static final String LOG_TRUNCATED = "Log truncated";

  private InvocationWalker() {}

  static List<ProgramInvocation> walk(SolanaTransaction transaction) {
    List<TransactionInstruction> instructions = transaction.instructions();
    int count = instructions.size();
    List<List<String>> logs = new ArrayList<>(count);
    List<List<AnchorEvent>> events = new ArrayList<>(count);
    boolean[] eventCarrier = new boolean[count];
    for (int i = 0; i < count; i++) {
      logs.add(new ArrayList<>());
      events.add(new ArrayList<>());
    }

    Map<Integer, Integer> lastAtHeight = new HashMap<>();
    for (int position = 0; position < count; position++) {
      TransactionInstruction instruction = instructions.get(position);
      int height = instruction.stackHeight();
      Integer parent = height > 1 ? lastAtHeight.get(height - 1) : null;
      lastAtHeight.put(height, position);
      if (parent != null
          && instructions.get(parent).programId().equals(instruction.programId())
          && AnchorEvent.isEventInstruction(instruction.data())) {
        events.get(parent).add(AnchorEvent.fromEventInstruction(instruction.data()));
        eventCarrier[position] = true;
      }
    }

    attributeLogs(transaction, logs);

    List<ProgramInvocation> invocations = new ArrayList<>(count);
    for (int position = 0; position < count; position++) {
      if (eventCarrier[position]) {
        continue;
      }
      TransactionInstruction instruction = instructions.get(position);
      invocations.add(
          new ProgramInvocation(
              position,
              instruction.stackHeight(),
              instruction.programId(),
              instruction.accounts(),
              instruction.data(),
              logs.get(position),
              events.get(position)));
    }
    return invocations;
  }

  private static void attributeLogs(SolanaTransaction transaction, List<List<String>> logs) {
    List<TransactionInstruction> instructions = transaction.instructions();
    Deque<Integer> stack = new ArrayDeque<>();
    int nextInvocation = 0;
    for (String line : transaction.logMessages()) {
      if (line.startsWith(LOG_TRUNCATED)) {
        return;
      }
      Matcher invoke = INVOKE.matcher(line);
      if (invoke.matches()) {
        if (nextInvocation >= instructions.size()
            || !instructions.get(nextInvocation).programId().equals(invoke.group(1))) {
          return;
        }
        stack.push(nextInvocation++);
        continue;
      }
      Matcher result = RESULT.matcher(line);
      if (result.matches()
          && !stack.isEmpty()
          && instructions.get(stack.peek()).programId().equals(result.group(1))) {
        stack.pop();
        continue;
      }
      if (!stack.isEmpty()) {
        logs.get(stack.peek()).add(line);
      }
    }
  }
}
