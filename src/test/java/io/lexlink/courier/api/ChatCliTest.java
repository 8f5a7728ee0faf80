package io.lexlink.courier.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.lexlink.courier.application.port.HistoryPort;
import io.lexlink.courier.config.CompositionRoot;
import io.lexlink.courier.domain.conversation.CloseCodes;
import io.lexlink.courier.domain.conversation.Message;
import io.lexlink.courier.domain.conversation.SenderRole;
import io.lexlink.courier.testutil.ManualScheduler;
import io.lexlink.courier.testutil.RecordingMetrics;
import io.lexlink.courier.testutil.RecordingTransport;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChatCliTest {
  private final ManualScheduler scheduler = new ManualScheduler();
  private final RecordingTransport transport = new RecordingTransport().autoOpen();
  private final RecordingMetrics metrics = new RecordingMetrics();
  private final AtomicInteger historyCalls = new AtomicInteger();
  private final AtomicReference<CompositionRoot> wired = new AtomicReference<>();
  private StringWriter out;

  @BeforeEach
  void captureOutput() {
    out = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(out, true));
  }

  @AfterEach
  void restoreOutput() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void sendsConsoleLinesAndClosesOnQuit() {
    ExitCode exit = run(history(List.of()), "Hello \n/typing off\n/quit\nnot sent\n",
        "conversation=c1", "token=t1");

    assertEquals(ExitCode.SUCCESS, exit);
    assertEquals(1, transport.count());
    RecordingTransport.FakeConnection connection = transport.last();
    assertEquals("ws://localhost:8000/api/v1/ws/conversation/c1?token=t1", connection.endpoint().toString());
    assertEquals(List.of(
        "{\"type\":\"send_message\",\"text\":\"Hello\"}",
        "{\"type\":\"typing\",\"is_typing\":false}"), connection.sent());
    assertEquals(CloseCodes.NORMAL, connection.closeCode().intValue());
    assertTrue(out.toString().contains("-- open"));
  }

  @Test
  void printsSeededHistoryAndInboundMessages() {
    Message earlier = new Message("m1", 7L, SenderRole.COUNTERPART, "Welcome", "t0", false, false);

    ExitCode exit = run(history(List.of(earlier)), "/quit\n", "conversation=c1", "token=t1");

    assertEquals(ExitCode.SUCCESS, exit);
    assertEquals(1, historyCalls.get());
    assertEquals(List.of(earlier), wired.get().store().messages());
    assertTrue(out.toString().contains("[t0] lawyer#7: Welcome"));
    assertEquals(List.of("{\"type\":\"mark_read\"}"), transport.last().sent());
  }

  @Test
  void noHistoryFlagSkipsFetch() {
    ExitCode exit = run(history(List.of()), "/quit\n", "conversation=c1", "token=t1", "--no-history");

    assertEquals(ExitCode.SUCCESS, exit);
    assertEquals(0, historyCalls.get());
  }

  @Test
  void readWhileDisconnectedIsReported() {
    transport.failNextOpen(new IllegalStateException("refused"));

    run(history(List.of()), "/read\n/quit\n", "conversation=c1", "token=t1");

    assertTrue(out.toString().contains("! Not connected; read receipt not sent"));
  }

  @Test
  void dryRunDoesNotConnect() {
    ExitCode exit = run(history(List.of()), "", "conversation=c1", "token=s3cret", "--dry-run");

    assertEquals(ExitCode.SUCCESS, exit);
    assertEquals(0, transport.count());
    String printed = out.toString();
    assertTrue(printed.contains("token=[REDACTED]"));
    assertFalse(printed.contains("s3cret"));
  }

  @Test
  void missingTokenIsInvalid() {
    ExitCode exit = run(history(List.of()), "", "conversation=c1");

    assertEquals(ExitCode.INVALID_ARGS, exit);
    assertEquals(0, transport.count());
  }

  @Test
  void formatShowsRoleAndSender() {
    Message message = new Message("m9", 3L, SenderRole.CLIENT, "Hi", "2024-05-01T10:00:00Z", false, false);
    assertEquals("[2024-05-01T10:00:00Z] user#3: Hi", ChatCli.format(message));
  }

  private HistoryPort history(List<Message> messages) {
    return identity -> {
      historyCalls.incrementAndGet();
      if (!"t1".equals(identity.credential())) {
        throw new IOException("unexpected credential");
      }
      return messages;
    };
  }

  private ExitCode run(HistoryPort history, String console, String... args) {
    return ChatCli.run(args, new BufferedReader(new StringReader(console)), config -> {
      CompositionRoot root = new CompositionRoot(config, metrics, scheduler, transport, history);
      wired.set(root);
      return root;
    });
  }
}
