package io.lexlink.courier.api;

import io.lexlink.courier.application.conversation.ConnectionManager;
import io.lexlink.courier.application.conversation.ConversationEndpoints;
import io.lexlink.courier.application.conversation.ConversationStateListener;
import io.lexlink.courier.application.conversation.ConversationStateStore;
import io.lexlink.courier.application.conversation.LifecycleCoordinator;
import io.lexlink.courier.config.ClientConfig;
import io.lexlink.courier.config.CompositionRoot;
import io.lexlink.courier.domain.conversation.ConnectionState;
import io.lexlink.courier.domain.conversation.ConversationError;
import io.lexlink.courier.domain.conversation.ConversationIdentity;
import io.lexlink.courier.domain.conversation.Message;
import io.lexlink.courier.logging.LoggingConfigurator;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Console chat client: joins one conversation, prints the transcript and sends what the user types.
 *
 * @since 1.0.0
 */
public final class ChatCli {
  private static final Logger log = LoggerFactory.getLogger(ChatCli.class);
  private static final String SUMMARY_USAGE =
      "usage: chat conversation=ID token=TOKEN [api=URL] [config=PATH] [--no-history] [--dry-run]";
  private static final String HELP_TEXT = """
      Courier chat

      Usage:
        chat conversation=ID token=TOKEN [options]

      Options:
        conversation=ID               Conversation to join
        token=TOKEN                   Bearer token presented to the server
        api=URL                       REST API base (default http://localhost:8000)
        config=PATH                   YAML file; the common and chat sections are applied
        reconnectBaseDelayMillis=N    First reconnect delay (default 1000)
        reconnectCapDelayMillis=N     Largest reconnect delay (default 30000)
        maxReconnectAttempts=N        Retries before giving up (default 5)
        typingDebounceMillis=N        Typing-started debounce (default 300)
        typingIdleStopMillis=N        Stop typing after this much inactivity; 0 disables (default 2000)
        connectTimeoutMillis=N        Handshake and history timeout (default 10000)
        --no-history                  Skip loading earlier messages
        --dry-run                     Print the resolved endpoint and settings without connecting
        --verbose                     Enable DEBUG logging
        --help                        Show this message
      """;
  private static final String COMMANDS =
      "Commands: /typing on|off, /read, /reconnect, /help, /quit. Anything else is sent as a message.";

  private ChatCli() {}

  static ExitCode run(String[] args) {
    BufferedReader console = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
    return run(args, console, CompositionRoot::new);
  }

  static ExitCode run(String[] args, BufferedReader console, Function<ClientConfig, CompositionRoot> wiring) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for chat CLI");
    }

    Map<String, String> cli;
    Map<String, String> settings;
    ClientConfig config;
    try {
      cli = CliArgsParser.toMap(input.keyValueArgs());
      if (input.hasFlag("--no-history")) {
        cli.put(ClientConfig.KEY_LOAD_HISTORY, "false");
      }
      settings = ConfigCliUtils.effectiveSettings(cli, "chat");
      config = ClientConfig.fromMap(settings);
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    ConversationIdentity identity = ConfigCliUtils.identity(settings);
    if (!identity.isComplete()) {
      log.error("conversation and token are both required ({})", identity);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (input.hasFlag("--dry-run")) {
      printDryRunPlan(config, identity);
      return ExitCode.SUCCESS;
    }

    try (CompositionRoot root = wiring.apply(config)) {
      return chat(root, identity, console);
    } catch (IOException ex) {
      log.error("Console read failed", ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure in chat session", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static ExitCode chat(CompositionRoot root, ConversationIdentity identity, BufferedReader console)
      throws IOException {
    ConversationStateStore store = root.store();
    ConnectionManager manager = root.manager();
    LifecycleCoordinator coordinator = root.coordinator();
    AtomicReference<LifecycleCoordinator.Binding> binding = new AtomicReference<>();

    try (ConversationStateStore.Subscription ignored = store.subscribe(new TranscriptPrinter())) {
      root.onLoop(() -> binding.set(coordinator.bind(identity)));
      int fetched = root.loadHistory(identity);
      log.debug("History returned {} messages", fetched);
      CliPrinter.println(COMMANDS);

      String line;
      while ((line = console.readLine()) != null) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
          continue;
        }
        if (trimmed.equalsIgnoreCase("/quit")) {
          break;
        }
        handleLine(root, manager, trimmed);
      }
    } finally {
      root.onLoop(() -> {
        LifecycleCoordinator.Binding current = binding.get();
        if (current != null) {
          current.release();
        }
      });
    }
    return ExitCode.SUCCESS;
  }

  private static void handleLine(CompositionRoot root, ConnectionManager manager, String line) {
    if (!line.startsWith("/")) {
      root.onLoop(() -> manager.send(line));
      return;
    }
    String[] parts = line.split("\\s+", 2);
    String command = parts[0].toLowerCase(Locale.ROOT);
    String argument = parts.length > 1 ? parts[1].trim().toLowerCase(Locale.ROOT) : "";
    switch (command) {
      case "/typing" -> {
        if (argument.equals("on") || argument.equals("off")) {
          boolean typing = argument.equals("on");
          root.onLoop(() -> manager.signalTyping(typing));
        } else {
          CliPrinter.println("usage: /typing on|off");
        }
      }
      case "/read" -> root.onLoop(() -> {
        if (!manager.markRead()) {
          CliPrinter.println("! Not connected; read receipt not sent");
        }
      });
      case "/reconnect" -> root.onLoop(manager::reconnect);
      case "/help" -> CliPrinter.println(COMMANDS);
      default -> CliPrinter.println("Unknown command " + command + ". " + COMMANDS);
    }
  }

  private static void printDryRunPlan(ClientConfig config, ConversationIdentity identity) {
    CliPrinter.printLines(
        "Chat dry-run: no connection will be opened.",
        " Endpoint          : " + new ConversationEndpoints(
            config.apiBaseUrl()).describe(identity),
        " Reconnect policy  : " + config.reconnectPolicy(),
        " Typing debounce   : " + config.typingDebounceMillis() + "ms",
        " Typing idle stop  : " + config.typingIdleStopMillis() + "ms",
        " Connect timeout   : " + config.connectTimeoutMillis() + "ms",
        " Load history      : " + config.loadHistory());
  }

  static String format(Message message) {
    return "[" + message.timestamp() + "] " + message.senderRole().wireName() + "#" + message.senderId()
        + ": " + message.text();
  }

  /** Prints transcript changes as they are published by the store. */
  private static final class TranscriptPrinter implements ConversationStateListener {
    private final Set<String> printed = new HashSet<>();

    @Override
    public void onMessagesChanged(List<Message> messages) {
      for (Message message : messages) {
        if (printed.add(message.id())) {
          CliPrinter.println(format(message));
        }
      }
    }

    @Override
    public void onConnectionStateChanged(ConnectionState state) {
      CliPrinter.println("-- " + state.name().toLowerCase(Locale.ROOT));
    }

    @Override
    public void onRemoteTypingChanged(boolean typing) {
      if (typing) {
        CliPrinter.println("... typing");
      }
    }

    @Override
    public void onErrorChanged(ConversationError error) {
      if (error != null) {
        CliPrinter.println("! " + error.message());
      }
    }

    @Override
    public void onReconnectAttemptChanged(int attempt) {
      if (attempt > 0) {
        CliPrinter.println("-- reconnect attempt " + attempt);
      }
    }
  }
}
