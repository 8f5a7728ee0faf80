package io.lexlink.courier.api;

import io.lexlink.courier.application.conversation.ConversationEndpoints;
import io.lexlink.courier.config.ClientConfig;
import io.lexlink.courier.domain.conversation.ConversationIdentity;
import io.lexlink.courier.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the WebSocket endpoint a chat session would open, with the token redacted.
 */
public final class EndpointCli {
  private static final Logger log = LoggerFactory.getLogger(EndpointCli.class);
  private static final String SUMMARY_USAGE =
      "usage: endpoint conversation=ID token=TOKEN [api=URL] [config=PATH]";
  private static final String HELP_TEXT = """
      Courier endpoint resolver

      Usage:
        endpoint conversation=ID token=TOKEN [api=URL] [config=PATH]

      Options:
        conversation=ID   Conversation to join
        token=TOKEN       Bearer token; printed as [REDACTED]
        api=URL           REST API base (default http://localhost:8000); http maps to ws, https to wss
        config=PATH       YAML file; the common and chat sections are applied
        --verbose         Enable DEBUG logging
        --help            Show this message
      """;

  private EndpointCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    Map<String, String> settings;
    ClientConfig config;
    try {
      settings = ConfigCliUtils.effectiveSettings(CliArgsParser.toMap(input.keyValueArgs()), "chat");
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
    CliPrinter.println(new ConversationEndpoints(config.apiBaseUrl()).describe(identity));
    return ExitCode.SUCCESS;
  }
}
