package io.lexlink.courier.testutil;

import io.lexlink.courier.application.port.TransportPort;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * {@link TransportPort} that records every connection and lets tests play the server side.
 */
public final class RecordingTransport implements TransportPort {
  private final List<FakeConnection> connections = new ArrayList<>();
  private boolean autoOpen;
  private RuntimeException openFailure;
  private boolean holdCloses;

  /** Makes every subsequent connection report open as soon as it is created. */
  public RecordingTransport autoOpen() {
    this.autoOpen = true;
    return this;
  }

  /** Leaves the close future of every subsequent connection pending until {@link FakeConnection#completeClose()}. */
  public RecordingTransport holdCloses() {
    this.holdCloses = true;
    return this;
  }

  /** Makes the next {@link #open(URI, TransportListener)} call throw {@code failure}. */
  public void failNextOpen(RuntimeException failure) {
    this.openFailure = failure;
  }

  @Override
  public TransportConnection open(URI endpoint, TransportListener listener) {
    if (openFailure != null) {
      RuntimeException failure = openFailure;
      openFailure = null;
      throw failure;
    }
    FakeConnection connection = new FakeConnection(endpoint, listener, holdCloses);
    connections.add(connection);
    if (autoOpen) {
      listener.onOpen();
    }
    return connection;
  }

  public int count() {
    return connections.size();
  }

  public FakeConnection last() {
    if (connections.isEmpty()) {
      throw new IllegalStateException("no connection opened");
    }
    return connections.get(connections.size() - 1);
  }

  public FakeConnection get(int index) {
    return connections.get(index);
  }

  /** One recorded connection. */
  public static final class FakeConnection implements TransportConnection {
    private final URI endpoint;
    private final TransportListener listener;
    private final List<String> sent = new ArrayList<>();
    private Integer closeCode;
    private String closeReason;
    private final CompletableFuture<Void> closeResult;

    private FakeConnection(URI endpoint, TransportListener listener, boolean holdClose) {
      this.endpoint = endpoint;
      this.listener = listener;
      this.closeResult = holdClose ? new CompletableFuture<>() : CompletableFuture.completedFuture(null);
    }

    @Override
    public void sendText(String text) {
      if (closeCode != null) {
        throw new IllegalStateException("connection closed");
      }
      sent.add(text);
    }

    @Override
    public CompletableFuture<Void> close(int code, String reason) {
      closeCode = code;
      closeReason = reason;
      return closeResult;
    }

    /** Finishes a close handshake held by {@link RecordingTransport#holdCloses()}. */
    public void completeClose() {
      closeResult.complete(null);
    }

    public CompletableFuture<Void> closeResult() {
      return closeResult;
    }

    public void open() {
      listener.onOpen();
    }

    public void receive(String json) {
      listener.onText(json);
    }

    public void serverClose(int code) {
      listener.onClose(code, "");
    }

    public void fail(Throwable error) {
      listener.onError(error);
    }

    public URI endpoint() {
      return endpoint;
    }

    public List<String> sent() {
      return List.copyOf(sent);
    }

    public Integer closeCode() {
      return closeCode;
    }

    public String closeReason() {
      return closeReason;
    }

    public boolean isClosedByClient() {
      return closeCode != null;
    }
  }
}
