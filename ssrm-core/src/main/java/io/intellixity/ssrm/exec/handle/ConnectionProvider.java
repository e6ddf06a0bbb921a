package io.intellixity.ssrm.exec.handle;

/**
 * Owns the pooled native client for one backend (a {@code MongoClient}, a {@code DataSource}, ...).
 * <p>
 * Constructed once at startup and injected. The client is created lazily on first {@link #getClient()} and
 * recreated after the backend reports it closed. Configuration problems surface from {@link #getClient()},
 * never from the constructor.
 */
public interface ConnectionProvider<TClient> extends AutoCloseable {
  /** Identifier used in log lines. */
  String id();

  /** Returns the shared client, creating it when none is cached. */
  TClient getClient();

  /** Releases the pool. Later {@link #getClient()} calls fail. */
  @Override
  void close();
}
