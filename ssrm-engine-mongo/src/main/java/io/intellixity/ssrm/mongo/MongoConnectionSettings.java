package io.intellixity.ssrm.mongo;

/** Pool configuration for {@link MongoConnectionProvider}. {@code uri} may be blank; that fails on first use. */
public record MongoConnectionSettings(String uri, int maxPoolSize, int connectTimeoutMs) {
  public static final int DEFAULT_MAX_POOL_SIZE = 10;
  public static final int DEFAULT_CONNECT_TIMEOUT_MS = 10_000;

  public MongoConnectionSettings {
    if (maxPoolSize <= 0) throw new IllegalArgumentException("maxPoolSize must be > 0");
    if (connectTimeoutMs < 0) throw new IllegalArgumentException("connectTimeoutMs must be >= 0");
  }

  public static MongoConnectionSettings of(String uri) {
    return new MongoConnectionSettings(uri, DEFAULT_MAX_POOL_SIZE, DEFAULT_CONNECT_TIMEOUT_MS);
  }
}
