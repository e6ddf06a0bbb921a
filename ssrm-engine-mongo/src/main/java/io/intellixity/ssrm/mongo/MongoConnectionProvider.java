package io.intellixity.ssrm.mongo;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.event.ClusterClosedEvent;
import com.mongodb.event.ClusterListener;
import io.intellixity.ssrm.error.ConnectivityException;
import io.intellixity.ssrm.exec.handle.ConnectionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Lazily created, shared {@link MongoClient}.
 * <p>
 * The client is built on the first {@link #getClient()} call. When its cluster reports closed the cached
 * instance is dropped and the next call builds a fresh one. Creation is serialised on this provider.
 * Reads are not retried by the driver.
 */
public final class MongoConnectionProvider implements ConnectionProvider<MongoClient> {
  private static final Logger log = LoggerFactory.getLogger(MongoConnectionProvider.class);

  private final String id;
  private final MongoConnectionSettings settings;
  private final Function<MongoClientSettings, MongoClient> factory;

  private MongoClient client;
  private long generation;
  private boolean closed;

  public MongoConnectionProvider(String id, MongoConnectionSettings settings) {
    this(id, settings, MongoClients::create);
  }

  MongoConnectionProvider(String id, MongoConnectionSettings settings, Function<MongoClientSettings, MongoClient> factory) {
    this.id = Objects.requireNonNull(id, "id");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.factory = Objects.requireNonNull(factory, "factory");
    if (settings.uri() == null || settings.uri().isBlank()) {
      log.warn("ssrm.mongo provider={} connection string is not configured; SSRM requests will fail", id);
    }
  }

  @Override
  public String id() { return id; }

  @Override
  public synchronized MongoClient getClient() {
    if (closed) throw new ConnectivityException("MongoDB connection provider '" + id + "' is closed");
    if (client != null) return client;

    String uri = settings.uri();
    if (uri == null || uri.isBlank()) {
      throw new ConnectivityException("MongoDB connection string is not configured (ssrm.mongo.uri)");
    }
    ConnectionString cs;
    try {
      cs = new ConnectionString(uri.trim());
    } catch (IllegalArgumentException e) {
      throw new ConnectivityException("Invalid MongoDB connection string: " + e.getMessage(), e);
    }

    long gen = ++generation;
    MongoClientSettings clientSettings = MongoClientSettings.builder()
        .applyConnectionString(cs)
        .retryReads(false)
        .applyToConnectionPoolSettings(b -> b.maxSize(settings.maxPoolSize()))
        .applyToSocketSettings(b -> b.connectTimeout(settings.connectTimeoutMs(), TimeUnit.MILLISECONDS))
        .applyToClusterSettings(b -> b
            .serverSelectionTimeout(settings.connectTimeoutMs(), TimeUnit.MILLISECONDS)
            .addClusterListener(new ClusterListener() {
              @Override
              public void clusterClosed(ClusterClosedEvent event) {
                onClusterClosed(gen);
              }
            }))
        .build();

    try {
      client = factory.apply(clientSettings);
    } catch (MongoException | IllegalArgumentException e) {
      throw new ConnectivityException("Unable to create MongoDB client: " + e.getMessage(), e);
    }
    if (log.isDebugEnabled()) {
      log.debug("ssrm.mongo op=connect provider={} generation={} maxPoolSize={}", id, gen, settings.maxPoolSize());
    }
    return client;
  }

  synchronized void onClusterClosed(long gen) {
    if (gen != generation || client == null) return;
    client = null;
    if (log.isDebugEnabled()) {
      log.debug("ssrm.mongo op=clusterClosed provider={} generation={}", id, gen);
    }
  }

  @Override
  public synchronized void close() {
    if (closed) return;
    closed = true;
    MongoClient c = client;
    client = null;
    if (c != null) c.close();
  }
}
