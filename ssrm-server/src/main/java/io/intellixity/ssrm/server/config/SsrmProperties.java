package io.intellixity.ssrm.server.config;

import io.intellixity.ssrm.mongo.MongoConnectionSettings;
import io.intellixity.ssrm.request.SsrmRequestParser;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ssrm")
public class SsrmProperties {
  private final Mongo mongo = new Mongo();
  private final Tenant tenant = new Tenant();
  private int maxPageSize = SsrmRequestParser.DEFAULT_MAX_PAGE_SIZE;

  public Mongo getMongo() { return mongo; }
  public Tenant getTenant() { return tenant; }
  public int getMaxPageSize() { return maxPageSize; }
  public void setMaxPageSize(int maxPageSize) { this.maxPageSize = maxPageSize; }

  public static class Mongo {
    /** Connection string; requests fail with 500 while unset. */
    private String uri;
    private String database = "goflow";
    private String collection = "events";
    private int maxPoolSize = MongoConnectionSettings.DEFAULT_MAX_POOL_SIZE;
    private int connectTimeoutMs = MongoConnectionSettings.DEFAULT_CONNECT_TIMEOUT_MS;

    public String getUri() { return uri; }
    public void setUri(String uri) { this.uri = uri; }
    public String getDatabase() { return database; }
    public void setDatabase(String database) { this.database = database; }
    public String getCollection() { return collection; }
    public void setCollection(String collection) { this.collection = collection; }
    public int getMaxPoolSize() { return maxPoolSize; }
    public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
    public int getConnectTimeoutMs() { return connectTimeoutMs; }
    public void setConnectTimeoutMs(int connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }
  }

  public static class Tenant {
    /** Document field scoped to the caller's tenant; scoping is off when unset. */
    private String field;
    private String header = "X-Tenant-Id";

    public String getField() { return field; }
    public void setField(String field) { this.field = field; }
    public String getHeader() { return header; }
    public void setHeader(String header) { this.header = header; }
  }
}
