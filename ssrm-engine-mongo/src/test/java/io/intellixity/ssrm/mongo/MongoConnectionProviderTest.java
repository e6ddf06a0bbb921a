package io.intellixity.ssrm.mongo;

import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import io.intellixity.ssrm.error.ConnectivityException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class MongoConnectionProviderTest {

  @Test
  void blankUri_failsOnFirstUse_notAtConstruction() {
    MongoConnectionProvider p = new MongoConnectionProvider("test", MongoConnectionSettings.of(" "));
    ConnectivityException e = assertThrows(ConnectivityException.class, p::getClient);
    assertTrue(e.getMessage().contains("not configured"));
  }

  @Test
  void invalidUri_isConnectivityError() {
    MongoConnectionProvider p = new MongoConnectionProvider("test", MongoConnectionSettings.of("postgres://nope"));
    assertThrows(ConnectivityException.class, p::getClient);
  }

  @Test
  void settings_applyPoolTimeoutAndNoRetries() {
    List<MongoClientSettings> seen = new ArrayList<>();
    MongoConnectionProvider p = new MongoConnectionProvider("test",
        new MongoConnectionSettings("mongodb://localhost:1", 7, 250),
        s -> {
          seen.add(s);
          return com.mongodb.client.MongoClients.create(s);
        });
    try {
      p.getClient();
      MongoClientSettings s = seen.get(0);
      assertFalse(s.getRetryReads());
      assertEquals(7, s.getConnectionPoolSettings().getMaxSize());
      assertEquals(250, s.getSocketSettings().getConnectTimeout(TimeUnit.MILLISECONDS));
      assertEquals(250, s.getClusterSettings().getServerSelectionTimeout(TimeUnit.MILLISECONDS));
    } finally {
      p.close();
    }
  }

  @Test
  void client_isCachedUntilClusterCloses() {
    MongoConnectionProvider p = new MongoConnectionProvider("test",
        new MongoConnectionSettings("mongodb://localhost:1", 2, 250));
    try {
      MongoClient first = p.getClient();
      assertSame(first, p.getClient());

      first.close();

      MongoClient second = p.getClient();
      assertNotSame(first, second);
    } finally {
      p.close();
    }
  }

  @Test
  void staleGeneration_doesNotDropCurrentClient() {
    MongoConnectionProvider p = new MongoConnectionProvider("test",
        new MongoConnectionSettings("mongodb://localhost:1", 2, 250));
    try {
      MongoClient first = p.getClient();
      p.onClusterClosed(0);
      assertSame(first, p.getClient());
    } finally {
      p.close();
    }
  }

  @Test
  void closedProvider_rejectsGetClient() {
    MongoConnectionProvider p = new MongoConnectionProvider("test", MongoConnectionSettings.of("mongodb://localhost:1"));
    p.close();
    assertThrows(ConnectivityException.class, p::getClient);
  }
}
