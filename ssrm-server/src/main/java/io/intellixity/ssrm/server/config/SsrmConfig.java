package io.intellixity.ssrm.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClient;
import io.intellixity.ssrm.exec.SsrmEngine;
import io.intellixity.ssrm.exec.handle.ConnectionProvider;
import io.intellixity.ssrm.mongo.MongoConnectionProvider;
import io.intellixity.ssrm.mongo.MongoConnectionSettings;
import io.intellixity.ssrm.mongo.MongoSsrmEngine;
import io.intellixity.ssrm.request.SsrmRequestParser;
import io.intellixity.ssrm.server.web.BasePipelineResolver;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SsrmProperties.class)
public class SsrmConfig {

  @Bean(destroyMethod = "close")
  public MongoConnectionProvider mongoConnectionProvider(SsrmProperties props) {
    SsrmProperties.Mongo m = props.getMongo();
    return new MongoConnectionProvider("mongo",
        new MongoConnectionSettings(m.getUri(), m.getMaxPoolSize(), m.getConnectTimeoutMs()));
  }

  @Bean
  public SsrmEngine ssrmEngine(ConnectionProvider<MongoClient> mongoConnectionProvider) {
    return new MongoSsrmEngine(mongoConnectionProvider);
  }

  @Bean
  public SsrmRequestParser ssrmRequestParser(ObjectMapper objectMapper, SsrmProperties props) {
    return new SsrmRequestParser(objectMapper, props.getMaxPageSize());
  }

  @Bean
  public BasePipelineResolver basePipelineResolver(ObjectMapper objectMapper, SsrmProperties props) {
    return new BasePipelineResolver(objectMapper, props.getTenant().getField(), props.getTenant().getHeader());
  }
}
