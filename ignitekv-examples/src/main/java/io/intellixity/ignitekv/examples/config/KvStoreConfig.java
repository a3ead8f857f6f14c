package io.intellixity.ignitekv.examples.config;

import io.intellixity.ignitekv.jdbc.JdbcKeyValueStores;
import io.intellixity.ignitekv.store.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(KvStoreProperties.class)
public class KvStoreConfig {
  private static final Logger log = LoggerFactory.getLogger(KvStoreConfig.class);

  @Bean(destroyMethod = "close")
  public KeyValueStore keyValueStore(KvStoreProperties props) {
    log.info("ignitekv.examples opening store location={} cache={}", props.getLocation(), props.getCache());
    return JdbcKeyValueStores.open(props.toStoreConfig(), props.getCache());
  }
}
