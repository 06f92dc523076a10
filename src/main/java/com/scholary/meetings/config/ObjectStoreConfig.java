package com.scholary.meetings.config;

import com.scholary.meetings.objectstore.ObjectStoreClient;
import com.scholary.meetings.objectstore.ObjectStoreProperties;
import com.scholary.meetings.objectstore.S3ObjectStoreClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>Wires the ObjectStoreClient used to fetch {@code s3://} recordings. The client is closed with
 * the application context.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean(destroyMethod = "close")
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }
}
