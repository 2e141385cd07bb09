package com.zexats.admission.config;

import io.lettuce.core.RedisURI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/** Redis connection, created only when a backend URL is configured. */
@Configuration(proxyBeanMethods = false)
@ConditionalOnExpression("!'${admission.redis.url:}'.isBlank()")
public class RedisConfig {
  private static final Logger log = LoggerFactory.getLogger(RedisConfig.class);

  @Bean
  public LettuceConnectionFactory redisConnectionFactory(AdmissionProperties properties) {
    AdmissionProperties.Redis redis = properties.getRedis();
    RedisURI uri = RedisURI.create(redis.getUrl().trim());

    RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(uri.getHost(), uri.getPort());
    standalone.setDatabase(uri.getDatabase());
    if (uri.getUsername() != null) {
      standalone.setUsername(uri.getUsername());
    }
    if (uri.getPassword() != null) {
      standalone.setPassword(RedisPassword.of(uri.getPassword()));
    }

    LettuceClientConfiguration.LettuceClientConfigurationBuilder client =
        LettuceClientConfiguration.builder().commandTimeout(redis.getCommandTimeout());
    if (uri.isSsl()) {
      client.useSsl();
    }

    log.info("Admission counters backed by Redis at {}:{}/{}", uri.getHost(), uri.getPort(), uri.getDatabase());
    return new LettuceConnectionFactory(standalone, client.build());
  }

  @Bean
  public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
    return new StringRedisTemplate(connectionFactory);
  }
}
