package com.acme.relay.redis;

import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import io.micronaut.core.annotation.Nullable;
import jakarta.inject.Singleton;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;

@Factory
@Requires(property = "redisson.enabled", value = "true", defaultValue = "true")
public class RedissonFactory {

  @Singleton
  @Bean(preDestroy = "shutdown")
  @Requires(property = "redisson.address")
  public RedissonClient redissonClient(
      @Property(name = "redisson.address") String address,
      @Nullable @Property(name = "redisson.password") String password) {
    return Redisson.create(config(address, password));
  }

  /** Builds single-server settings; a bare {@code host:port} address gets the redis:// scheme. */
  static Config config(String address, String password) {
    Config config = new Config();
    var server = config.useSingleServer().setAddress(normalizeAddress(address));
    if (password != null && !password.isEmpty()) {
      server.setPassword(password);
    }
    return config;
  }

  static String normalizeAddress(String address) {
    if (address.startsWith("redis://") || address.startsWith("rediss://")) {
      return address;
    }
    return "redis://" + address;
  }
}
