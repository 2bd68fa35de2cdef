package taskboard.sync.config;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Redisson 단일 서버 구성. local 캐시 모드에서는 생성하지 않습니다. */
@Configuration
@ConditionalOnProperty(prefix = "app.cache", name = "type", havingValue = "redis", matchIfMissing = true)
public class RedissonConfig {

  private static final String REDISSON_HOST_PREFIX = "redis://";

  @Value("${spring.data.redis.host:localhost}")
  private String host;

  @Value("${spring.data.redis.port:6379}")
  private int port;

  @Bean(destroyMethod = "shutdown")
  public RedissonClient redissonClient() {
    Config config = new Config();
    config
        .useSingleServer()
        .setAddress(REDISSON_HOST_PREFIX + host + ":" + port)
        .setConnectionMinimumIdleSize(2)
        .setConnectTimeout(3000)
        .setTimeout(3000)
        .setRetryAttempts(1);
    return Redisson.create(config);
  }
}
