package taskboard.sync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.redisson.api.RedissonClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaTemplate;
import taskboard.sync.core.port.out.TaskCacheRegion;
import taskboard.sync.core.port.out.TaskEventBroadcaster;
import taskboard.sync.core.port.out.TaskEventBus;
import taskboard.sync.core.port.out.TaskStore;
import taskboard.sync.infrastructure.broadcast.ChannelTaskEventBroadcaster;
import taskboard.sync.infrastructure.cache.LocalTaskCacheRegion;
import taskboard.sync.infrastructure.cache.RedisTaskCacheRegion;
import taskboard.sync.infrastructure.config.EventBusProperties;
import taskboard.sync.infrastructure.config.SocketIoProperties;
import taskboard.sync.infrastructure.config.TaskCacheProperties;
import taskboard.sync.infrastructure.executor.LogicExecutor;
import taskboard.sync.infrastructure.messaging.KafkaTaskEventBus;
import taskboard.sync.infrastructure.messaging.TaskEventCodec;
import taskboard.sync.infrastructure.persistence.InMemoryTaskStore;

/**
 * module-infra 어댑터를 port 빈으로 등록
 *
 * <h4>캐시 전략 선택 ({@code app.cache.type})</h4>
 *
 * <ul>
 *   <li>redis (기본): {@link RedisTaskCacheRegion}
 *   <li>local: {@link LocalTaskCacheRegion}
 * </ul>
 */
@Configuration
@EnableConfigurationProperties({
  EventBusProperties.class,
  TaskCacheProperties.class,
  SocketIoProperties.class
})
public class TaskSyncInfraConfig {

  @Bean
  public TaskEventCodec taskEventCodec(ObjectMapper objectMapper, LogicExecutor executor) {
    return new TaskEventCodec(objectMapper, executor);
  }

  @Bean
  public TaskEventBus taskEventBus(
      KafkaTemplate<String, String> kafkaTemplate,
      TaskEventCodec codec,
      EventBusProperties properties,
      LogicExecutor executor) {
    return new KafkaTaskEventBus(kafkaTemplate, codec, properties, executor);
  }

  @Bean
  public TaskEventBroadcaster taskEventBroadcaster(
      SocketIoProperties properties, LogicExecutor executor, MeterRegistry meterRegistry) {
    return new ChannelTaskEventBroadcaster(properties.getEventName(), executor, meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean(TaskStore.class)
  public TaskStore taskStore() {
    return new InMemoryTaskStore();
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "app.cache",
      name = "type",
      havingValue = "redis",
      matchIfMissing = true)
  public TaskCacheRegion redisTaskCacheRegion(
      RedissonClient redissonClient,
      ObjectMapper objectMapper,
      TaskCacheProperties properties,
      LogicExecutor executor,
      MeterRegistry meterRegistry) {
    return new RedisTaskCacheRegion(
        redissonClient, objectMapper, properties, executor, meterRegistry);
  }

  @Bean
  @ConditionalOnProperty(prefix = "app.cache", name = "type", havingValue = "local")
  public TaskCacheRegion localTaskCacheRegion(TaskCacheProperties properties) {
    return new LocalTaskCacheRegion(properties);
  }
}
