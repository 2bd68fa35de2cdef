package taskboard.sync.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import taskboard.sync.infrastructure.config.EventBusProperties;

/**
 * tasks_topic 선언
 *
 * <p>단일 파티션으로 전역 순서를 유지합니다. 레코드 key가 group id이므로 파티션을 늘려도 그룹 내 순서는 유지됩니다.
 */
@Configuration
public class KafkaTopicConfig {

  @Bean
  public NewTopic tasksTopic(EventBusProperties properties) {
    return TopicBuilder.name(properties.getTopic()).partitions(1).replicas(1).build();
  }
}
