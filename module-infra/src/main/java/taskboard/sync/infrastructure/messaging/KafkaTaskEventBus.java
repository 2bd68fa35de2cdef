package taskboard.sync.infrastructure.messaging;

import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import taskboard.sync.core.port.out.TaskEventBus;
import taskboard.sync.domain.task.TaskEvent;
import taskboard.sync.infrastructure.config.EventBusProperties;
import taskboard.sync.infrastructure.executor.LogicExecutor;
import taskboard.sync.infrastructure.executor.TaskContext;
import taskboard.sync.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * Kafka 기반 {@link TaskEventBus}
 *
 * <h4>Record 구조</h4>
 *
 * <ul>
 *   <li>key: group id (파티션이 늘어나도 그룹 내 순서 유지)
 *   <li>value: {@link TaskEventCodec} JSON
 * </ul>
 *
 * <p>브로커 ack를 {@code app.event-bus.publish-timeout}까지 블로킹 대기합니다. 타임아웃, 브로커 오류, 직렬화 실패는 모두
 * {@link taskboard.sync.error.exception.EventPublishException}으로 번역됩니다.
 */
@Slf4j
@RequiredArgsConstructor
public class KafkaTaskEventBus implements TaskEventBus {

  private final KafkaTemplate<String, String> kafkaTemplate;
  private final TaskEventCodec codec;
  private final EventBusProperties properties;
  private final LogicExecutor executor;

  @Override
  public void append(TaskEvent event) {
    String key = String.valueOf(event.groupId());
    executor.executeWithTranslation(
        () -> {
          send(key, event);
          return null;
        },
        ExceptionTranslator.forEventBus(),
        TaskContext.of("TaskEventBus", "Append", "group=" + key));
  }

  private void send(String key, TaskEvent event) throws Exception {
    String payload = codec.encode(event);
    SendResult<String, String> result =
        kafkaTemplate
            .send(properties.getTopic(), key, payload)
            .get(properties.getPublishTimeout().toMillis(), TimeUnit.MILLISECONDS);

    if (result != null && result.getRecordMetadata() != null) {
      log.debug(
          "[TaskEventBus] Appended: action={}, taskId={}, partition={}, offset={}",
          event.action().wireValue(),
          event.task().id(),
          result.getRecordMetadata().partition(),
          result.getRecordMetadata().offset());
    }
  }
}
