package taskboard.sync.infrastructure.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import taskboard.sync.domain.task.TaskEvent;
import taskboard.sync.infrastructure.executor.LogicExecutor;
import taskboard.sync.infrastructure.executor.TaskContext;
import taskboard.sync.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * tasks_topic 레코드 값 ↔ {@link TaskEvent} 변환기 (UTF-8 JSON)
 *
 * <ul>
 *   <li>encode 실패 → EventPublishException (발행 경로)
 *   <li>decode 실패 → EventRelayException(E003) (relay 경로, worker에 치명적)
 * </ul>
 */
@RequiredArgsConstructor
public class TaskEventCodec {

  /** 로그 컨텍스트에 남길 원문 최대 길이 */
  private static final int PREVIEW_LENGTH = 120;

  private final ObjectMapper objectMapper;
  private final LogicExecutor executor;

  public String encode(TaskEvent event) {
    return executor.executeWithTranslation(
        () -> objectMapper.writeValueAsString(event),
        ExceptionTranslator.forEventBus(),
        TaskContext.of("TaskEventCodec", "Encode", "group=" + event.groupId()));
  }

  public TaskEvent decode(String payload) {
    return executor.executeWithTranslation(
        () -> readEvent(payload),
        ExceptionTranslator.forJson(),
        TaskContext.of("TaskEventCodec", "Decode", preview(payload)));
  }

  private TaskEvent readEvent(String payload) throws Exception {
    if (payload == null) {
      throw new IllegalArgumentException("record value is null");
    }
    TaskEvent event = objectMapper.readValue(payload, TaskEvent.class);
    if (event == null) {
      throw new IllegalArgumentException("record value is JSON null");
    }
    return event;
  }

  private static String preview(String payload) {
    if (payload == null) {
      return "null";
    }
    return payload.length() <= PREVIEW_LENGTH ? payload : payload.substring(0, PREVIEW_LENGTH) + "...";
  }
}
