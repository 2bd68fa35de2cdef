package taskboard.sync.core.port.out;

import taskboard.sync.domain.task.TaskEvent;

/**
 * 순서가 보장되는 내구성 이벤트 로그 (tasks_topic)
 *
 * <p>구현체는 브로커 ack까지 블로킹하며, 설정된 타임아웃 안에 ack가 없으면 {@link
 * taskboard.sync.error.exception.EventPublishException}을 던집니다.
 */
public interface TaskEventBus {

  /**
   * 이벤트를 토픽에 append하고 브로커 ack를 기다립니다.
   *
   * @param event 발행할 이벤트
   * @throws taskboard.sync.error.exception.EventPublishException append 실패 또는 타임아웃
   */
  void append(TaskEvent event);
}
