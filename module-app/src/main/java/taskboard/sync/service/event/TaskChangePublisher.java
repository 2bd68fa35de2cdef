package taskboard.sync.service.event;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import taskboard.sync.core.port.out.TaskCacheRegion;
import taskboard.sync.core.port.out.TaskEventBus;
import taskboard.sync.domain.task.TaskAction;
import taskboard.sync.domain.task.TaskEvent;
import taskboard.sync.domain.task.TaskSnapshot;
import taskboard.sync.infrastructure.executor.LogicExecutor;
import taskboard.sync.infrastructure.executor.TaskContext;

/**
 * 커밋된 작업 변경 1건을 이벤트 버스에 발행하고 그룹 캐시를 무효화합니다.
 *
 * <h4>순서 보장</h4>
 *
 * <ol>
 *   <li>append (브로커 ack까지 블로킹, publish-timeout 상한)
 *   <li>invalidate (발행 결과와 무관하게 항상 시도)
 * </ol>
 *
 * <p>두 단계는 각각 독립적으로 보호됩니다. 발행 실패가 무효화를 막지 않고, 어느 쪽 실패도 호출자에게 예외로 전파되지 않습니다.
 */
@Slf4j
@Service
public class TaskChangePublisher {

  private final TaskEventBus eventBus;
  private final TaskCacheRegion cacheRegion;
  private final LogicExecutor executor;

  private final Counter publishSuccessCounter;
  private final Counter publishFailureCounter;

  public TaskChangePublisher(
      TaskEventBus eventBus,
      TaskCacheRegion cacheRegion,
      LogicExecutor executor,
      MeterRegistry meterRegistry) {
    this.eventBus = eventBus;
    this.cacheRegion = cacheRegion;
    this.executor = executor;
    this.publishSuccessCounter =
        Counter.builder("task.event.publish").tag("status", "success").register(meterRegistry);
    this.publishFailureCounter =
        Counter.builder("task.event.publish").tag("status", "failure").register(meterRegistry);
  }

  public PublishResult publishAndInvalidate(TaskAction action, TaskSnapshot snapshot) {
    TaskEvent event = TaskEvent.of(action, snapshot);
    String warning = publish(event);
    boolean invalidated = invalidate(snapshot.groupId());
    return new PublishResult(warning == null, invalidated, warning);
  }

  /** @return 실패 사유, 성공이면 null */
  private String publish(TaskEvent event) {
    return executor.executeOrCatch(
        () -> {
          eventBus.append(event);
          publishSuccessCounter.increment();
          return null;
        },
        e -> {
          publishFailureCounter.increment();
          String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
          log.warn(
              "[TaskChangePublisher] Publish failed, store write kept: action={}, taskId={}, groupId={}, cause={}",
              event.action().wireValue(),
              event.task().id(),
              event.groupId(),
              reason);
          return reason;
        },
        TaskContext.of("TaskChangePublisher", "Publish", "group=" + event.groupId()));
  }

  private boolean invalidate(long groupId) {
    return executor.executeOrCatch(
        () -> {
          cacheRegion.invalidate(groupId);
          return true;
        },
        e -> {
          log.warn(
              "[TaskChangePublisher] Cache invalidation failed, entry expires by TTL: groupId={}, cause={}",
              groupId,
              e.getMessage());
          return false;
        },
        TaskContext.of("TaskChangePublisher", "Invalidate", "group=" + groupId));
  }
}
