package taskboard.sync.service.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import taskboard.sync.core.port.out.TaskCacheRegion;
import taskboard.sync.core.port.out.TaskEventBus;
import taskboard.sync.domain.task.TaskAction;
import taskboard.sync.domain.task.TaskEvent;
import taskboard.sync.domain.task.TaskSnapshot;
import taskboard.sync.error.exception.CacheAccessException;
import taskboard.sync.error.exception.EventPublishException;
import taskboard.sync.infrastructure.executor.DefaultLogicExecutor;
import taskboard.sync.infrastructure.executor.policy.ExecutionPipeline;
import taskboard.sync.infrastructure.executor.strategy.ExceptionTranslator;

@ExtendWith(MockitoExtension.class)
@DisplayName("TaskChangePublisher 테스트")
class TaskChangePublisherTest {

  @Mock private TaskEventBus eventBus;
  @Mock private TaskCacheRegion cacheRegion;

  private SimpleMeterRegistry meterRegistry;
  private TaskChangePublisher publisher;

  private final TaskSnapshot snapshot = new TaskSnapshot(5L, "t", "d", true, 2L);

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    publisher =
        new TaskChangePublisher(
            eventBus,
            cacheRegion,
            new DefaultLogicExecutor(
                new ExecutionPipeline(List.of()), ExceptionTranslator.defaultTranslator()),
            meterRegistry);
  }

  @Test
  @DisplayName("append 후 같은 그룹을 무효화 (순서 보장)")
  void publishThenInvalidate() {
    // when
    PublishResult result = publisher.publishAndInvalidate(TaskAction.UPDATE, snapshot);

    // then
    InOrder order = inOrder(eventBus, cacheRegion);
    ArgumentCaptor<TaskEvent> event = ArgumentCaptor.forClass(TaskEvent.class);
    order.verify(eventBus).append(event.capture());
    order.verify(cacheRegion).invalidate(2L);

    assertThat(event.getValue()).isEqualTo(TaskEvent.of(TaskAction.UPDATE, snapshot));
    assertThat(result).isEqualTo(new PublishResult(true, true, null));
    assertThat(publishCount("success")).isEqualTo(1.0);
  }

  @Test
  @DisplayName("append 타임아웃: 무효화는 수행되고 경고가 기록된다")
  void publishFailure_stillInvalidates() {
    // given
    doThrow(new EventPublishException("ack timeout", new TimeoutException()))
        .when(eventBus)
        .append(any());

    // when
    PublishResult result = publisher.publishAndInvalidate(TaskAction.CREATE, snapshot);

    // then
    verify(cacheRegion).invalidate(2L);
    assertThat(result.published()).isFalse();
    assertThat(result.invalidated()).isTrue();
    assertThat(result.warning()).contains("ack timeout");
    assertThat(publishCount("failure")).isEqualTo(1.0);
    assertThat(publishCount("success")).isZero();
  }

  @Test
  @DisplayName("무효화 실패는 호출자에게 예외가 아닌 결과로 전달")
  void invalidateFailure_isReported() {
    doThrow(new CacheAccessException("redis down", new IllegalStateException()))
        .when(cacheRegion)
        .invalidate(2L);

    PublishResult result = publisher.publishAndInvalidate(TaskAction.DELETE, snapshot);

    assertThat(result.published()).isTrue();
    assertThat(result.invalidated()).isFalse();
    assertThat(result.hasWarning()).isFalse();
  }

  @Test
  @DisplayName("예상치 못한 런타임 예외도 무효화를 막지 않는다")
  void unexpectedFailure_stillInvalidates() {
    doThrow(new IllegalStateException("producer closed")).when(eventBus).append(any());

    PublishResult result = publisher.publishAndInvalidate(TaskAction.UPDATE, snapshot);

    verify(cacheRegion).invalidate(2L);
    assertThat(result.published()).isFalse();
    assertThat(result.warning()).isNotBlank();
  }

  private double publishCount(String status) {
    return meterRegistry.get("task.event.publish").tag("status", status).counter().count();
  }
}
