package taskboard.sync.service.task;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import taskboard.sync.core.port.out.TaskStore;
import taskboard.sync.domain.task.TaskAction;
import taskboard.sync.domain.task.TaskPatch;
import taskboard.sync.domain.task.TaskRecord;
import taskboard.sync.domain.task.TaskSnapshot;
import taskboard.sync.error.exception.InternalSystemException;
import taskboard.sync.error.exception.TaskNotFoundException;
import taskboard.sync.infrastructure.executor.DefaultLogicExecutor;
import taskboard.sync.infrastructure.executor.policy.ExecutionPipeline;
import taskboard.sync.infrastructure.executor.strategy.ExceptionTranslator;
import taskboard.sync.service.event.PublishResult;
import taskboard.sync.service.event.TaskChangePublisher;

@ExtendWith(MockitoExtension.class)
@DisplayName("TaskCommandService 테스트")
class TaskCommandServiceTest {

  private static final LocalDateTime CREATED_AT = LocalDateTime.of(2024, 1, 1, 9, 0);
  private static final PublishResult OK = new PublishResult(true, true, null);

  @Mock private TaskStore taskStore;
  @Mock private TaskChangePublisher publisher;

  private TaskCommandService service;

  @BeforeEach
  void setUp() {
    service =
        new TaskCommandService(
            taskStore,
            publisher,
            new DefaultLogicExecutor(
                new ExecutionPipeline(List.of()), ExceptionTranslator.defaultTranslator()));
  }

  @Test
  @DisplayName("create: 저장 후 CREATE 발행 1회")
  void create_publishesOnce() {
    // given
    TaskRecord created = new TaskRecord(1L, "Buy milk", "2L", false, CREATED_AT, 1L);
    when(taskStore.create(1L, "Buy milk", "2L")).thenReturn(created);
    when(publisher.publishAndInvalidate(TaskAction.CREATE, created.toSnapshot())).thenReturn(OK);

    // when
    MutationResult result = service.create(1L, "Buy milk", "2L");

    // then
    InOrder order = inOrder(taskStore, publisher);
    order.verify(taskStore).create(1L, "Buy milk", "2L");
    order.verify(publisher).publishAndInvalidate(TaskAction.CREATE, created.toSnapshot());
    assertThat(result.task()).isEqualTo(new TaskSnapshot(1L, "Buy milk", "2L", false, 1L));
    assertThat(result.hasWarning()).isFalse();
  }

  @Test
  @DisplayName("update: 부분 수정은 누락 필드를 유지")
  void update_appliesPartialPatch() {
    TaskRecord current = new TaskRecord(5L, "title", "desc", false, CREATED_AT, 2L);
    TaskRecord expected = new TaskRecord(5L, "title", "desc", true, CREATED_AT, 2L);
    when(taskStore.findById(5L)).thenReturn(Optional.of(current));
    when(taskStore.update(expected)).thenReturn(expected);
    when(publisher.publishAndInvalidate(TaskAction.UPDATE, expected.toSnapshot())).thenReturn(OK);

    MutationResult result = service.update(2L, 5L, TaskPatch.completed(true));

    assertThat(result.task().completed()).isTrue();
    assertThat(result.task().title()).isEqualTo("title");
  }

  @Test
  @DisplayName("update: 다른 그룹 작업은 not found, 발행하지 않음")
  void update_rejectsForeignGroup() {
    when(taskStore.findById(5L))
        .thenReturn(Optional.of(new TaskRecord(5L, "t", "d", false, CREATED_AT, 3L)));

    assertThatThrownBy(() -> service.update(2L, 5L, TaskPatch.completed(true)))
        .isInstanceOf(TaskNotFoundException.class);
    verify(taskStore, never()).update(any());
    verifyNoInteractions(publisher);
  }

  @Test
  @DisplayName("delete: 없는 작업은 not found")
  void delete_missingTask() {
    when(taskStore.findById(9L)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.delete(1L, 9L)).isInstanceOf(TaskNotFoundException.class);
    verify(taskStore, never()).delete(anyLong());
    verifyNoInteractions(publisher);
  }

  @Test
  @DisplayName("delete: 삭제 전 스냅샷으로 DELETE 발행")
  void delete_publishesPreDeleteSnapshot() {
    TaskRecord current = new TaskRecord(5L, "t", "d", true, CREATED_AT, 2L);
    when(taskStore.findById(5L)).thenReturn(Optional.of(current));
    when(publisher.publishAndInvalidate(TaskAction.DELETE, current.toSnapshot())).thenReturn(OK);

    MutationResult result = service.delete(2L, 5L);

    InOrder order = inOrder(taskStore, publisher);
    order.verify(taskStore).delete(5L);
    order.verify(publisher).publishAndInvalidate(TaskAction.DELETE, current.toSnapshot());
    assertThat(result.task()).isEqualTo(current.toSnapshot());
  }

  @Test
  @DisplayName("발행 경고는 예외가 아닌 결과로 노출")
  void publishWarning_isSurfaced() {
    TaskRecord created = new TaskRecord(1L, "t", "d", false, CREATED_AT, 1L);
    when(taskStore.create(1L, "t", "d")).thenReturn(created);
    when(publisher.publishAndInvalidate(TaskAction.CREATE, created.toSnapshot()))
        .thenReturn(new PublishResult(false, true, "ack timeout"));

    MutationResult result = service.create(1L, "t", "d");

    assertThat(result.hasWarning()).isTrue();
    assertThat(result.publish().invalidated()).isTrue();
  }

  @Test
  @DisplayName("delete: 저장소 삭제 실패는 번역되어 전파, 발행하지 않음")
  void delete_storeFailure_doesNotPublish() {
    // given
    TaskRecord current = new TaskRecord(5L, "t", "d", false, CREATED_AT, 2L);
    when(taskStore.findById(5L)).thenReturn(Optional.of(current));
    doThrow(new IllegalStateException("connection reset")).when(taskStore).delete(5L);

    // when & then
    assertThatThrownBy(() -> service.delete(2L, 5L))
        .isInstanceOf(InternalSystemException.class)
        .hasCauseInstanceOf(IllegalStateException.class);
    verifyNoInteractions(publisher);
  }
}
