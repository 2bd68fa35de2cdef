package taskboard.sync.service.task;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import taskboard.sync.core.port.out.TaskStore;
import taskboard.sync.domain.task.TaskAction;
import taskboard.sync.domain.task.TaskPatch;
import taskboard.sync.domain.task.TaskRecord;
import taskboard.sync.domain.task.TaskSnapshot;
import taskboard.sync.error.exception.TaskNotFoundException;
import taskboard.sync.infrastructure.executor.LogicExecutor;
import taskboard.sync.infrastructure.executor.TaskContext;
import taskboard.sync.service.event.PublishResult;
import taskboard.sync.service.event.TaskChangePublisher;

/**
 * 작업 변경 처리
 *
 * <p>저장소 커밋 1건당 {@link TaskChangePublisher#publishAndInvalidate}를 정확히 1회 호출합니다. 다른 그룹 소유의 작업은 없는
 * 작업과 구분하지 않고 {@link TaskNotFoundException}으로 거절합니다.
 *
 * <p>저장소 쓰기 실패는 {@link LogicExecutor}가 번역해 던지며, 이 경우 발행하지 않습니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskCommandService {

  private final TaskStore taskStore;
  private final TaskChangePublisher publisher;
  private final LogicExecutor executor;

  public MutationResult create(long groupId, String title, String description) {
    TaskRecord created =
        executor.execute(
            () -> taskStore.create(groupId, title, description),
            TaskContext.of("TaskCommand", "Create", "group=" + groupId));
    return publish(TaskAction.CREATE, created.toSnapshot());
  }

  /** 부분 수정: patch의 null 필드는 기존 값 유지 */
  public MutationResult update(long groupId, long taskId, TaskPatch patch) {
    TaskRecord current = findOwned(groupId, taskId);
    TaskRecord updated =
        executor.execute(
            () -> taskStore.update(current.apply(patch)),
            TaskContext.of("TaskCommand", "Update", "task=" + taskId));
    return publish(TaskAction.UPDATE, updated.toSnapshot());
  }

  /** 삭제 전 스냅샷을 캡처하여 이벤트에 싣습니다. */
  public MutationResult delete(long groupId, long taskId) {
    TaskSnapshot snapshot = findOwned(groupId, taskId).toSnapshot();
    executor.executeVoid(
        () -> taskStore.delete(taskId), TaskContext.of("TaskCommand", "Delete", "task=" + taskId));
    return publish(TaskAction.DELETE, snapshot);
  }

  private TaskRecord findOwned(long groupId, long taskId) {
    return taskStore
        .findById(taskId)
        .filter(task -> task.belongsTo(groupId))
        .orElseThrow(() -> new TaskNotFoundException(taskId, groupId));
  }

  private MutationResult publish(TaskAction action, TaskSnapshot snapshot) {
    PublishResult result = publisher.publishAndInvalidate(action, snapshot);
    log.debug(
        "[TaskCommand] Committed: action={}, taskId={}, groupId={}, published={}, invalidated={}",
        action.wireValue(),
        snapshot.id(),
        snapshot.groupId(),
        result.published(),
        result.invalidated());
    return new MutationResult(snapshot, result);
  }
}
