package taskboard.sync.domain.task;

import java.util.Objects;

/**
 * 커밋된 변경 1건당 1회 생성되는 작업 변경 이벤트
 *
 * <p>와이어 포맷:
 *
 * <pre>{@code
 * {"action": "create", "task": {"id": 1, "title": "..", "description": "..",
 *                                "completed": false, "group_id": 1}}
 * }</pre>
 *
 * <p>소비는 at-least-once이므로 클라이언트는 이 이벤트를 증분 diff가 아닌 "다시 읽어라"는 힌트로 취급해야 합니다.
 */
public record TaskEvent(TaskAction action, TaskSnapshot task) {

  public TaskEvent {
    Objects.requireNonNull(action, "action");
    Objects.requireNonNull(task, "task");
  }

  public static TaskEvent of(TaskAction action, TaskSnapshot task) {
    return new TaskEvent(action, task);
  }

  public long groupId() {
    return task.groupId();
  }
}
