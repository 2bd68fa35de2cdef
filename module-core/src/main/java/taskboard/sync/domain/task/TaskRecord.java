package taskboard.sync.domain.task;

import java.time.LocalDateTime;
import java.util.Objects;

/** 저장소(TaskStore)가 돌려주는 작업 행 */
public record TaskRecord(
    long id,
    String title,
    String description,
    boolean completed,
    LocalDateTime createdAt,
    long groupId) {

  public TaskRecord {
    Objects.requireNonNull(createdAt, "createdAt");
  }

  public boolean belongsTo(long candidateGroupId) {
    return groupId == candidateGroupId;
  }

  public TaskRecord apply(TaskPatch patch) {
    return new TaskRecord(
        id,
        patch.title() != null ? patch.title() : title,
        patch.description() != null ? patch.description() : description,
        patch.completed() != null ? patch.completed() : completed,
        createdAt,
        groupId);
  }

  public TaskSnapshot toSnapshot() {
    return new TaskSnapshot(id, title, description, completed, groupId);
  }

  public TaskView toView() {
    return new TaskView(id, title, description, completed, createdAt);
  }
}
