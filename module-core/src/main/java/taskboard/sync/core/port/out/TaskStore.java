package taskboard.sync.core.port.out;

import java.util.List;
import java.util.Optional;
import taskboard.sync.domain.task.TaskRecord;

/**
 * 작업 행 저장소 (외부 협력자)
 *
 * <p>각 메서드는 반환 시점에 커밋이 완료된 것으로 간주합니다.
 */
public interface TaskStore {

  TaskRecord create(long groupId, String title, String description);

  Optional<TaskRecord> findById(long taskId);

  TaskRecord update(TaskRecord task);

  void delete(long taskId);

  /** 그룹의 작업 목록 (id 오름차순) */
  List<TaskRecord> findByGroupId(long groupId);
}
