package taskboard.sync.service.task;

import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import taskboard.sync.core.port.out.TaskCacheRegion;
import taskboard.sync.core.port.out.TaskStore;
import taskboard.sync.domain.task.TaskRecord;
import taskboard.sync.domain.task.TaskView;
import taskboard.sync.infrastructure.executor.LogicExecutor;
import taskboard.sync.infrastructure.executor.TaskContext;

/** 그룹 작업 목록 조회 (cache-aside) */
@Service
@RequiredArgsConstructor
public class TaskQueryService {

  private final TaskCacheRegion cacheRegion;
  private final TaskStore taskStore;
  private final LogicExecutor executor;

  public List<TaskView> getTasks(long groupId) {
    return executor.execute(
        () -> cacheRegion.getOrLoad(groupId, this::loadFromStore),
        TaskContext.of("TaskQuery", "GetTasks", "group=" + groupId));
  }

  private List<TaskView> loadFromStore(long groupId) {
    return taskStore.findByGroupId(groupId).stream().map(TaskRecord::toView).toList();
  }
}
