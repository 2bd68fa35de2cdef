package taskboard.sync.core.port.out;

import java.util.List;
import taskboard.sync.domain.task.TaskView;

/** 캐시 miss 시 호출되는 저장소 기반 로더 */
@FunctionalInterface
public interface TaskLoader {

  List<TaskView> loadTasks(long groupId);
}
