package taskboard.sync.core.port.out;

import java.util.List;
import taskboard.sync.domain.task.TaskView;

/**
 * 그룹별 작업 목록 캐시 (TTL + 명시적 무효화)
 *
 * <p>무효화가 누락되더라도 TTL로 staleness 상한이 보장됩니다.
 */
public interface TaskCacheRegion {

  /**
   * 캐시 값을 반환하고, miss면 loader로 적재 후 TTL과 함께 저장합니다.
   *
   * <p>동일 키의 동시 miss는 가능한 한 loader 1회 호출로 합쳐집니다.
   */
  List<TaskView> getOrLoad(long groupId, TaskLoader loader);

  /** 그룹 엔트리를 즉시 제거합니다. 이후 getOrLoad는 miss가 됩니다. */
  void invalidate(long groupId);
}
