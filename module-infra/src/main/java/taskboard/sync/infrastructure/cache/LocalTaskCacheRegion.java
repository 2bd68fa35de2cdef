package taskboard.sync.infrastructure.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import taskboard.sync.core.port.out.TaskCacheRegion;
import taskboard.sync.core.port.out.TaskLoader;
import taskboard.sync.domain.task.TaskView;
import taskboard.sync.infrastructure.config.TaskCacheProperties;

/**
 * 단일 인스턴스용 Caffeine 캐시
 *
 * <p>{@code Cache.get(key, mappingFunction)}은 키 단위로 원자적이므로 같은 그룹의 동시 miss는 loader 1회 호출로 합쳐집니다.
 */
@Slf4j
public class LocalTaskCacheRegion implements TaskCacheRegion {

  private static final long MAXIMUM_SIZE = 10_000;

  private final Cache<Long, List<TaskView>> cache;

  public LocalTaskCacheRegion(TaskCacheProperties properties) {
    this(properties, Ticker.systemTicker());
  }

  LocalTaskCacheRegion(TaskCacheProperties properties, Ticker ticker) {
    this.cache =
        Caffeine.newBuilder()
            .expireAfterWrite(properties.getTtl())
            .maximumSize(MAXIMUM_SIZE)
            .ticker(ticker)
            .build();
  }

  @Override
  public List<TaskView> getOrLoad(long groupId, TaskLoader loader) {
    return cache.get(groupId, key -> List.copyOf(loader.loadTasks(key)));
  }

  @Override
  public void invalidate(long groupId) {
    cache.invalidate(groupId);
    log.debug("[TaskCache] Invalidated local entry: groupId={}", groupId);
  }
}
