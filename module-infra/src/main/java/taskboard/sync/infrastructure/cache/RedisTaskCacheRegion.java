package taskboard.sync.infrastructure.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RBucket;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import taskboard.sync.core.port.out.TaskCacheRegion;
import taskboard.sync.core.port.out.TaskLoader;
import taskboard.sync.domain.task.TaskView;
import taskboard.sync.error.exception.DistributedLockException;
import taskboard.sync.infrastructure.config.TaskCacheProperties;
import taskboard.sync.infrastructure.executor.LogicExecutor;
import taskboard.sync.infrastructure.executor.TaskContext;
import taskboard.sync.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * Redis 기반 그룹별 작업 목록 캐시
 *
 * <h4>저장 구조</h4>
 *
 * <ul>
 *   <li>{@code tasks:group:{groupId}} → JSON 배열 문자열 (StringCodec, TTL)
 *   <li>{@code tasks:group:{groupId}:lock} → load coalescing용 RLock
 * </ul>
 *
 * <h4>Cache Stampede 방지</h4>
 *
 * <ul>
 *   <li>Leader: 락 획득 → Double-check → loader 실행 → 저장
 *   <li>Follower: 락 대기 → Double-check에서 Leader가 저장한 값 사용
 *   <li>락 실패 시: loader 직접 실행, 캐시에 저장하지 않음 (가용성 우선)
 * </ul>
 *
 * <p>Redis 읽기 장애는 miss로 취급하여 저장소에서 직접 적재합니다.
 */
@Slf4j
public class RedisTaskCacheRegion implements TaskCacheRegion {

  private static final TypeReference<List<TaskView>> TASK_LIST = new TypeReference<>() {};
  private static final String LOCK_SUFFIX = ":lock";

  private final RedissonClient redissonClient;
  private final ObjectMapper objectMapper;
  private final TaskCacheProperties properties;
  private final LogicExecutor executor;

  private final Counter hitCounter;
  private final Counter missCounter;
  private final Counter lockFailureCounter;

  public RedisTaskCacheRegion(
      RedissonClient redissonClient,
      ObjectMapper objectMapper,
      TaskCacheProperties properties,
      LogicExecutor executor,
      MeterRegistry meterRegistry) {
    this.redissonClient = redissonClient;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.executor = executor;
    this.hitCounter = cacheCounter(meterRegistry, "hit");
    this.missCounter = cacheCounter(meterRegistry, "miss");
    this.lockFailureCounter = cacheCounter(meterRegistry, "lock_failure");
  }

  private static Counter cacheCounter(MeterRegistry registry, String result) {
    return Counter.builder("task.cache.requests")
        .tag("region", "redis")
        .tag("result", result)
        .register(registry);
  }

  @Override
  public List<TaskView> getOrLoad(long groupId, TaskLoader loader) {
    String key = cacheKey(groupId);
    List<TaskView> cached = readCached(key);
    if (cached != null) {
      hitCounter.increment();
      return cached;
    }
    return loadWithLock(groupId, key, loader);
  }

  @Override
  public void invalidate(long groupId) {
    String key = cacheKey(groupId);
    boolean deleted =
        executor.executeWithTranslation(
            () -> bucket(key).delete(),
            ExceptionTranslator.forCache(),
            TaskContext.of("TaskCache", "Invalidate", key));
    log.debug("[TaskCache] Invalidated: key={}, existed={}", key, deleted);
  }

  private List<TaskView> loadWithLock(long groupId, String key, TaskLoader loader) {
    String lockKey = key + LOCK_SUFFIX;
    RLock lock = redissonClient.getLock(lockKey);

    try {
      acquire(lock, lockKey);
    } catch (DistributedLockException e) {
      log.warn("[TaskCache] {}, loading without cache: key={}", e.getMessage(), key);
      lockFailureCounter.increment();
      missCounter.increment();
      return loader.loadTasks(groupId);
    }

    return executor.executeWithFinally(
        () -> doubleCheckAndLoad(groupId, key, loader),
        () -> unlockSafely(lock),
        TaskContext.of("TaskCache", "DoubleCheckLoad", key));
  }

  /** 대기 시간 초과와 Redis 장애 모두 {@link DistributedLockException}으로 던집니다. */
  private void acquire(RLock lock, String lockKey) {
    boolean acquired =
        executor.executeWithTranslation(
            () ->
                lock.tryLock(
                    properties.getLockWait().toMillis(),
                    properties.getLockLease().toMillis(),
                    TimeUnit.MILLISECONDS),
            ExceptionTranslator.forLock(),
            TaskContext.of("TaskCache", "AcquireLock", lockKey));
    if (!acquired) {
      throw new DistributedLockException(lockKey);
    }
  }

  private List<TaskView> doubleCheckAndLoad(long groupId, String key, TaskLoader loader) {
    List<TaskView> cached = readCached(key);
    if (cached != null) {
      hitCounter.increment();
      return cached;
    }

    missCounter.increment();
    List<TaskView> loaded = loader.loadTasks(groupId);
    write(key, loaded);
    return loaded;
  }

  private List<TaskView> readCached(String key) {
    return executor.executeOrDefault(
        () -> {
          String json = bucket(key).get();
          return json == null ? null : objectMapper.readValue(json, TASK_LIST);
        },
        null,
        TaskContext.of("TaskCache", "Read", key));
  }

  /** 저장 실패는 다음 요청의 miss로 이어질 뿐이므로 무시하고 진행 */
  private void write(String key, List<TaskView> tasks) {
    executor.executeOrDefault(
        () -> {
          bucket(key)
              .set(
                  objectMapper.writeValueAsString(tasks),
                  properties.getTtl().toMillis(),
                  TimeUnit.MILLISECONDS);
          return true;
        },
        false,
        TaskContext.of("TaskCache", "Write", key));
  }

  private void unlockSafely(RLock lock) {
    executor.executeOrDefault(
        () -> {
          if (lock.isHeldByCurrentThread()) {
            lock.unlock();
          }
          return null;
        },
        null,
        TaskContext.of("TaskCache", "Unlock", lock.getName()));
  }

  private RBucket<String> bucket(String key) {
    return redissonClient.getBucket(key, StringCodec.INSTANCE);
  }

  private String cacheKey(long groupId) {
    return properties.getKeyPrefix() + groupId;
  }
}
