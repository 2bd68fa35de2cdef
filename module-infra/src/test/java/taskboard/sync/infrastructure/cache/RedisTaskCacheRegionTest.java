package taskboard.sync.infrastructure.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RBucket;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.Codec;
import taskboard.sync.core.port.out.TaskLoader;
import taskboard.sync.domain.task.TaskView;
import taskboard.sync.error.exception.CacheAccessException;
import taskboard.sync.infrastructure.config.TaskCacheProperties;
import taskboard.sync.infrastructure.executor.DefaultLogicExecutor;
import taskboard.sync.infrastructure.executor.policy.ExecutionPipeline;
import taskboard.sync.infrastructure.executor.strategy.ExceptionTranslator;

@ExtendWith(MockitoExtension.class)
@DisplayName("RedisTaskCacheRegion 테스트")
class RedisTaskCacheRegionTest {

  private static final String KEY = "tasks:group:2";

  @Mock private RedissonClient redissonClient;
  @Mock private RBucket<String> bucket;
  @Mock private RLock lock;

  private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final List<TaskView> tasks =
      List.of(
          new TaskView(1L, "a", "", false, LocalDateTime.of(2024, 1, 1, 9, 0)),
          new TaskView(5L, "b", "", true, LocalDateTime.of(2024, 1, 2, 9, 0)));

  private RedisTaskCacheRegion region;
  private AtomicInteger loads;
  private TaskLoader loader;

  @BeforeEach
  void setUp() {
    region =
        new RedisTaskCacheRegion(
            redissonClient,
            objectMapper,
            new TaskCacheProperties(),
            new DefaultLogicExecutor(
                new ExecutionPipeline(List.of()), ExceptionTranslator.defaultTranslator()),
            meterRegistry);
    loads = new AtomicInteger();
    loader =
        groupId -> {
          loads.incrementAndGet();
          return tasks;
        };
  }

  @Test
  @DisplayName("hit: 저장소를 읽지 않고 캐시 값을 반환")
  void getOrLoad_hit() throws Exception {
    // given
    when(redissonClient.<String>getBucket(eq(KEY), any(Codec.class))).thenReturn(bucket);
    when(bucket.get()).thenReturn(objectMapper.writeValueAsString(tasks));

    // when
    List<TaskView> result = region.getOrLoad(2L, loader);

    // then
    assertThat(result).isEqualTo(tasks);
    assertThat(loads).hasValue(0);
    verify(redissonClient, never()).getLock(anyString());
  }

  @Test
  @DisplayName("miss: 락 획득 → double-check → 적재 → TTL과 함께 저장 → 해제")
  void getOrLoad_missLoadsAndStores() throws Exception {
    // given
    when(redissonClient.<String>getBucket(eq(KEY), any(Codec.class))).thenReturn(bucket);
    when(bucket.get()).thenReturn(null);
    when(redissonClient.getLock(KEY + ":lock")).thenReturn(lock);
    when(lock.tryLock(anyLong(), anyLong(), eq(TimeUnit.MILLISECONDS))).thenReturn(true);
    when(lock.isHeldByCurrentThread()).thenReturn(true);

    // when
    List<TaskView> result = region.getOrLoad(2L, loader);

    // then
    assertThat(result).isEqualTo(tasks);
    assertThat(loads).hasValue(1);
    verify(bucket).set(anyString(), eq(60_000L), eq(TimeUnit.MILLISECONDS));
    verify(lock).unlock();
  }

  @Test
  @DisplayName("double-check: 락 대기 중 다른 요청이 채운 값은 재사용")
  void getOrLoad_doubleCheckHit() throws Exception {
    when(redissonClient.<String>getBucket(eq(KEY), any(Codec.class))).thenReturn(bucket);
    when(bucket.get()).thenReturn(null, objectMapper.writeValueAsString(tasks));
    when(redissonClient.getLock(KEY + ":lock")).thenReturn(lock);
    when(lock.tryLock(anyLong(), anyLong(), eq(TimeUnit.MILLISECONDS))).thenReturn(true);
    when(lock.isHeldByCurrentThread()).thenReturn(true);

    List<TaskView> result = region.getOrLoad(2L, loader);

    assertThat(result).isEqualTo(tasks);
    assertThat(loads).hasValue(0);
    verify(bucket, never()).set(anyString(), anyLong(), any(TimeUnit.class));
  }

  @Test
  @DisplayName("락 대기 타임아웃: 캐시에 저장하지 않고 직접 적재")
  void getOrLoad_lockTimeoutLoadsWithoutCaching() throws Exception {
    when(redissonClient.<String>getBucket(eq(KEY), any(Codec.class))).thenReturn(bucket);
    when(bucket.get()).thenReturn(null);
    when(redissonClient.getLock(KEY + ":lock")).thenReturn(lock);
    when(lock.tryLock(anyLong(), anyLong(), eq(TimeUnit.MILLISECONDS))).thenReturn(false);

    List<TaskView> result = region.getOrLoad(2L, loader);

    assertThat(result).isEqualTo(tasks);
    assertThat(loads).hasValue(1);
    verify(bucket, never()).set(anyString(), anyLong(), any(TimeUnit.class));
    assertThat(
            meterRegistry
                .get("task.cache.requests")
                .tag("result", "lock_failure")
                .counter()
                .count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("Redis 장애: 저장소에서 직접 적재 (Graceful Degradation)")
  void getOrLoad_redisDown() throws Exception {
    when(redissonClient.<String>getBucket(eq(KEY), any(Codec.class)))
        .thenThrow(new IllegalStateException("connection refused"));
    when(redissonClient.getLock(KEY + ":lock")).thenReturn(lock);
    when(lock.tryLock(anyLong(), anyLong(), eq(TimeUnit.MILLISECONDS)))
        .thenThrow(new IllegalStateException("connection refused"));

    List<TaskView> result = region.getOrLoad(2L, loader);

    assertThat(result).isEqualTo(tasks);
    assertThat(loads).hasValue(1);
  }

  @Test
  @DisplayName("락 대기 중 인터럽트: 락 실패로 처리해 직접 적재, 인터럽트 플래그 복원")
  void getOrLoad_lockInterrupted() throws Exception {
    // given
    when(redissonClient.<String>getBucket(eq(KEY), any(Codec.class))).thenReturn(bucket);
    when(bucket.get()).thenReturn(null);
    when(redissonClient.getLock(KEY + ":lock")).thenReturn(lock);
    when(lock.tryLock(anyLong(), anyLong(), eq(TimeUnit.MILLISECONDS)))
        .thenThrow(new InterruptedException());

    try {
      // when
      List<TaskView> result = region.getOrLoad(2L, loader);

      // then
      assertThat(result).isEqualTo(tasks);
      assertThat(loads).hasValue(1);
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
      verify(bucket, never()).set(anyString(), anyLong(), any(TimeUnit.class));
      assertThat(
              meterRegistry
                  .get("task.cache.requests")
                  .tag("result", "lock_failure")
                  .counter()
                  .count())
          .isEqualTo(1.0);
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  @DisplayName("invalidate: 엔트리 삭제")
  void invalidate_deletesEntry() {
    when(redissonClient.<String>getBucket(eq(KEY), any(Codec.class))).thenReturn(bucket);
    when(bucket.delete()).thenReturn(true);

    region.invalidate(2L);

    verify(bucket).delete();
  }

  @Test
  @DisplayName("invalidate: Redis 장애는 CacheAccessException으로 호출자에게 전달")
  void invalidate_failure() {
    when(redissonClient.<String>getBucket(eq(KEY), any(Codec.class))).thenReturn(bucket);
    when(bucket.delete()).thenThrow(new IllegalStateException("connection refused"));

    assertThatThrownBy(() -> region.invalidate(2L)).isInstanceOf(CacheAccessException.class);
  }
}
