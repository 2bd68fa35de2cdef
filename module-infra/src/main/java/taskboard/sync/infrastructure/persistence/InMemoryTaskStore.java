package taskboard.sync.infrastructure.persistence;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import taskboard.sync.core.port.out.TaskStore;
import taskboard.sync.domain.task.TaskRecord;

/**
 * 프로세스 메모리 기반 {@link TaskStore}
 *
 * <p>로컬 실행과 테스트용입니다. 각 메서드는 반환 시점에 커밋된 것으로 간주합니다. createdAt은 UTC 기준 초 단위로 절삭합니다.
 */
@Slf4j
public class InMemoryTaskStore implements TaskStore {

  private final Map<Long, TaskRecord> rows = new ConcurrentHashMap<>();
  private final AtomicLong sequence = new AtomicLong();
  private final Clock clock;

  public InMemoryTaskStore() {
    this(Clock.systemUTC());
  }

  public InMemoryTaskStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public TaskRecord create(long groupId, String title, String description) {
    long id = sequence.incrementAndGet();
    TaskRecord task =
        new TaskRecord(
            id,
            title,
            description,
            false,
            LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS),
            groupId);
    rows.put(id, task);
    log.debug("[TaskStore] Created: taskId={}, groupId={}", id, groupId);
    return task;
  }

  @Override
  public Optional<TaskRecord> findById(long taskId) {
    return Optional.ofNullable(rows.get(taskId));
  }

  @Override
  public TaskRecord update(TaskRecord task) {
    TaskRecord previous = rows.replace(task.id(), task);
    if (previous == null) {
      throw new IllegalStateException("update on missing row: taskId=" + task.id());
    }
    return task;
  }

  @Override
  public void delete(long taskId) {
    rows.remove(taskId);
  }

  @Override
  public List<TaskRecord> findByGroupId(long groupId) {
    return rows.values().stream()
        .filter(task -> task.belongsTo(groupId))
        .sorted(Comparator.comparingLong(TaskRecord::id))
        .toList();
  }
}
