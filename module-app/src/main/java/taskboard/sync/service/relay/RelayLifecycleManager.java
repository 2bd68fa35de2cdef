package taskboard.sync.service.relay;

import jakarta.annotation.PreDestroy;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import taskboard.sync.domain.relay.RelayState;
import taskboard.sync.infrastructure.executor.LogicExecutor;
import taskboard.sync.infrastructure.executor.TaskContext;

/**
 * 프로세스당 relay worker 1개를 보장하는 관리자
 *
 * <h4>ensureRunning</h4>
 *
 * <ul>
 *   <li>첫 실시간 연결 시 지연 시작
 *   <li>이전 worker 스레드가 종료(FAULTED)되었으면 새 worker로 교체
 *   <li>ReentrantLock으로 check-then-start를 원자화 (동시 호출 N개 → worker 1개)
 *   <li>스레드 start까지만 호출자를 붙잡음 (poll 대기 없음)
 * </ul>
 *
 * <p>종료 후에는 더 이상 worker를 시작하지 않습니다.
 */
@Slf4j
@Component
public class RelayLifecycleManager {

  private static final String THREAD_NAME_PREFIX = "task-event-relay-";
  private static final long SHUTDOWN_JOIN_MILLIS = 5_000L;

  private final TaskEventRelayWorkerFactory workerFactory;
  private final LogicExecutor executor;

  private final ReentrantLock lock = new ReentrantLock();
  private final AtomicInteger threadSequence = new AtomicInteger();

  // lock 보호 대상
  private TaskEventRelayWorker worker;
  private Thread workerThread;
  private boolean shutDown;

  public RelayLifecycleManager(TaskEventRelayWorkerFactory workerFactory, LogicExecutor executor) {
    this.workerFactory = workerFactory;
    this.executor = executor;
  }

  /**
   * worker가 없거나 죽었으면 새로 시작합니다.
   *
   * @return 이번 호출에서 worker를 시작했으면 true
   */
  public boolean ensureRunning() {
    lock.lock();
    try {
      if (shutDown) {
        return false;
      }
      if (workerThread != null && workerThread.isAlive()) {
        return false;
      }
      if (worker != null) {
        log.warn("[RelayLifecycle] Previous worker ended, restarting: lastState={}", worker.state());
      }
      start();
      return true;
    } finally {
      lock.unlock();
    }
  }

  private void start() {
    TaskEventRelayWorker next = workerFactory.create();
    Thread thread = new Thread(next, THREAD_NAME_PREFIX + threadSequence.incrementAndGet());
    thread.setDaemon(true);
    thread.start();
    worker = next;
    workerThread = thread;
    log.info("[RelayLifecycle] Worker started: thread={}", thread.getName());
  }

  public RelayState state() {
    lock.lock();
    try {
      return worker == null ? RelayState.NOT_STARTED : worker.state();
    } finally {
      lock.unlock();
    }
  }

  /** 종료 표시와 핸들 복사만 lock 안에서 하고, join은 lock 밖에서 기다립니다. */
  @PreDestroy
  public void shutdown() {
    TaskEventRelayWorker current;
    Thread thread;
    lock.lock();
    try {
      shutDown = true;
      current = worker;
      thread = workerThread;
    } finally {
      lock.unlock();
    }
    if (current == null) {
      return;
    }
    current.shutdown();
    executor.executeOrDefault(
        () -> {
          thread.join(SHUTDOWN_JOIN_MILLIS);
          return null;
        },
        null,
        TaskContext.of("RelayLifecycle", "Shutdown", thread.getName()));
    log.info("[RelayLifecycle] Shutdown complete: state={}", current.state());
  }
}
