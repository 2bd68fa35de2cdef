package taskboard.sync.service.relay;

import io.micrometer.core.instrument.Counter;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import taskboard.sync.core.port.out.TaskEventBroadcaster;
import taskboard.sync.domain.relay.RelayState;
import taskboard.sync.domain.task.TaskEvent;
import taskboard.sync.infrastructure.messaging.TaskEventCodec;

/**
 * tasks_topic → 실시간 채널 relay (단일 스레드 전용)
 *
 * <h4>처리 흐름</h4>
 *
 * <ol>
 *   <li>subscribe(tasks_topic), 커밋된 오프셋이 없으면 earliest부터
 *   <li>poll → decode → broadcaster.push(channel, event)
 *   <li>오프셋은 auto-commit (forward 후 커밋, at-least-once)
 * </ol>
 *
 * <h4>종료</h4>
 *
 * <ul>
 *   <li>decode/broadcast 실패: FAULTED, ERROR 로그, {@code task.relay.fault} 증가. 자동 재시작 없음
 *   <li>실패 시 close(auto-commit) 전에 파티션별 미전달 첫 레코드로 seek. broadcast 실패는 해당 레코드부터,
 *       decode 실패(poison)는 다음 레코드부터 재시작 worker가 이어받음
 *   <li>{@link #shutdown()}: consumer.wakeup() → STOPPED
 * </ul>
 *
 * <p>Kafka Consumer는 thread-safe하지 않으므로 {@link #shutdown()}(wakeup) 외의 모든 consumer 호출은 worker 스레드에서만
 * 일어납니다.
 */
@Slf4j
public class TaskEventRelayWorker implements Runnable {

  private final Consumer<String, String> consumer;
  private final TaskEventCodec codec;
  private final TaskEventBroadcaster broadcaster;
  private final String topic;
  private final String channel;
  private final Duration pollTimeout;
  private final Counter faultCounter;

  private final AtomicReference<RelayState> state = new AtomicReference<>(RelayState.NOT_STARTED);
  private volatile boolean shutdownRequested;

  // worker 스레드 전용: 배치 처리 중 파티션별 다음 전달 대상 오프셋
  private final Map<TopicPartition, Long> unrelayed = new HashMap<>();

  public TaskEventRelayWorker(
      Consumer<String, String> consumer,
      TaskEventCodec codec,
      TaskEventBroadcaster broadcaster,
      String topic,
      String channel,
      Duration pollTimeout,
      Counter faultCounter) {
    this.consumer = consumer;
    this.codec = codec;
    this.broadcaster = broadcaster;
    this.topic = topic;
    this.channel = channel;
    this.pollTimeout = pollTimeout;
    this.faultCounter = faultCounter;
  }

  @Override
  public void run() {
    state.set(RelayState.RUNNING);
    log.info("[RelayWorker] Started: topic={}, channel={}", topic, channel);
    try {
      consumer.subscribe(List.of(topic));
      while (!shutdownRequested) {
        ConsumerRecords<String, String> records = consumer.poll(pollTimeout);
        markBatch(records);
        for (ConsumerRecord<String, String> record : records) {
          forward(record);
        }
        unrelayed.clear();
      }
      stopped();
    } catch (WakeupException e) {
      stopped();
    } catch (RuntimeException e) {
      state.set(RelayState.FAULTED);
      faultCounter.increment();
      log.error("[RelayWorker] Faulted, waiting for restart on next connection: topic={}", topic, e);
      rewindUnrelayed();
    } finally {
      closeConsumer();
    }
  }

  private void markBatch(ConsumerRecords<String, String> records) {
    for (TopicPartition partition : records.partitions()) {
      unrelayed.put(partition, records.records(partition).get(0).offset());
    }
  }

  private void forward(ConsumerRecord<String, String> record) {
    TopicPartition partition = new TopicPartition(record.topic(), record.partition());
    // decode 실패 레코드는 재시도해도 실패하므로 건너뜀
    unrelayed.put(partition, record.offset() + 1);
    TaskEvent event = codec.decode(record.value());
    unrelayed.put(partition, record.offset());
    log.debug(
        "[RelayWorker] Received: partition={}, offset={}, action={}, taskId={}, groupId={}",
        record.partition(),
        record.offset(),
        event.action().wireValue(),
        event.task().id(),
        event.groupId());
    broadcaster.push(channel, event);
    unrelayed.put(partition, record.offset() + 1);
  }

  /**
   * close()의 auto-commit이 배치 끝 위치를 커밋하지 않도록, 파티션마다 아직 전달하지 못한 첫 레코드로 되감습니다.
   */
  private void rewindUnrelayed() {
    unrelayed.forEach(
        (partition, offset) -> {
          try {
            consumer.seek(partition, offset);
            log.warn(
                "[RelayWorker] Rewound for redelivery: partition={}, offset={}",
                partition.partition(),
                offset);
          } catch (RuntimeException e) {
            log.warn(
                "[RelayWorker] Rewind failed: partition={}, offset={}",
                partition.partition(),
                offset,
                e);
          }
        });
    unrelayed.clear();
  }

  private void stopped() {
    state.set(RelayState.STOPPED);
    log.info("[RelayWorker] Stopped: topic={}", topic);
  }

  private void closeConsumer() {
    try {
      consumer.close();
    } catch (RuntimeException e) {
      log.warn("[RelayWorker] Consumer close failed: topic={}", topic, e);
    }
  }

  /** 다른 스레드에서 호출 가능. poll 대기 중이면 즉시 깨워 루프를 끝냅니다. */
  public void shutdown() {
    shutdownRequested = true;
    RelayState current = state.get();
    if (current == RelayState.FAULTED || current == RelayState.STOPPED) {
      return;
    }
    consumer.wakeup();
  }

  public RelayState state() {
    return state.get();
  }
}
