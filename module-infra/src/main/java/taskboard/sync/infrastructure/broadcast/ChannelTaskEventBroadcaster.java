package taskboard.sync.infrastructure.broadcast;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import lombok.extern.slf4j.Slf4j;
import taskboard.sync.core.port.out.BroadcastClient;
import taskboard.sync.core.port.out.TaskEventBroadcaster;
import taskboard.sync.infrastructure.executor.LogicExecutor;
import taskboard.sync.infrastructure.executor.TaskContext;

/**
 * 채널 멤버십 + fan-out 구현 (transport 독립)
 *
 * <h4>동시성</h4>
 *
 * <ul>
 *   <li>채널 → 구독자 집합: ConcurrentHashMap + CopyOnWriteArraySet
 *   <li>push는 호출 시점의 스냅샷을 순회 (구독 변경과 경합하지 않음)
 * </ul>
 *
 * <p>클라이언트 1개의 전송 실패는 WARN 로그와 {@code task.broadcast.client.failure} 카운터로 기록하고 나머지 전송은
 * 계속합니다.
 */
@Slf4j
public class ChannelTaskEventBroadcaster implements TaskEventBroadcaster {

  private final Map<String, Set<BroadcastClient>> channels = new ConcurrentHashMap<>();
  private final String eventName;
  private final Counter clientFailureCounter;
  private final LogicExecutor executor;

  public ChannelTaskEventBroadcaster(
      String eventName, LogicExecutor executor, MeterRegistry meterRegistry) {
    this.eventName = eventName;
    this.executor = executor;
    this.clientFailureCounter =
        Counter.builder("task.broadcast.client.failure").register(meterRegistry);
  }

  @Override
  public void subscribe(BroadcastClient client, String channel) {
    channels.computeIfAbsent(channel, key -> new CopyOnWriteArraySet<>()).add(client);
    log.debug("[Broadcaster] Subscribed: client={}, channel={}", client.id(), channel);
  }

  @Override
  public void unsubscribe(BroadcastClient client, String channel) {
    Set<BroadcastClient> members = channels.get(channel);
    if (members != null && members.remove(client)) {
      log.debug("[Broadcaster] Unsubscribed: client={}, channel={}", client.id(), channel);
    }
  }

  @Override
  public void unsubscribeAll(BroadcastClient client) {
    channels.values().forEach(members -> members.remove(client));
    log.debug("[Broadcaster] Unsubscribed from all channels: client={}", client.id());
  }

  @Override
  public int push(String channel, Object payload) {
    Set<BroadcastClient> members = channels.get(channel);
    if (members == null || members.isEmpty()) {
      log.debug("[Broadcaster] No subscribers: channel={}", channel);
      return 0;
    }

    int delivered = 0;
    for (BroadcastClient client : members) {
      if (deliver(client, channel, payload)) {
        delivered++;
      }
    }
    log.debug(
        "[Broadcaster] Pushed: channel={}, delivered={}/{}", channel, delivered, members.size());
    return delivered;
  }

  /** 클라이언트 단위 격리: 실패는 기록만 하고 false 반환 */
  private boolean deliver(BroadcastClient client, String channel, Object payload) {
    return executor.executeOrCatch(
        () -> {
          client.send(eventName, payload);
          return true;
        },
        e -> {
          clientFailureCounter.increment();
          log.warn(
              "[Broadcaster] Delivery failed, continuing: client={}, channel={}, cause={}",
              client.id(),
              channel,
              e.getMessage());
          return false;
        },
        TaskContext.of("Broadcaster", "Deliver", client.id()));
  }

  @Override
  public int subscriberCount(String channel) {
    Set<BroadcastClient> members = channels.get(channel);
    return members == null ? 0 : members.size();
  }
}
