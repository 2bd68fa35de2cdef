package taskboard.sync.infrastructure.broadcast;

import com.corundumstudio.socketio.SocketIOClient;
import java.util.Objects;
import taskboard.sync.core.port.out.BroadcastClient;

/**
 * netty-socketio 연결 어댑터
 *
 * <p>동등성은 세션 ID 기준입니다. connect/disconnect 리스너가 같은 연결에 대해 매번 새 어댑터를 만들어도 구독 집합에서 같은 원소로
 * 취급됩니다.
 */
public final class SocketIoBroadcastClient implements BroadcastClient {

  private final SocketIOClient client;

  public SocketIoBroadcastClient(SocketIOClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public String id() {
    return client.getSessionId().toString();
  }

  @Override
  public void send(String eventName, Object payload) {
    client.sendEvent(eventName, payload);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SocketIoBroadcastClient other)) {
      return false;
    }
    return client.getSessionId().equals(other.client.getSessionId());
  }

  @Override
  public int hashCode() {
    return client.getSessionId().hashCode();
  }
}
