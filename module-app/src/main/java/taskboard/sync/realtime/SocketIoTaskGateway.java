package taskboard.sync.realtime;

import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.SocketIONamespace;
import com.corundumstudio.socketio.SocketIOServer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;
import taskboard.sync.core.port.out.TaskEventBroadcaster;
import taskboard.sync.infrastructure.broadcast.SocketIoBroadcastClient;
import taskboard.sync.infrastructure.config.SocketIoProperties;
import taskboard.sync.service.relay.RelayLifecycleManager;

/**
 * Socket.IO {@code /tasks} 네임스페이스 게이트웨이
 *
 * <ul>
 *   <li>connect: 채널 구독 + relay worker 보장 (첫 연결 시 지연 시작, 죽었으면 재시작)
 *   <li>disconnect: 모든 채널에서 구독 해제
 * </ul>
 *
 * <p>서버 start/stop은 SmartLifecycle로 컨텍스트와 함께 관리합니다.
 */
@Slf4j
@Component
public class SocketIoTaskGateway implements SmartLifecycle {

  private final SocketIOServer server;
  private final TaskEventBroadcaster broadcaster;
  private final RelayLifecycleManager relayLifecycleManager;
  private final String channel;

  private volatile boolean running = false;

  public SocketIoTaskGateway(
      SocketIOServer server,
      TaskEventBroadcaster broadcaster,
      RelayLifecycleManager relayLifecycleManager,
      SocketIoProperties properties) {
    this.server = server;
    this.broadcaster = broadcaster;
    this.relayLifecycleManager = relayLifecycleManager;
    this.channel = properties.getNamespace();
    SocketIONamespace namespace = server.addNamespace(channel);
    namespace.addConnectListener(this::onConnect);
    namespace.addDisconnectListener(this::onDisconnect);
  }

  void onConnect(SocketIOClient client) {
    SocketIoBroadcastClient subscriber = new SocketIoBroadcastClient(client);
    broadcaster.subscribe(subscriber, channel);
    boolean started = relayLifecycleManager.ensureRunning();
    log.info(
        "[SocketIoGateway] Connected: session={}, subscribers={}, relayStarted={}",
        subscriber.id(),
        broadcaster.subscriberCount(channel),
        started);
  }

  void onDisconnect(SocketIOClient client) {
    SocketIoBroadcastClient subscriber = new SocketIoBroadcastClient(client);
    broadcaster.unsubscribeAll(subscriber);
    log.info(
        "[SocketIoGateway] Disconnected: session={}, subscribers={}",
        subscriber.id(),
        broadcaster.subscriberCount(channel));
  }

  @Override
  public void start() {
    server.start();
    running = true;
    log.info(
        "[SocketIoGateway] Listening: port={}, namespace={}",
        server.getConfiguration().getPort(),
        channel);
  }

  @Override
  public void stop() {
    server.stop();
    running = false;
    log.info("[SocketIoGateway] Stopped");
  }

  @Override
  public boolean isRunning() {
    return running;
  }
}
