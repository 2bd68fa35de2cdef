package taskboard.sync.config;

import com.corundumstudio.socketio.SocketIOServer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import taskboard.sync.infrastructure.config.SocketIoProperties;

/**
 * netty-socketio 서버
 *
 * <p>리스너 등록은 {@link taskboard.sync.realtime.SocketIoTaskGateway}가 담당하며, 서버 start/stop도 게이트웨이 라이프사이클을
 * 따릅니다.
 */
@Configuration
public class SocketIoConfig {

  @Bean
  public SocketIOServer socketIOServer(SocketIoProperties properties) {
    com.corundumstudio.socketio.Configuration config =
        new com.corundumstudio.socketio.Configuration();
    config.setHostname(properties.getHost());
    config.setPort(properties.getPort());
    config.setOrigin("*");
    return new SocketIOServer(config);
  }
}
