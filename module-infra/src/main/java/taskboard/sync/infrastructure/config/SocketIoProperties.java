package taskboard.sync.infrastructure.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** 실시간 채널(Socket.IO) 설정 ({@code app.socket-io}) */
@Validated
@ConfigurationProperties(prefix = "app.socket-io")
public class SocketIoProperties {

  @NotBlank private String host = "0.0.0.0";

  @Min(1)
  @Max(65535)
  private int port = 9093;

  @NotBlank private String namespace = "/tasks";

  @NotBlank private String eventName = "task_event";

  public String getHost() {
    return host;
  }

  public void setHost(String host) {
    this.host = host;
  }

  public int getPort() {
    return port;
  }

  public void setPort(int port) {
    this.port = port;
  }

  public String getNamespace() {
    return namespace;
  }

  public void setNamespace(String namespace) {
    this.namespace = namespace;
  }

  public String getEventName() {
    return eventName;
  }

  public void setEventName(String eventName) {
    this.eventName = eventName;
  }
}
