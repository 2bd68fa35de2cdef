package taskboard.sync.infrastructure.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 작업 이벤트 버스 설정 ({@code app.event-bus})
 *
 * <p>consumer-group은 프로세스 전체에서 고정값입니다. relay worker가 재시작되어도 같은 그룹으로 합류해야 커밋된 오프셋부터 이어서
 * 소비합니다.
 */
@Validated
@ConfigurationProperties(prefix = "app.event-bus")
public class EventBusProperties {

  @NotBlank private String topic = "tasks_topic";

  @NotBlank private String consumerGroup = "task-consumer-group";

  /** 브로커 ack 대기 상한. 초과 시 append 실패로 간주 */
  @NotNull private Duration publishTimeout = Duration.ofSeconds(5);

  /** relay poll 1회 대기 시간 */
  @NotNull private Duration pollTimeout = Duration.ofMillis(500);

  public String getTopic() {
    return topic;
  }

  public void setTopic(String topic) {
    this.topic = topic;
  }

  public String getConsumerGroup() {
    return consumerGroup;
  }

  public void setConsumerGroup(String consumerGroup) {
    this.consumerGroup = consumerGroup;
  }

  public Duration getPublishTimeout() {
    return publishTimeout;
  }

  public void setPublishTimeout(Duration publishTimeout) {
    this.publishTimeout = publishTimeout;
  }

  public Duration getPollTimeout() {
    return pollTimeout;
  }

  public void setPollTimeout(Duration pollTimeout) {
    this.pollTimeout = pollTimeout;
  }
}
