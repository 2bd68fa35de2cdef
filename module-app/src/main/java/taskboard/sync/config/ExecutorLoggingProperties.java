package taskboard.sync.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * ExecutionPolicy 로깅 관련 설정 프로퍼티
 *
 * <pre>
 * executor:
 *   logging:
 *     slow-ms: 200
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "executor.logging")
public class ExecutorLoggingProperties {

  /** 이 값(ms) 이상이면 성공 로그를 SLOW(INFO)로 승격. 허용 범위 0 ~ 60000 */
  @Min(0)
  @Max(60_000)
  private long slowMs = 200L;

  public long getSlowMs() {
    return slowMs;
  }

  public void setSlowMs(long slowMs) {
    this.slowMs = slowMs;
  }
}
