package taskboard.sync.infrastructure.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 그룹별 작업 목록 캐시 설정 ({@code app.cache})
 *
 * <ul>
 *   <li>type=redis (기본): Redisson RBucket + RLock
 *   <li>type=local: 단일 인스턴스용 Caffeine
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.cache")
public class TaskCacheProperties {

  @NotBlank private String type = "redis";

  /** 엔트리 TTL. 무효화 누락 시 staleness 상한 */
  @NotNull private Duration ttl = Duration.ofSeconds(60);

  /** load coalescing 락 대기 시간 */
  @NotNull private Duration lockWait = Duration.ofSeconds(3);

  /** 락 보유 상한 (loader가 멈춰도 자동 해제) */
  @NotNull private Duration lockLease = Duration.ofSeconds(10);

  @NotBlank private String keyPrefix = "tasks:group:";

  public String getType() {
    return type;
  }

  public void setType(String type) {
    this.type = type;
  }

  public Duration getTtl() {
    return ttl;
  }

  public void setTtl(Duration ttl) {
    this.ttl = ttl;
  }

  public Duration getLockWait() {
    return lockWait;
  }

  public void setLockWait(Duration lockWait) {
    this.lockWait = lockWait;
  }

  public Duration getLockLease() {
    return lockLease;
  }

  public void setLockLease(Duration lockLease) {
    this.lockLease = lockLease;
  }

  public String getKeyPrefix() {
    return keyPrefix;
  }

  public void setKeyPrefix(String keyPrefix) {
    this.keyPrefix = keyPrefix;
  }
}
