package taskboard.sync.monitoring;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;
import taskboard.sync.domain.relay.RelayState;
import taskboard.sync.service.relay.RelayLifecycleManager;

/**
 * Relay worker 상태 Health Check
 *
 * <ul>
 *   <li>RUNNING, NOT_STARTED(첫 연결 전 지연 시작 대기) → UP
 *   <li>FAULTED → DOWN (다음 실시간 연결 시 재시작)
 *   <li>STOPPED → OUT_OF_SERVICE (종료 중)
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class RelayHealthIndicator implements HealthIndicator {

  private final RelayLifecycleManager relayLifecycleManager;

  @Override
  public Health health() {
    RelayState state = relayLifecycleManager.state();
    Health.Builder builder =
        switch (state) {
          case RUNNING, NOT_STARTED -> Health.up();
          case FAULTED -> Health.down();
          case STOPPED -> Health.outOfService();
        };
    return builder.withDetail("relayState", state.name()).build();
  }
}
