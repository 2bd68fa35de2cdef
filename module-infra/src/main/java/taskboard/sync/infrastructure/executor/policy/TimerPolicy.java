package taskboard.sync.infrastructure.executor.policy;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;
import org.springframework.core.annotation.Order;
import taskboard.sync.infrastructure.executor.TaskContext;

/**
 * task 실행 시간을 {@code logic.executor} 타이머로 기록하는 정책
 *
 * <p>태그는 component / operation / result만 사용합니다. dynamicValue는 카디널리티 폭주 원인이므로 태그에서 제외합니다.
 */
@Order(PolicyOrder.TIMER)
public class TimerPolicy implements ExecutionPolicy {

  private final MeterRegistry meterRegistry;

  public TimerPolicy(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void after(ExecutionOutcome outcome, long elapsedNanos, TaskContext context) {
    Timer.builder("logic.executor")
        .tag("component", context.component())
        .tag("operation", context.operation())
        .tag("result", outcome == ExecutionOutcome.SUCCESS ? "success" : "failure")
        .register(meterRegistry)
        .record(elapsedNanos, TimeUnit.NANOSECONDS);
  }
}
