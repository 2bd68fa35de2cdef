package taskboard.sync.config;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.AnnotationAwareOrderComparator;
import taskboard.sync.infrastructure.executor.DefaultLogicExecutor;
import taskboard.sync.infrastructure.executor.LogicExecutor;
import taskboard.sync.infrastructure.executor.policy.ExecutionPipeline;
import taskboard.sync.infrastructure.executor.policy.ExecutionPolicy;
import taskboard.sync.infrastructure.executor.policy.LoggingPolicy;
import taskboard.sync.infrastructure.executor.policy.TimerPolicy;
import taskboard.sync.infrastructure.executor.strategy.ExceptionTranslator;

/** LogicExecutor와 실행 정책(Timer → Logging) 조립 */
@Configuration
@EnableConfigurationProperties(ExecutorLoggingProperties.class)
public class ExecutorConfig {

  @Bean
  public ExceptionTranslator exceptionTranslator() {
    return ExceptionTranslator.defaultTranslator();
  }

  @Bean
  public LoggingPolicy loggingPolicy(ExecutorLoggingProperties props) {
    return new LoggingPolicy(props.getSlowMs());
  }

  @Bean
  public TimerPolicy timerPolicy(MeterRegistry meterRegistry) {
    return new TimerPolicy(meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean(ExecutionPipeline.class)
  public ExecutionPipeline executionPipeline(List<ExecutionPolicy> policies) {
    List<ExecutionPolicy> ordered = new ArrayList<>(policies);
    AnnotationAwareOrderComparator.sort(ordered);
    return new ExecutionPipeline(ordered);
  }

  @Bean
  @ConditionalOnMissingBean(LogicExecutor.class)
  public LogicExecutor logicExecutor(ExecutionPipeline pipeline, ExceptionTranslator translator) {
    return new DefaultLogicExecutor(pipeline, translator);
  }
}
