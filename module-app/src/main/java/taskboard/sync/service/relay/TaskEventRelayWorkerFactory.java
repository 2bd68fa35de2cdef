package taskboard.sync.service.relay;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.kafka.clients.consumer.Consumer;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.stereotype.Component;
import taskboard.sync.core.port.out.TaskEventBroadcaster;
import taskboard.sync.infrastructure.config.EventBusProperties;
import taskboard.sync.infrastructure.config.SocketIoProperties;
import taskboard.sync.infrastructure.messaging.TaskEventCodec;

/** 고정 consumer group으로 새 consumer를 만들어 worker를 조립합니다. */
@Component
public class TaskEventRelayWorkerFactory {

  private static final String CLIENT_ID_SUFFIX = "relay";

  private final ConsumerFactory<String, String> consumerFactory;
  private final TaskEventCodec codec;
  private final TaskEventBroadcaster broadcaster;
  private final EventBusProperties eventBusProperties;
  private final SocketIoProperties socketIoProperties;
  private final Counter faultCounter;

  public TaskEventRelayWorkerFactory(
      ConsumerFactory<String, String> consumerFactory,
      TaskEventCodec codec,
      TaskEventBroadcaster broadcaster,
      EventBusProperties eventBusProperties,
      SocketIoProperties socketIoProperties,
      MeterRegistry meterRegistry) {
    this.consumerFactory = consumerFactory;
    this.codec = codec;
    this.broadcaster = broadcaster;
    this.eventBusProperties = eventBusProperties;
    this.socketIoProperties = socketIoProperties;
    this.faultCounter = Counter.builder("task.relay.fault").register(meterRegistry);
  }

  public TaskEventRelayWorker create() {
    Consumer<String, String> consumer =
        consumerFactory.createConsumer(eventBusProperties.getConsumerGroup(), CLIENT_ID_SUFFIX);
    return new TaskEventRelayWorker(
        consumer,
        codec,
        broadcaster,
        eventBusProperties.getTopic(),
        socketIoProperties.getNamespace(),
        eventBusProperties.getPollTimeout(),
        faultCounter);
  }
}
