package taskboard.sync.infrastructure.messaging;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import taskboard.sync.domain.task.TaskAction;
import taskboard.sync.domain.task.TaskEvent;
import taskboard.sync.domain.task.TaskSnapshot;
import taskboard.sync.error.CommonErrorCode;
import taskboard.sync.error.exception.EventRelayException;
import taskboard.sync.infrastructure.executor.DefaultLogicExecutor;
import taskboard.sync.infrastructure.executor.policy.ExecutionPipeline;
import taskboard.sync.infrastructure.executor.strategy.ExceptionTranslator;

@DisplayName("TaskEventCodec 와이어 포맷 테스트")
class TaskEventCodecTest {

  private ObjectMapper objectMapper;
  private TaskEventCodec codec;

  @BeforeEach
  void setUp() {
    objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    codec =
        new TaskEventCodec(
            objectMapper,
            new DefaultLogicExecutor(
                new ExecutionPipeline(List.of()), ExceptionTranslator.defaultTranslator()));
  }

  @Test
  @DisplayName("encode: 소문자 action과 group_id 필드명을 사용")
  void encode_usesWireNames() throws Exception {
    // given
    TaskEvent event =
        TaskEvent.of(TaskAction.CREATE, new TaskSnapshot(1L, "Buy milk", "2L", false, 1L));

    // when
    String json = codec.encode(event);

    // then
    assertThat(objectMapper.readTree(json))
        .isEqualTo(
            objectMapper.readTree(
                "{\"action\":\"create\",\"task\":{\"id\":1,\"title\":\"Buy milk\","
                    + "\"description\":\"2L\",\"completed\":false,\"group_id\":1}}"));
  }

  @Test
  @DisplayName("decode: 다른 프로세스가 쓴 레코드를 읽는다")
  void decode_readsForeignRecord() {
    String payload =
        "{\"action\":\"update\",\"task\":{\"id\":5,\"title\":\"t\",\"description\":\"d\","
            + "\"completed\":true,\"group_id\":2}}";

    TaskEvent event = codec.decode(payload);

    assertThat(event.action()).isEqualTo(TaskAction.UPDATE);
    assertThat(event.task()).isEqualTo(new TaskSnapshot(5L, "t", "d", true, 2L));
    assertThat(event.groupId()).isEqualTo(2L);
  }

  @Test
  @DisplayName("decode: 깨진 JSON은 EVENT_DECODE_ERROR")
  void decode_malformedJson() {
    assertThatThrownBy(() -> codec.decode("{not-json"))
        .isInstanceOf(EventRelayException.class)
        .extracting(e -> ((EventRelayException) e).getErrorCode())
        .isEqualTo(CommonErrorCode.EVENT_DECODE_ERROR);
  }

  @Test
  @DisplayName("decode: 알 수 없는 action은 EVENT_DECODE_ERROR")
  void decode_unknownAction() {
    String payload =
        "{\"action\":\"archive\",\"task\":{\"id\":5,\"title\":\"t\",\"description\":\"d\","
            + "\"completed\":true,\"group_id\":2}}";

    assertThatThrownBy(() -> codec.decode(payload))
        .isInstanceOf(EventRelayException.class)
        .extracting(e -> ((EventRelayException) e).getErrorCode())
        .isEqualTo(CommonErrorCode.EVENT_DECODE_ERROR);
  }

  @Test
  @DisplayName("decode: null 레코드 값은 EVENT_DECODE_ERROR")
  void decode_nullValue() {
    assertThatThrownBy(() -> codec.decode(null))
        .isInstanceOf(EventRelayException.class)
        .extracting(e -> ((EventRelayException) e).getErrorCode())
        .isEqualTo(CommonErrorCode.EVENT_DECODE_ERROR);
  }
}
