package io.chatwebsocket.core;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServerEventTest {

    @Test
    void classifiesErrorFrames() {
        ServerEvent event = ServerEvent.of(Map.of("type", "error", "message", "rate limited", "code", 429));

        assertThat(event).isInstanceOf(ServerEvent.Error.class);
        ServerEvent.Error error = (ServerEvent.Error) event;
        assertThat(error.message()).isEqualTo("rate limited");
        assertThat(error.code()).isEqualTo("429");
    }

    @Test
    void errorWithoutMessageHasNullMessage() {
        ServerEvent.Error error = (ServerEvent.Error) ServerEvent.of(Map.of("type", "error"));

        assertThat(error.message()).isNull();
        assertThat(error.code()).isNull();
        assertThat(new ChatWebSocketException.ServerError(error.message(), error.code()).getMessage())
                .isEqualTo("Server error");
    }

    @Test
    void classifiesCompletedAndOtherFrames() {
        assertThat(ServerEvent.of(Map.of("type", "response.completed"))).isInstanceOf(ServerEvent.Completed.class);

        ServerEvent delta = ServerEvent.of(Map.of("type", "response.output_text.delta", "delta", "hi"));
        assertThat(delta).isInstanceOf(ServerEvent.Other.class);
        assertThat(delta.type()).isEqualTo("response.output_text.delta");
        assertThat(delta.payload()).containsEntry("delta", "hi");
    }

    @Test
    void payloadIsAnImmutableCopy() {
        Map<String, Object> frame = new HashMap<>();
        frame.put("type", "response.created");
        ServerEvent event = ServerEvent.of(frame);
        frame.put("extra", true);

        assertThat(event.payload()).doesNotContainKey("extra");
        assertThatThrownBy(() -> event.payload().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void rejectsFramesWithoutStringType() {
        assertThatThrownBy(() -> ServerEvent.of(Map.of("message", "x"))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ServerEvent.of(Map.of("type", 7))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ServerEvent.of(Map.of("type", ""))).isInstanceOf(IllegalArgumentException.class);
    }
}
