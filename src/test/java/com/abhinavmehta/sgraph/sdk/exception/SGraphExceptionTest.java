package com.abhinavmehta.sgraph.sdk.exception;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SGraphExceptionTest {

    @Test
    void onlyInternalErrorIsADefect() {
        for (ErrorKind kind : ErrorKind.values()) {
            assertThat(kind.isDefect()).isEqualTo(kind == ErrorKind.INTERNAL_ERROR);
        }
        assertThat(new GraphInvariantException("broken", Map.of()).getKind().isDefect()).isTrue();
    }

    @Test
    void contextIsCopiedAndUnmodifiable() {
        Map<String, Object> context = new HashMap<>();
        context.put("sourceRef", "/tmp/model.json");
        LoadException exception = new LoadException("failed", context, null);
        context.put("late", 1);

        assertThat(exception.getContext()).containsOnlyKeys("sourceRef");
        assertThatThrownBy(() -> exception.getContext().put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void subclassesCarryTheirKind() {
        assertThat(new NotLoadedException("m1").getKind()).isEqualTo(ErrorKind.NOT_LOADED);
        assertThat(new ElementNotFoundException("/P/x").getKind()).isEqualTo(ErrorKind.ELEMENT_NOT_FOUND);
        assertThat(new ScopeNotFoundException("/P/x").getKind()).isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(new InvalidPatternException("(", "bad").getKind()).isEqualTo(ErrorKind.INVALID_PATTERN);
        assertThat(InvalidArgumentException.invalidDirection("up").getKind()).isEqualTo(ErrorKind.INVALID_DIRECTION);
        assertThat(new QueryTimeoutException(50).getKind()).isEqualTo(ErrorKind.QUERY_TIMEOUT);
    }

    @Test
    void toStringNamesKindAndContext() {
        String text = new LoadException("failed", Map.of("reason", "timeout"), null).toString();

        assertThat(text).contains("LoadException").contains("LOAD_ERROR").contains("reason=timeout");
    }
}
