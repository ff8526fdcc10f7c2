package com.presence.core.selection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ResponseSelectorTest {

    private static final List<String> OPTIONS = List.of("first", "second", "third");

    @Nested
    @DisplayName("HashResponseSelector")
    class Hash {

        @Test
        @DisplayName("same key always yields the same option")
        void deterministicPerKey() {
            var selector = new HashResponseSelector(0);
            String first = selector.select(OPTIONS, "user-1:red").orElseThrow();
            for (int i = 0; i < 10; i++) {
                assertEquals(first, selector.select(OPTIONS, "user-1:red").orElseThrow());
            }
        }

        @Test
        @DisplayName("separate instances with the same seed agree")
        void stableAcrossInstances() {
            assertEquals(new HashResponseSelector(7).select(OPTIONS, "k"),
                    new HashResponseSelector(7).select(OPTIONS, "k"));
        }

        @Test
        @DisplayName("empty options yield empty")
        void emptyOptions() {
            assertEquals(Optional.empty(), new HashResponseSelector(0).select(List.of(), "k"));
            assertEquals(Optional.empty(), new HashResponseSelector(0).select(null, "k"));
        }

        @Test
        @DisplayName("a single option is always chosen")
        void singleOption() {
            assertEquals("only", new HashResponseSelector(3).select(List.of("only"), null).orElseThrow());
        }
    }

    @Nested
    @DisplayName("RoundRobinResponseSelector")
    class RoundRobin {

        @Test
        @DisplayName("cycles through options in declared order")
        void cycles() {
            var selector = new RoundRobinResponseSelector(0);
            assertEquals("first", selector.select(OPTIONS, "k").orElseThrow());
            assertEquals("second", selector.select(OPTIONS, "k").orElseThrow());
            assertEquals("third", selector.select(OPTIONS, "k").orElseThrow());
            assertEquals("first", selector.select(OPTIONS, "k").orElseThrow());
        }

        @Test
        @DisplayName("keys advance independently")
        void independentKeys() {
            var selector = new RoundRobinResponseSelector(0);
            selector.select(OPTIONS, "a");
            assertEquals("first", selector.select(OPTIONS, "b").orElseThrow());
            assertEquals("second", selector.select(OPTIONS, "a").orElseThrow());
        }

        @Test
        @DisplayName("seed sets the starting offset")
        void seedOffset() {
            assertEquals("second", new RoundRobinResponseSelector(1).select(OPTIONS, "k").orElseThrow());
        }

        @Test
        @DisplayName("empty options yield empty")
        void emptyOptions() {
            assertTrue(new RoundRobinResponseSelector(0).select(List.of(), "k").isEmpty());
        }
    }

    @Nested
    @DisplayName("SelectionConfig")
    class Config {

        @Test
        @DisplayName("strategy property picks the implementation")
        void picksImplementation() {
            var properties = new com.presence.core.stage.StageProperties();
            var config = new SelectionConfig();
            assertInstanceOf(HashResponseSelector.class, config.responseSelector(properties));

            properties.getSelection().setStrategy("round-robin");
            assertInstanceOf(RoundRobinResponseSelector.class, config.responseSelector(properties));
        }

        @Test
        @DisplayName("unknown strategy fails fast")
        void unknownStrategy() {
            var properties = new com.presence.core.stage.StageProperties();
            properties.getSelection().setStrategy("random");
            assertThrows(IllegalStateException.class, () -> new SelectionConfig().responseSelector(properties));
        }
    }
}
