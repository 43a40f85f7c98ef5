package com.mike.contactcardfinder.service.behavior;

import com.mike.contactcardfinder.driver.UiElement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.time.Duration;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class TypingSimulatorTest {

    private Sleeper sleeper;
    private UiElement element;

    @BeforeEach
    void setUp() {
        sleeper = mock(Sleeper.class);
        element = mock(UiElement.class);
    }

    @Nested
    @DisplayName("type")
    class Type {

        @Test
        @DisplayName("no mistakes -> each character typed once, in order, no backspace")
        void type_without_mistakes() {
            //Arrange
            TypingConfig config = TypingConfig.defaults().withMistakeProbability(0.0);
            TypingSimulator simulator = new TypingSimulator(config, new Random(1), sleeper);
            //Act
            simulator.type(element, "abc");
            //Assert
            InOrder order = inOrder(element);
            order.verify(element).type("a");
            order.verify(element).type("b");
            order.verify(element).type("c");
            verify(element, never()).press(anyString());
        }

        @Test
        @DisplayName("no pause after the last character")
        void type_sleeps_only_between_characters() {
            //Arrange
            TypingConfig config = TypingConfig.defaults().withMistakeProbability(0.0);
            TypingSimulator simulator = new TypingSimulator(config, new Random(1), sleeper);
            //Act
            simulator.type(element, "ab");
            //Assert
            verify(sleeper, times(1)).sleep(any(Duration.class));
        }

        @Test
        @DisplayName("mistake -> neighbouring key, backspace, then the right key")
        void type_with_mistake_corrects_it() {
            //Arrange
            TypingConfig config = TypingConfig.defaults().withMistakeProbability(1.0);
            TypingSimulator simulator = new TypingSimulator(config, new Random(2), sleeper);
            ArgumentCaptor<String> typed = ArgumentCaptor.forClass(String.class);
            //Act
            simulator.type(element, "a");
            //Assert
            InOrder order = inOrder(element);
            order.verify(element).type(typed.capture());
            order.verify(element).press("Backspace");
            order.verify(element).type("a");
            assertTrue(List.of("s", "q").contains(typed.getValue()), "unexpected typo " + typed.getValue());
        }

        @Test
        @DisplayName("typo keeps the case of the intended character")
        void type_mistake_preserves_case() {
            //Arrange
            TypingConfig config = TypingConfig.defaults().withMistakeProbability(1.0);
            TypingSimulator simulator = new TypingSimulator(config, new Random(4), sleeper);
            ArgumentCaptor<String> typed = ArgumentCaptor.forClass(String.class);
            //Act
            simulator.type(element, "A");
            //Assert
            verify(element, times(2)).type(typed.capture());
            assertTrue(List.of("S", "Q").contains(typed.getAllValues().get(0)));
            assertEquals("A", typed.getAllValues().get(1));
        }

        @Test
        @DisplayName("never makes a mistake on separators")
        void type_no_mistake_on_separator() {
            //Arrange
            TypingConfig config = TypingConfig.defaults().withMistakeProbability(1.0);
            TypingSimulator simulator = new TypingSimulator(config, new Random(1), sleeper);
            //Act
            simulator.type(element, ";");
            //Assert
            verify(element).type(";");
            verify(element, never()).press(anyString());
        }
    }

    @Nested
    @DisplayName("fill")
    class Fill {

        @Test
        @DisplayName("clears the field before typing")
        void fill_clears_first() {
            //Arrange
            TypingConfig config = TypingConfig.defaults().withMistakeProbability(0.0);
            TypingSimulator simulator = new TypingSimulator(config, new Random(1), sleeper);
            //Act
            simulator.fill(element, "x");
            //Assert
            InOrder order = inOrder(element, sleeper);
            order.verify(element).fill("");
            order.verify(sleeper).sleep(Duration.ofMillis(100));
            order.verify(element).type("x");
        }
    }

    @Nested
    @DisplayName("delays and typos")
    class Internals {

        @Test
        @DisplayName("plain letter delay stays within the speed range plus jitter")
        void char_delay_within_speed_range() {
            //Arrange
            TypingConfig config = new TypingConfig(2.0, 6.0, 0.0, MsRange.of(100, 300), 1.5, 0.0, 5);
            TypingSimulator simulator = new TypingSimulator(config, new Random(8), sleeper);
            //Act + Assert
            for (int i = 0; i < 200; i++) {
                double d = simulator.charDelaySeconds('a');
                assertTrue(d >= (1.0 / 6.0) * 0.8 - 1e-9 && d <= 0.5 * 1.2 + 1e-9, "out of range: " + d);
            }
        }

        @Test
        @DisplayName("unknown character -> random lowercase letter")
        void mistake_for_unknown_char() {
            //Arrange
            TypingSimulator simulator = new TypingSimulator(TypingConfig.defaults(), new Random(6), sleeper);
            //Act
            char wrong = simulator.mistakeFor('ñ');
            //Assert
            assertTrue(wrong >= 'a' && wrong <= 'z');
        }
    }
}
