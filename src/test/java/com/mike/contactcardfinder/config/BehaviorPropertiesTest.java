package com.mike.contactcardfinder.config;

import com.mike.contactcardfinder.exception.ConfigInvalidException;
import com.mike.contactcardfinder.service.behavior.DelayCategory;
import com.mike.contactcardfinder.service.behavior.DelayConfig;
import com.mike.contactcardfinder.service.behavior.MsRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BehaviorPropertiesTest {

    @Test
    @DisplayName("bound values flow into the delay ranges")
    void delay_ranges() {
        //Arrange
        BehaviorProperties props = new BehaviorProperties();
        props.getDelay().setAfterClickMinMs(100);
        props.getDelay().setAfterClickMaxMs(200);
        //Act
        DelayConfig config = props.toDelayConfig();
        //Assert
        assertEquals(new MsRange(100, 200), config.rangeFor(DelayCategory.AFTER_CLICK));
        assertEquals(new MsRange(3000, 8000), config.rangeFor(DelayCategory.BETWEEN_RECORDS));
    }

    @Test
    @DisplayName("max below min -> ConfigInvalidException")
    void inverted_range() {
        //Arrange
        BehaviorProperties props = new BehaviorProperties();
        props.getDelay().setCardLoadMinMs(3000);
        props.getDelay().setCardLoadMaxMs(1000);
        //Act + Assert
        assertThrows(ConfigInvalidException.class, props::toDelayConfig);
    }

    @Test
    @DisplayName("probability outside [0,1] -> ConfigInvalidException")
    void bad_probability() {
        //Arrange
        BehaviorProperties props = new BehaviorProperties();
        props.getMouse().setOvershootChance(1.5);
        props.getTyping().setMistakeProbability(-0.1);
        //Act + Assert
        assertThrows(ConfigInvalidException.class, props::toMouseConfig);
        assertThrows(ConfigInvalidException.class, props::toTypingConfig);
    }
}
