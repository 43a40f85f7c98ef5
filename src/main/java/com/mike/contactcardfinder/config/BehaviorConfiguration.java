package com.mike.contactcardfinder.config;

import com.mike.contactcardfinder.service.behavior.DelayConfig;
import com.mike.contactcardfinder.service.behavior.DelayManager;
import com.mike.contactcardfinder.service.behavior.IdentityConfig;
import com.mike.contactcardfinder.service.behavior.IdentityRotator;
import com.mike.contactcardfinder.service.behavior.MouseConfig;
import com.mike.contactcardfinder.service.behavior.MouseEmulator;
import com.mike.contactcardfinder.service.behavior.Sleeper;
import com.mike.contactcardfinder.service.behavior.TypingConfig;
import com.mike.contactcardfinder.service.behavior.TypingSimulator;
import com.mike.contactcardfinder.service.cardextractor.ExtractionRules;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

/**
 * Builds the immutable policy records from the bound properties and wires the behavior components.
 */
@Configuration
public class BehaviorConfiguration {

    @Bean
    public Random behaviorRandom() {
        return new Random();
    }

    @Bean
    public DelayConfig delayConfig(BehaviorProperties props) {
        return props.toDelayConfig();
    }

    @Bean
    public MouseConfig mouseConfig(BehaviorProperties props) {
        return props.toMouseConfig();
    }

    @Bean
    public TypingConfig typingConfig(BehaviorProperties props) {
        return props.toTypingConfig();
    }

    @Bean
    public IdentityConfig identityConfig(BehaviorProperties props) {
        return props.toIdentityConfig();
    }

    @Bean
    public ExtractionRules extractionRules(ExtractionProperties props) {
        return props.toRules();
    }

    @Bean
    public DelayManager delayManager(DelayConfig config, Random behaviorRandom, Sleeper sleeper) {
        return new DelayManager(config, behaviorRandom, sleeper);
    }

    @Bean
    public MouseEmulator mouseEmulator(MouseConfig config, Random behaviorRandom, Sleeper sleeper) {
        return new MouseEmulator(config, behaviorRandom, sleeper);
    }

    @Bean
    public TypingSimulator typingSimulator(TypingConfig config, Random behaviorRandom, Sleeper sleeper) {
        return new TypingSimulator(config, behaviorRandom, sleeper);
    }

    @Bean
    public IdentityRotator identityRotator(IdentityConfig config, Random behaviorRandom) {
        return new IdentityRotator(config, behaviorRandom);
    }
}
