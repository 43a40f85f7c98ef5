package com.mike.contactcardfinder.config;

import com.mike.contactcardfinder.service.behavior.DelayCategory;
import com.mike.contactcardfinder.service.behavior.DelayConfig;
import com.mike.contactcardfinder.service.behavior.IdentityConfig;
import com.mike.contactcardfinder.service.behavior.MouseConfig;
import com.mike.contactcardfinder.service.behavior.MsRange;
import com.mike.contactcardfinder.service.behavior.TypingConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumMap;
import java.util.Map;

/**
 * Binding side of the behavior policies. Components never see this class, only the records built from it.
 */
@Data
@ConfigurationProperties(prefix = "contactfinder.behavior")
public class BehaviorProperties {

    private Delay delay = new Delay();
    private Mouse mouse = new Mouse();
    private Typing typing = new Typing();
    private Identity identity = new Identity();

    @Data
    public static class Delay {
        private int betweenActionsMinMs = 500;
        private int betweenActionsMaxMs = 2000;
        private int betweenRecordsMinMs = 3000;
        private int betweenRecordsMaxMs = 8000;
        private int afterTypingMinMs = 200;
        private int afterTypingMaxMs = 800;
        private int afterClickMinMs = 800;
        private int afterClickMaxMs = 1500;
        private int afterCardCloseMinMs = 1000;
        private int afterCardCloseMaxMs = 2000;
        private int cardLoadMinMs = 1500;
        private int cardLoadMaxMs = 2500;
    }

    @Data
    public static class Mouse {
        private boolean bezierCurves = true;
        private int randomOffsetPx = 10;
        private int moveDurationMinMs = 500;
        private int moveDurationMaxMs = 1500;
        private double overshootChance = 0.15;
        private int pauseBeforeClickMinMs = 50;
        private int pauseBeforeClickMaxMs = 150;
    }

    @Data
    public static class Typing {
        private double minCharsPerSecond = 2.0;
        private double maxCharsPerSecond = 6.0;
        private double mistakeProbability = 0.02;
        private int correctionDelayMinMs = 100;
        private int correctionDelayMaxMs = 300;
        private double betweenWordsFactor = 1.5;
        private double burstChance = 0.3;
        private int burstLength = 5;
    }

    @Data
    public static class Identity {
        private boolean rotate = true;
        private int poolSize = 10;

        /** windows, mac or linux; anything else keeps the whole pool */
        private String preferPlatform;
    }

    public DelayConfig toDelayConfig() {
        Map<DelayCategory, MsRange> ranges = new EnumMap<>(DelayCategory.class);
        ranges.put(DelayCategory.BETWEEN_ACTIONS, new MsRange(delay.betweenActionsMinMs, delay.betweenActionsMaxMs));
        ranges.put(DelayCategory.BETWEEN_RECORDS, new MsRange(delay.betweenRecordsMinMs, delay.betweenRecordsMaxMs));
        ranges.put(DelayCategory.AFTER_TYPING, new MsRange(delay.afterTypingMinMs, delay.afterTypingMaxMs));
        ranges.put(DelayCategory.AFTER_CLICK, new MsRange(delay.afterClickMinMs, delay.afterClickMaxMs));
        ranges.put(DelayCategory.AFTER_CARD_CLOSE, new MsRange(delay.afterCardCloseMinMs, delay.afterCardCloseMaxMs));
        ranges.put(DelayCategory.CARD_LOAD, new MsRange(delay.cardLoadMinMs, delay.cardLoadMaxMs));
        return new DelayConfig(ranges);
    }

    public MouseConfig toMouseConfig() {
        return new MouseConfig(
                mouse.bezierCurves,
                mouse.randomOffsetPx,
                new MsRange(mouse.moveDurationMinMs, mouse.moveDurationMaxMs),
                mouse.overshootChance,
                new MsRange(mouse.pauseBeforeClickMinMs, mouse.pauseBeforeClickMaxMs)
        );
    }

    public TypingConfig toTypingConfig() {
        return new TypingConfig(
                typing.minCharsPerSecond,
                typing.maxCharsPerSecond,
                typing.mistakeProbability,
                new MsRange(typing.correctionDelayMinMs, typing.correctionDelayMaxMs),
                typing.betweenWordsFactor,
                typing.burstChance,
                typing.burstLength
        );
    }

    public IdentityConfig toIdentityConfig() {
        return new IdentityConfig(identity.rotate, identity.poolSize, identity.preferPlatform);
    }
}
