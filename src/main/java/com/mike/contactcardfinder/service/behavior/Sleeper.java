package com.mike.contactcardfinder.service.behavior;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration);
}
