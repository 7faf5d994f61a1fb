package com.eyelevel.jobrelay.service.poll;

import java.time.Duration;

/**
 * Pauses the polling thread between status reads.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;
}
