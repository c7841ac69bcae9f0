package com.opencrawl.crawl.service;

import java.time.Duration;

@FunctionalInterface
interface Sleeper {
    Sleeper THREAD = delay -> Thread.sleep(delay.toMillis());

    void sleep(Duration delay) throws InterruptedException;
}
