package com.vulnharvest.core.util;

import java.time.Duration;

/** 대기 추상화: 페이싱/백오프 지연을 테스트에서 기록·생략할 수 있게 분리 */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;
}
