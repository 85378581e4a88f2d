package com.vulnharvest.core.util;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** 테스트용 Sleeper: 실제로 자지 않고 호출만 기록 (스레드 세이프) */
public final class RecordingSleeper implements Sleeper {
    public final List<Duration> sleeps = new CopyOnWriteArrayList<>();

    @Override
    public void sleep(Duration d) {
        sleeps.add(d == null ? Duration.ZERO : d);
    }

    public long count(Duration d) {
        return sleeps.stream().filter(d::equals).count();
    }
}
