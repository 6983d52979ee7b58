package org.filexfer.server;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

//потоки клиентов, запущенные циклом accept; трогает только поток accept, блокировки не нужны
class Workers {
    static final int SWEEP_THRESHOLD = 50;

    private final List<Thread> threads = new ArrayList<>();

    void track(Thread worker) {
        threads.add(worker);
        if (threads.size() > SWEEP_THRESHOLD) {
            sweep();
        }
    }

    //убирает из списка уже завершившиеся потоки
    int sweep() {
        int removed = 0;
        Iterator<Thread> iterator = threads.iterator();
        while (iterator.hasNext()) {
            if (!iterator.next().isAlive()) {
                iterator.remove();
                removed++;
            }
        }
        return removed;
    }

    //ждет завершения всех оставшихся потоков
    void awaitAll() throws InterruptedException {
        for (Thread thread : threads) {
            thread.join();
        }
        threads.clear();
    }

    int size() {
        return threads.size();
    }
}
