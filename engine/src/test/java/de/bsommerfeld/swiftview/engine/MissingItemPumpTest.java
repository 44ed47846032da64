package de.bsommerfeld.swiftview.engine;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class MissingItemPumpTest {

    private final List<List<Path>> batches = new CopyOnWriteArrayList<>();
    private MissingItemPump pump;

    @AfterEach
    void tearDown() {
        if (pump != null)
            pump.close();
    }

    private static List<Path> paths(int count) {
        return IntStream.range(0, count).mapToObj(i -> Path.of("/p/img" + i + ".png")).toList();
    }

    private List<Path> delivered() {
        List<Path> all = new ArrayList<>();
        batches.forEach(all::addAll);
        return all;
    }

    private void awaitDelivered(int count) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (delivered().size() < count && System.currentTimeMillis() < deadline)
            Thread.sleep(10);
        assertEquals(count, delivered().size());
    }

    @Test
    void enqueue_shouldDeliverInBoundedFifoBatches() throws Exception {
        pump = new MissingItemPump(batches::add, 3, 5);
        List<Path> input = paths(10);

        pump.enqueue(input);
        awaitDelivered(10);

        assertEquals(input, delivered());
        assertTrue(batches.stream().allMatch(b -> b.size() <= 3), "batch exceeded limit: " + batches);
        assertTrue(batches.size() >= 4);
        assertEquals(0, pump.pendingCount());
    }

    @Test
    void enqueue_duplicatePaths_shouldDeliverEachOnce() throws Exception {
        pump = new MissingItemPump(batches::add, 8, 5);
        List<Path> input = paths(5);

        pump.enqueue(input);
        pump.enqueue(input);
        awaitDelivered(5);
        Thread.sleep(50);

        assertEquals(input, delivered());
    }

    @Test
    void clear_shouldStartNewSession() throws Exception {
        pump = new MissingItemPump(batches::add, 8, 5);
        List<Path> input = paths(2);

        pump.enqueue(input);
        awaitDelivered(2);
        pump.clear();
        pump.enqueue(input);

        awaitDelivered(4);
    }

    @Test
    void forget_shouldRemoveQueuedPath() throws Exception {
        pump = new MissingItemPump(batches::add, 8, 200);
        List<Path> input = paths(3);

        pump.enqueue(input);
        pump.forget(input.get(1));
        awaitDelivered(2);

        assertEquals(List.of(input.get(0), input.get(2)), delivered());
    }

    @Test
    void sinkFailure_shouldNotStopLaterTicks() throws Exception {
        CountDownLatch secondBatch = new CountDownLatch(1);
        List<Integer> sizes = new CopyOnWriteArrayList<>();
        pump = new MissingItemPump(batch -> {
            sizes.add(batch.size());
            if (sizes.size() == 1)
                throw new IllegalStateException("sink down");
            secondBatch.countDown();
        }, 2, 5);

        pump.enqueue(paths(4));

        assertTrue(secondBatch.await(5, TimeUnit.SECONDS));
        assertEquals(List.of(2, 2), sizes);
    }

    @Test
    void constructor_withZeroBatch_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> new MissingItemPump(batches::add, 0, 5));
    }
}
