package com.vbot.core.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs inbound events on a fixed set of single-threaded lanes. All events of one chat share
 * a lane, so they start in transport order; different chats proceed independently.
 */
public class ChatDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(ChatDispatcher.class);

    private final ExecutorService[] lanes;

    public ChatDispatcher(int laneCount) {
        this.lanes = new ExecutorService[Math.max(1, laneCount)];
        for (int i = 0; i < lanes.length; i++) {
            String name = "dispatch-" + i;
            lanes[i] = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, name);
                t.setDaemon(true);
                return t;
            });
        }
    }

    public void submit(long chatId, Runnable task) {
        int lane = Math.floorMod(Long.hashCode(chatId), lanes.length);
        lanes[lane].execute(() -> {
            try {
                task.run();
            } catch (RuntimeException | LinkageError e) {
                logger.error("Unhandled error while dispatching for chat {}", chatId, e);
            }
        });
    }

    public int getLaneCount() {
        return lanes.length;
    }

    public void shutdown() {
        for (ExecutorService lane : lanes) {
            lane.shutdown();
        }
        for (ExecutorService lane : lanes) {
            try {
                if (!lane.awaitTermination(5, TimeUnit.SECONDS))
                    lane.shutdownNow();
            } catch (InterruptedException e) {
                lane.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}
