package com.corpusindex.pipeline;

import com.corpusindex.config.Constants;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * 有界阻塞通道。send 在满时阻塞、receive 在空时阻塞；
 * 两者按固定间隔检查致命错误槽，一旦出现致命错误立即放弃等待。
 *
 * @param <T> 消息类型
 */
public final class BoundedChannel<T> {
    private final String name;
    private final BlockingQueue<T> queue;
    private final FatalErrorSlot cancellation;
    private final long pollMillis;

    public BoundedChannel(String name, int capacity, FatalErrorSlot cancellation) {
        this(name, capacity, cancellation, Constants.CHANNEL_POLL_MILLIS);
    }

    BoundedChannel(String name, int capacity, FatalErrorSlot cancellation, long pollMillis) {
        if (capacity < 1) {
            throw new IllegalArgumentException("通道容量必须 >= 1: " + capacity);
        }
        if (cancellation == null) {
            throw new IllegalArgumentException("cancellation 不能为空");
        }
        this.name = name;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.cancellation = cancellation;
        this.pollMillis = pollMillis;
    }

    /**
     * 发送消息，通道满时阻塞。
     *
     * @return 成功入队返回 true；出现致命错误或线程被中断时返回 false
     */
    public boolean send(T message) {
        if (message == null) {
            throw new IllegalArgumentException("通道 " + name + " 不接受 null 消息");
        }
        try {
            while (!cancellation.isSet()) {
                if (queue.offer(message, pollMillis, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
            return false;
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * 接收消息，通道空时阻塞。
     *
     * @return 下一条消息；出现致命错误或线程被中断时返回 null
     */
    public T receive() {
        try {
            while (!cancellation.isSet()) {
                T message = queue.poll(pollMillis, TimeUnit.MILLISECONDS);
                if (message != null) {
                    return message;
                }
            }
            return null;
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    public int size() {
        return queue.size();
    }

    public String name() {
        return name;
    }
}
