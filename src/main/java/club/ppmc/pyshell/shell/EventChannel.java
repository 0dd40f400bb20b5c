/**
 * EventChannel.java
 *
 * 单一事件类型的发布通道，只在会话事件线程上访问。
 * 在第一个订阅者出现之前发布的事件会被暂存，订阅时按顺序补发，
 * 因此在构造会话之后才注册的监听器也不会丢失早到的记录。
 * 暂存队列有上限，超出时丢弃最早的事件；调用 stopBuffering() 后清空队列，且不再暂存。
 */
package club.ppmc.pyshell.shell;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

@Slf4j
class EventChannel<T> {

    static final int DEFAULT_BACKLOG_LIMIT = 10_000;

    private final String name;
    private final int backlogLimit;
    private final List<Consumer<T>> subscribers = new ArrayList<>();
    private final Deque<T> backlog = new ArrayDeque<>();

    private boolean buffering = true;
    private boolean overflowLogged;

    EventChannel(String name) {
        this(name, DEFAULT_BACKLOG_LIMIT);
    }

    EventChannel(String name, int backlogLimit) {
        if (backlogLimit <= 0) {
            throw new IllegalArgumentException("暂存上限必须大于0");
        }
        this.name = name;
        this.backlogLimit = backlogLimit;
    }

    void subscribe(Consumer<T> subscriber) {
        subscribers.add(subscriber);
        while (!backlog.isEmpty()) {
            deliver(subscriber, backlog.poll());
        }
    }

    void publish(T event) {
        if (subscribers.isEmpty()) {
            if (buffering) {
                buffer(event);
            }
            return;
        }
        for (Consumer<T> subscriber : subscribers) {
            deliver(subscriber, event);
        }
    }

    /**
     * 丢弃暂存的事件，之后没有订阅者时发布的事件直接丢弃。
     */
    void stopBuffering() {
        buffering = false;
        if (!backlog.isEmpty()) {
            log.debug("{} 通道没有订阅者，丢弃 {} 个暂存事件", name, backlog.size());
            backlog.clear();
        }
    }

    boolean hasSubscribers() {
        return !subscribers.isEmpty();
    }

    int backlogSize() {
        return backlog.size();
    }

    private void buffer(T event) {
        if (backlog.size() >= backlogLimit) {
            backlog.poll();
            if (!overflowLogged) {
                overflowLogged = true;
                log.warn("{} 通道没有订阅者且暂存事件超过 {} 个，开始丢弃最早的事件", name, backlogLimit);
            }
        }
        backlog.add(event);
    }

    private void deliver(Consumer<T> subscriber, T event) {
        try {
            subscriber.accept(event);
        } catch (RuntimeException e) {
            log.error("{} 事件的监听器抛出异常，已忽略该监听器本次调用", name, e);
        }
    }
}
