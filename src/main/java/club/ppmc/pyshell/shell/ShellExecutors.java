/**
 * ShellExecutors.java
 *
 * 会话使用的线程资源。
 * 读取管道的阻塞任务运行在共享的守护线程池上；每个会话另有一个单线程事件循环，
 * 所有事件分发与生命周期状态变更都在该线程上串行执行。事件循环空闲一秒后线程自动退出，无需显式关闭。
 */
package club.ppmc.pyshell.shell;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

final class ShellExecutors {

    static final ExecutorService STREAM_READERS = Executors.newCachedThreadPool(daemonThreads("pyshell-reader-"));

    private ShellExecutors() {}

    static ExecutorService newEventLoop(String name) {
        var executor = new ThreadPoolExecutor(
                1, 1, 1, TimeUnit.SECONDS, new LinkedBlockingQueue<>(), daemonThreads(name + "-"));
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
