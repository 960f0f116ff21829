/*
 * Copyright 2024 The MacGate Authors. All Rights Reserved
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package macgate.util;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

public class ThreadPool extends ThreadPoolExecutor {
    private final static Logger logger = LogManager.getLogger(ThreadPool.class);
    private final static ExecutorService executorService;

    static {
        executorService = new ThreadPool();
    }

    /**
     * Run a task on the shared pool.
     * <p/>
     * The thread is renamed for the duration of the task and any exception that escapes the task
     * is logged instead of disappearing into the returned future.
     *
     * @param runnable The task.
     * @param name The base thread name.
     * @param postPend A short identifier for what the thread is working on.
     * @return A future that can be used to cancel the task.
     */
    public static Future<?> submit(final Runnable runnable, final String name, final String postPend) {
        return executorService.submit(new Runnable() {
            @Override
            public void run() {
                Thread thread = Thread.currentThread();
                String oldName = thread.getName();
                try {
                    thread.setName(name + "-" + thread.getId() + ":" + postPend);
                    runnable.run();
                } catch (Throwable e) {
                    logger.error("Thread threw unhandled exception => ", e);
                } finally {
                    thread.setName(oldName);
                }
            }
        });
    }

    /**
     * Creates a thread factory producing daemon threads named <i>name-number</i>.
     */
    public static ThreadFactory namedFactory(final String name) {
        return new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r, name + "-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            }
        };
    }

    public ThreadPool() {
        super(0, Integer.MAX_VALUE, 60L, TimeUnit.SECONDS, new SynchronousQueue<Runnable>(),
                namedFactory("MacGatePool"));
    }
}
