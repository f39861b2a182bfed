/*
 * JBoss, Home of Professional Open Source.
 * Copyright 2017 Red Hat, Inc., and individual contributors
 * as indicated by the @author tags.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package io.elasticpool;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import io.smallrye.common.constraint.Assert;

/**
 * A queued unit of work together with its result handle.  The callable is bound, with its arguments, when the task
 * is submitted; the task is then owned by the task queue until exactly one worker claims and runs it.
 *
 * @param <T> the result type
 */
final class PoolTask<T> implements Runnable, TaskFuture<T> {
    private final Callable<T> callable;
    // all protected by this...
    private boolean claimed;
    private Status status;
    private Object result;
    private List<Reg<?>> listeners;

    private final class Reg<A> implements Runnable {
        private final Listener<? super T, A> listener;
        private final A attachment;

        private Reg(final Listener<? super T, A> listener, final A attachment) {
            this.listener = listener;
            this.attachment = attachment;
        }

        public void run() {
            switch (getStatus()) {
                case ABANDONED: listener.handleAbandoned(PoolTask.this, attachment); break;
                case COMPLETE: listener.handleComplete(PoolTask.this, attachment); break;
                case FAILED: listener.handleFailed(PoolTask.this, (Throwable) result, attachment);
            }
        }

        public String toString() {
            return listener.toString();
        }
    }

    PoolTask(final Callable<T> callable) {
        Assert.checkNotNullParam("callable", callable);
        this.callable = callable;
        status = Status.WAITING;
    }

    /**
     * Run the bound callable and resolve this handle with its outcome.  A throwable raised by the callable is
     * captured, never propagated to the calling worker.  Calls after the first one do nothing.
     */
    public void run() {
        synchronized (this) {
            if (claimed || status != Status.WAITING) {
                return;
            }
            claimed = true;
        }
        final T value;
        try {
            value = callable.call();
        } catch (Throwable t) {
            setFailed(t);
            return;
        }
        setResult(value);
    }

    /**
     * Resolve this handle as abandoned, unless a worker already claimed the task.
     *
     * @return {@code true} if the task was abandoned, {@code false} if it was claimed or resolved already
     */
    boolean abandon() {
        List<Reg<?>> list;
        synchronized (this) {
            if (claimed || status != Status.WAITING) {
                return false;
            }
            status = Status.ABANDONED;
            notifyAll();
            list = listeners;
            listeners = null;
        }
        notifyListeners(list);
        return true;
    }

    private void setResult(final T result) {
        List<Reg<?>> list;
        synchronized (this) {
            this.result = result;
            status = Status.COMPLETE;
            notifyAll();
            list = listeners;
            listeners = null;
        }
        notifyListeners(list);
    }

    private void setFailed(final Throwable cause) {
        List<Reg<?>> list;
        synchronized (this) {
            result = cause;
            status = Status.FAILED;
            notifyAll();
            list = listeners;
            listeners = null;
        }
        notifyListeners(list);
    }

    private void notifyListeners(final List<Reg<?>> list) {
        if (list != null) for (Reg<?> reg : list) {
            safeNotify(reg);
        }
    }

    private void safeNotify(final Reg<?> reg) {
        try {
            reg.run();
        } catch (Throwable t) {
            Messages.msg.listenerFailed(t, reg);
        }
    }

    public Status await() throws InterruptedException {
        synchronized (this) {
            while (status == Status.WAITING) {
                wait();
            }
            return status;
        }
    }

    public Status await(final long timeout, final TimeUnit unit) throws InterruptedException {
        long remaining = unit.toNanos(timeout);
        long now = System.nanoTime();
        Status status;
        synchronized (this) {
            for (;;) {
                status = this.status;
                if (remaining <= 0L || status != Status.WAITING) {
                    return status;
                }
                wait(remaining / 1_000_000L, (int) (remaining % 1_000_000));
                remaining -= -now + (now = System.nanoTime());
            }
        }
    }

    public Status awaitUninterruptibly() {
        synchronized (this) {
            boolean intr = Thread.interrupted();
            try {
                while (status == Status.WAITING) try {
                    wait();
                } catch (InterruptedException e) {
                    intr = true;
                }
            } finally {
                if (intr) {
                    Thread.currentThread().interrupt();
                }
            }
            return status;
        }
    }

    Status awaitUninterruptibly(final long timeout, final TimeUnit unit) {
        long remaining = unit.toNanos(timeout);
        long now = System.nanoTime();
        Status status;
        boolean intr = Thread.interrupted();
        try {
            synchronized (this) {
                for (;;) {
                    status = this.status;
                    if (remaining <= 0L || status != Status.WAITING) {
                        return status;
                    }
                    try {
                        wait(remaining / 1_000_000L, (int) (remaining % 1_000_000));
                    } catch (InterruptedException e) {
                        intr = true;
                    }
                    remaining -= -now + (now = System.nanoTime());
                }
            }
        } finally {
            if (intr) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public T get() throws InterruptedException, ExecutionException {
        synchronized (this) {
            return resultOf(await());
        }
    }

    public T get(final long timeout, final TimeUnit unit) throws InterruptedException, ExecutionException, TimeoutException {
        synchronized (this) {
            final Status status = await(timeout, unit);
            if (status == Status.WAITING) {
                throw Messages.msg.operationTimedOut();
            }
            return resultOf(status);
        }
    }

    public T getUninterruptibly() throws CancellationException, ExecutionException {
        synchronized (this) {
            return resultOf(awaitUninterruptibly());
        }
    }

    public T getUninterruptibly(final long timeout, final TimeUnit unit) throws CancellationException, ExecutionException, TimeoutException {
        synchronized (this) {
            final Status status = awaitUninterruptibly(timeout, unit);
            if (status == Status.WAITING) {
                throw Messages.msg.operationTimedOut();
            }
            return resultOf(status);
        }
    }

    @SuppressWarnings("unchecked")
    private T resultOf(final Status status) throws ExecutionException {
        assert Thread.holdsLock(this);
        switch (status) {
            case ABANDONED:
                throw Messages.msg.taskAbandoned();
            case FAILED:
                throw Messages.msg.taskFailed((Throwable) result);
            case COMPLETE:
                return (T) result;
            default:
                throw Assert.impossibleSwitchCase(status);
        }
    }

    public Status getStatus() {
        synchronized (this) {
            return status;
        }
    }

    public <A> void addListener(final Listener<? super T, A> listener, final A attachment) {
        Assert.checkNotNullParam("listener", listener);
        final Reg<A> reg = new Reg<A>(listener, attachment);
        synchronized (this) {
            if (status == Status.WAITING) {
                if (listeners == null) {
                    listeners = new ArrayList<Reg<?>>();
                }
                listeners.add(reg);
                return;
            }
        }
        safeNotify(reg);
    }

    public boolean cancel(final boolean mayInterruptIfRunning) {
        return false;
    }

    public boolean isCancelled() {
        return getStatus() == Status.ABANDONED;
    }

    public boolean isDone() {
        return getStatus() != Status.WAITING;
    }

    public String toString() {
        return String.format("%s[%s]", super.toString(), getStatus());
    }
}
