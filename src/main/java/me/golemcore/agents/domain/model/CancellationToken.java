package me.golemcore.agents.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal shared by a turn, its provider call and its
 * tool invocations. Cancelling a token cancels every child created from it.
 * Cancellation is one-way and idempotent.
 */
@Slf4j
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * Creates a token that is cancelled whenever this one is.
     */
    public CancellationToken child() {
        CancellationToken child = new CancellationToken();
        onCancel(child::cancel);
        return child;
    }

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        for (Runnable callback : callbacks) {
            // Whoever removes the callback runs it, so it runs once.
            if (!callbacks.remove(callback)) {
                continue;
            }
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.warn("[Cancel] callback failed: {}", e.getMessage());
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Registers a callback run on cancellation, or immediately if the token is
     * already cancelled.
     */
    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get() && callbacks.remove(callback)) {
            callback.run();
        }
    }
}
