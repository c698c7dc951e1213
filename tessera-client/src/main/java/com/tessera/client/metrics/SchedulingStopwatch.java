/*
 * Copyright (c) 2023-2025 Burak Sezer
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.tessera.client.metrics;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;

import java.time.Duration;

/**
 * Measures the scheduling of a query across all of its attempts.
 * <p>
 * {@link #ready()} marks the query as schedulable; each attempt is bracketed by {@link #start()} and
 * {@link #stop()}. Time between attempts counts as waiting time.
 */
public class SchedulingStopwatch {
    private final Stopwatch turnaroundTime;
    private final Stopwatch responseTime;
    private final Stopwatch runTime;
    private boolean responded;
    private long numPreemptions;

    public SchedulingStopwatch() {
        this(Ticker.systemTicker());
    }

    public SchedulingStopwatch(Ticker ticker) {
        this.turnaroundTime = Stopwatch.createUnstarted(ticker);
        this.responseTime = Stopwatch.createUnstarted(ticker);
        this.runTime = Stopwatch.createUnstarted(ticker);
    }

    public void ready() {
        if (!turnaroundTime.isRunning() && !responded) {
            turnaroundTime.start();
            responseTime.start();
        }
    }

    public void start() {
        if (runTime.isRunning()) {
            return;
        }
        if (!responded) {
            if (responseTime.isRunning()) {
                responseTime.stop();
            }
            responded = true;
        }
        runTime.start();
    }

    public void stop() {
        if (runTime.isRunning()) {
            runTime.stop();
            numPreemptions++;
        }
    }

    public SchedulingTimeSpan getElapsedTime() {
        Duration turnaround = turnaroundTime.elapsed();
        Duration run = runTime.elapsed();
        return new SchedulingTimeSpan(turnaround, responseTime.elapsed(), run, turnaround.minus(run), numPreemptions);
    }
}
