/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.chainkernel.metrics;

/**
 * Metric names emitted by the kernel.
 */
public final class KernelMetrics {

    private KernelMetrics() {}

    public static final String RECORDS = "chainkernel_records_total";
    public static final String DECODE_FAILURES = "chainkernel_decode_failures_total";
    public static final String DEDUP_HITS = "chainkernel_dedup_hits_total";
    public static final String EVENTS_PUBLISHED = "chainkernel_events_published_total";
    public static final String PUBLISH_RETRIES = "chainkernel_publish_retries_total";
    public static final String WORKER_RESTARTS = "chainkernel_worker_restarts_total";
    public static final String CACHE_ERRORS = "chainkernel_cache_errors_total";
    public static final String DEDUP_MARKS_DROPPED = "chainkernel_dedup_marks_dropped_total";
    public static final String CONFIG_ERRORS = "chainkernel_config_errors_total";
    public static final String CHECKPOINTS = "chainkernel_checkpoints_total";

    public static final String PUBLISHER_BUFFERED = "chainkernel_publisher_buffered";
    public static final String WORKERS_RUNNING = "chainkernel_workers_running";
    public static final String WORKERS = "chainkernel_workers";

    public static final String TAG_SOURCE = "source";
    public static final String TAG_STATUS = "status";
}
