package com.agenteval.experiment.domain;

import java.util.List;

/**
 * Distribution of latest run cases over their statuses for one experiment.
 */
public record StatusCounts(long total, long pending, long running, long success, long failed) {

    public static final StatusCounts EMPTY = new StatusCounts(0, 0, 0, 0, 0);

    public static StatusCounts from(List<StatusCount> rows) {
        long pending = 0;
        long running = 0;
        long success = 0;
        long failed = 0;
        long total = 0;
        for (StatusCount row : rows) {
            long count = row.total() == null ? 0 : row.total();
            total += count;
            switch (row.status()) {
                case PENDING -> pending += count;
                case RUNNING -> running += count;
                case SUCCESS -> success += count;
                case FAILED -> failed += count;
            }
        }
        return new StatusCounts(total, pending, running, success, failed);
    }
}
