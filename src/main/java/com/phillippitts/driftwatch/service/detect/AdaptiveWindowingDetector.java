package com.phillippitts.driftwatch.service.detect;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * ADWIN adaptive windowing change detector (Bifet &amp; Gavalda, 2007).
 *
 * <p>Keeps a variable-length window of recent values compressed into an exponential histogram:
 * row {@code i} holds buckets of {@code 2^i} values, at most {@code maxBuckets} per row before the
 * two oldest are merged into the next row. Every {@code clock} values the window is split at each
 * bucket boundary; if the means of the older and newer parts differ by more than a Hoeffding-style
 * bound derived from {@code delta} and the window variance, the oldest bucket is dropped and a
 * change is flagged. Insertion is amortized O(1), the cut test O(log n).
 *
 * <p>No assumption is made about the value distribution. Because the window shrinks to the new
 * regime after a cut, values deep inside a sustained shift are reported as unchanged.
 *
 * <p>Not thread-safe: confined to the monitor control thread.
 */
public final class AdaptiveWindowingDetector implements ChangeDetector {

    private final double delta;
    private final int clock;
    private final int maxBuckets;
    private final int minWindowLength;
    private final int gracePeriod;

    /** rows.get(i): buckets of 2^i values, newest first. */
    private final List<Deque<Bucket>> rows = new ArrayList<>();

    private long width = 0;
    private double total = 0.0;
    private double variance = 0.0;
    private long tick = 0;
    private long detections = 0;
    private boolean changeDetected = false;

    public AdaptiveWindowingDetector(double delta) {
        this(delta, 32, 5, 5, 10);
    }

    public AdaptiveWindowingDetector(double delta, int clock, int maxBuckets, int minWindowLength, int gracePeriod) {
        if (!(delta > 0.0 && delta < 1.0)) {
            throw new IllegalArgumentException("delta must be in (0, 1), got: " + delta);
        }
        if (clock <= 0 || maxBuckets <= 0 || minWindowLength <= 0 || gracePeriod <= 0) {
            throw new IllegalArgumentException("clock, maxBuckets, minWindowLength and gracePeriod must be positive");
        }
        this.delta = delta;
        this.clock = clock;
        this.maxBuckets = maxBuckets;
        this.minWindowLength = minWindowLength;
        this.gracePeriod = gracePeriod;
        rows.add(new ArrayDeque<>());
    }

    @Override
    public boolean observe(double value) {
        tick++;
        insert(value);
        changeDetected = tick % clock == 0 && width > gracePeriod && detectChange();
        if (changeDetected) {
            detections++;
        }
        return changeDetected;
    }

    @Override
    public boolean isChangeDetected() {
        return changeDetected;
    }

    @Override
    public long width() {
        return width;
    }

    public double mean() {
        return width == 0 ? 0.0 : total / width;
    }

    public double variance() {
        return width == 0 ? 0.0 : variance / width;
    }

    public long detections() {
        return detections;
    }

    private void insert(double value) {
        if (width > 0) {
            double priorMean = total / width;
            variance += width * (value - priorMean) * (value - priorMean) / (width + 1);
        }
        width++;
        total += value;
        rows.get(0).addFirst(new Bucket(value, 0.0, 1));
        compress();
    }

    private void compress() {
        for (int i = 0; i < rows.size(); i++) {
            Deque<Bucket> row = rows.get(i);
            if (row.size() <= maxBuckets) {
                break;
            }
            Bucket older = row.pollLast();
            Bucket newer = row.pollLast();
            if (i + 1 == rows.size()) {
                rows.add(new ArrayDeque<>());
            }
            rows.get(i + 1).addFirst(older.merge(newer));
        }
    }

    private boolean detectChange() {
        boolean changed = false;
        boolean reduceWidth = true;
        while (reduceWidth) {
            reduceWidth = false;
            long n0 = 0;
            long n1 = width;
            double u0 = 0.0;
            double u1 = total;

            scan:
            for (int i = rows.size() - 1; i >= 0; i--) {
                Iterator<Bucket> oldestFirst = rows.get(i).descendingIterator();
                while (oldestFirst.hasNext()) {
                    Bucket bucket = oldestFirst.next();
                    n0 += bucket.count;
                    n1 -= bucket.count;
                    u0 += bucket.total;
                    u1 -= bucket.total;
                    if (i == 0 && !oldestFirst.hasNext()) {
                        break scan;
                    }
                    if (n0 >= minWindowLength && n1 >= minWindowLength
                            && exceedsBound(n0, n1, u0 / n0 - u1 / n1)) {
                        changed = true;
                        reduceWidth = true;
                        dropOldest();
                        break scan;
                    }
                }
            }
        }
        return changed;
    }

    private boolean exceedsBound(long n0, long n1, double meanDifference) {
        double deltaPrime = Math.log(2.0 * Math.log(width) / delta);
        double harmonic = 1.0 / (n0 - minWindowLength + 1) + 1.0 / (n1 - minWindowLength + 1);
        double windowVariance = variance / width;
        double epsilon = Math.sqrt(2.0 * harmonic * windowVariance * deltaPrime)
                + 2.0 / 3.0 * deltaPrime * harmonic;
        return Math.abs(meanDifference) > epsilon;
    }

    private void dropOldest() {
        int last = rows.size() - 1;
        while (last > 0 && rows.get(last).isEmpty()) {
            rows.remove(last--);
        }
        Bucket oldest = rows.get(last).pollLast();
        if (oldest == null) {
            return;
        }
        width -= oldest.count;
        total -= oldest.total;
        if (width == 0) {
            total = 0.0;
            variance = 0.0;
        } else {
            double oldestMean = oldest.total / oldest.count;
            double remainingMean = total / width;
            double diff = oldestMean - remainingMean;
            variance -= oldest.variance + oldest.count * width * diff * diff / (oldest.count + width);
            if (variance < 0.0) {
                variance = 0.0;
            }
        }
        if (last > 0 && rows.get(last).isEmpty()) {
            rows.remove(last);
        }
    }

    private static final class Bucket {
        final double total;
        final double variance;
        final long count;

        Bucket(double total, double variance, long count) {
            this.total = total;
            this.variance = variance;
            this.count = count;
        }

        Bucket merge(Bucket other) {
            double diff = total / count - other.total / other.count;
            double combined = variance + other.variance + count * other.count * diff * diff / (count + other.count);
            return new Bucket(total + other.total, combined, count + other.count);
        }
    }
}
